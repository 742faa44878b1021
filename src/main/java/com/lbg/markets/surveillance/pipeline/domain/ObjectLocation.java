package com.lbg.markets.surveillance.pipeline.domain;

/**
 * Bucket/key pair addressing an object in a store.
 * The key may be empty for a destination that has not been written yet.
 */
public record ObjectLocation(
        String bucket,
        String key
) {
    public ObjectLocation {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket cannot be blank");
        }
        key = key != null ? key : "";
    }

    public static ObjectLocation pending(String bucket) {
        return new ObjectLocation(bucket, "");
    }

    public ObjectLocation withKey(String newKey) {
        return new ObjectLocation(bucket, newKey);
    }

    public boolean hasKey() {
        return !key.isEmpty();
    }

    @Override
    public String toString() {
        return bucket + "/" + key;
    }
}
