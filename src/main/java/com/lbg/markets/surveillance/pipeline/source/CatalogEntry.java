package com.lbg.markets.surveillance.pipeline.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.ObjectLocation;

import java.util.Map;

/**
 * One file as listed in a task catalog document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogEntry(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("src_bucket") String sourceBucket,
        @JsonProperty("src_key") String sourceKey,
        @JsonProperty("dest_bucket") String destinationBucket,
        @JsonProperty("meta") Map<String, String> metadata
) {
    /**
     * @param defaultDestinationBucket used when the entry names no destination bucket
     */
    public FileTask toTask(String defaultDestinationBucket) {
        String bucket = destinationBucket != null && !destinationBucket.isBlank()
                ? destinationBucket
                : defaultDestinationBucket;
        return FileTask.ready(id, name, new ObjectLocation(sourceBucket, sourceKey), bucket, metadata);
    }
}
