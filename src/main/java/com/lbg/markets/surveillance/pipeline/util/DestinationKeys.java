package com.lbg.markets.surveillance.pipeline.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.UUID;

/**
 * Utility for generating and reading destination object keys.
 * Keys have the form {@code yyyy/MM/dd/HH/mm/ss/<uuid>}: the creation time followed by a
 * random UUID. The UUID segment doubles as the file's registration identifier.
 */
public final class DestinationKeys {

    public static final String SEPARATOR = "/";
    public static final int SEGMENT_COUNT = 7;

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd/HH/mm/ss");

    private DestinationKeys() {
        // Utility class
    }

    /**
     * Generate a fresh key stamped with the current time of the given clock.
     */
    public static String generate(Clock clock) {
        return generate(LocalDateTime.now(clock), UUID.randomUUID());
    }

    public static String generate(LocalDateTime createdAt, UUID uniqueId) {
        return TIMESTAMP_FORMAT.format(createdAt) + SEPARATOR + uniqueId;
    }

    /**
     * Extract the unique identifier carried by the last segment of a key.
     */
    public static UUID uniqueId(String destinationKey) {
        String segment = split(destinationKey)[SEGMENT_COUNT - 1];
        UUID parsed;
        try {
            parsed = UUID.fromString(segment);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Destination key does not end with a UUID: " + destinationKey, e);
        }
        // UUID.fromString tolerates short groups; only the canonical form is accepted
        if (!parsed.toString().equals(segment)) {
            throw new IllegalArgumentException("Destination key does not end with a canonical UUID: " + destinationKey);
        }
        return parsed;
    }

    /**
     * Extract the creation timestamp carried by the first six segments of a key.
     */
    public static LocalDateTime createdAt(String destinationKey) {
        String[] segments = split(destinationKey);
        String timestamp = String.join(SEPARATOR, Arrays.copyOf(segments, SEGMENT_COUNT - 1));
        try {
            return LocalDateTime.parse(timestamp, TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Destination key has an invalid timestamp: " + destinationKey, e);
        }
    }

    public static boolean isValid(String destinationKey) {
        try {
            createdAt(destinationKey);
            uniqueId(destinationKey);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String[] split(String destinationKey) {
        if (destinationKey == null || destinationKey.isBlank()) {
            throw new IllegalArgumentException("Destination key cannot be blank");
        }
        String[] segments = destinationKey.split(SEPARATOR, -1);
        if (segments.length != SEGMENT_COUNT) {
            throw new IllegalArgumentException(String.format(
                    "Destination key must have %d segments but has %d: %s",
                    SEGMENT_COUNT, segments.length, destinationKey));
        }
        return segments;
    }
}
