package com.lbg.markets.surveillance.pipeline.domain;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A file moving through the pipeline.
 * <p>
 * Instances are immutable: each stage hands the next owner a new instance produced by one of
 * the transition methods, so a task is only ever mutated by whoever currently holds it.
 */
public record FileTask(
        String id,
        String name,
        ObjectLocation source,
        ObjectLocation destination,
        Map<String, String> metadata,
        UUID registrationId,
        TaskStatus status,
        TaskFailure failure
) {
    public FileTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(destination, "destination cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        name = name != null && !name.isBlank() ? name : id;
        metadata = metadata != null ? copyMetadata(metadata) : Map.of();
        if ((status == TaskStatus.FAILED) != (failure != null)) {
            throw new IllegalArgumentException("failure must be present exactly when status is FAILED");
        }
    }

    public enum TaskStatus {
        READY,
        TRANSFERRED,
        REGISTERED,
        FAILED;

        public boolean canTransitionTo(TaskStatus next) {
            return switch (this) {
                case READY -> Set.of(TRANSFERRED, FAILED).contains(next);
                case TRANSFERRED -> Set.of(REGISTERED, FAILED).contains(next);
                case REGISTERED, FAILED -> false;
            };
        }
    }

    /**
     * Create a task that has not entered the pipeline yet.
     */
    public static FileTask ready(String id, String name, ObjectLocation source, String destinationBucket,
                                 Map<String, String> metadata) {
        return new FileTask(id, name, source, ObjectLocation.pending(destinationBucket), metadata,
                null, TaskStatus.READY, null);
    }

    /**
     * Replication finished; the destination now carries its key.
     */
    public FileTask transferred(String destinationKey) {
        if (destinationKey == null || destinationKey.isBlank()) {
            throw new IllegalArgumentException("destinationKey cannot be blank");
        }
        requireTransition(TaskStatus.TRANSFERRED);
        return new FileTask(id, name, source, destination.withKey(destinationKey), metadata,
                null, TaskStatus.TRANSFERRED, null);
    }

    /**
     * Metadata registration finished with the given identifier.
     */
    public FileTask registered(UUID newRegistrationId) {
        Objects.requireNonNull(newRegistrationId, "registrationId cannot be null");
        requireTransition(TaskStatus.REGISTERED);
        return new FileTask(id, name, source, destination, metadata,
                newRegistrationId, TaskStatus.REGISTERED, null);
    }

    public FileTask failed(TaskFailure taskFailure) {
        Objects.requireNonNull(taskFailure, "failure cannot be null");
        requireTransition(TaskStatus.FAILED);
        return new FileTask(id, name, source, destination, metadata,
                registrationId, TaskStatus.FAILED, taskFailure);
    }

    public FileTask failed(PipelineStage stage, String cause) {
        return failed(new TaskFailure(stage, cause));
    }

    public boolean isSuccessful() {
        return status == TaskStatus.REGISTERED;
    }

    private void requireTransition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateTransitionException(id, status, next);
        }
    }

    private static Map<String, String> copyMetadata(Map<String, String> metadata) {
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("metadata attribute name cannot be null");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("metadata attribute " + entry.getKey() + " cannot be null");
            }
        }
        return Map.copyOf(metadata);
    }
}
