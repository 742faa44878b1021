package com.lbg.markets.surveillance.pipeline.domain;

/**
 * Why and where a task left the success path.
 */
public record TaskFailure(
        PipelineStage stage,
        String cause
) {
    public TaskFailure {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        cause = cause != null && !cause.isBlank() ? cause : "unknown";
    }

    public static TaskFailure of(PipelineStage stage, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new TaskFailure(stage, message);
    }
}
