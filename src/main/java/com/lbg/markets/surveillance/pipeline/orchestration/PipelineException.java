package com.lbg.markets.surveillance.pipeline.orchestration;

import java.io.Serial;

/**
 * Base exception for failures of a pipeline run as a whole, as opposed to a single task.
 */
public class PipelineException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6203158471198620934L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
