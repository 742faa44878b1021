package com.lbg.markets.surveillance.pipeline.orchestration;

import java.io.Serial;

/**
 * The end-of-stream sequencing between stages was broken. Always fatal for the run.
 */
public class ShutdownProtocolViolationException extends PipelineException {
    @Serial
    private static final long serialVersionUID = -4428153036905562193L;

    public ShutdownProtocolViolationException(String message) {
        super(message);
    }
}
