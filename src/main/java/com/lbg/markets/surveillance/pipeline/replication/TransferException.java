package com.lbg.markets.surveillance.pipeline.replication;

import java.io.Serial;

/**
 * Replicating an object to the destination store failed or timed out.
 */
public class TransferException extends Exception {
    @Serial
    private static final long serialVersionUID = 1790425531764250983L;

    public TransferException(String message) {
        super(message);
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
