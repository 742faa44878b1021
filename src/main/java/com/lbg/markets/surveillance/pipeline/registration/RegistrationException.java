package com.lbg.markets.surveillance.pipeline.registration;

import java.io.Serial;

/**
 * Registering file metadata with the remote API failed or timed out.
 */
public class RegistrationException extends Exception {
    @Serial
    private static final long serialVersionUID = -869310952641723105L;

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
