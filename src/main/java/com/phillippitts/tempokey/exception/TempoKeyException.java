package com.phillippitts.tempokey.exception;

/**
 * Base exception for all tempokey application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TempoKeyException extends RuntimeException {

    public TempoKeyException(String message) {
        super(message);
    }

    public TempoKeyException(String message, Throwable cause) {
        super(message, cause);
    }

    public TempoKeyException(Throwable cause) {
        super(cause);
    }
}
