package com.phillippitts.tempokey.exception;

/**
 * Thrown when the tempo/key estimation service fails: non-2xx response, malformed payload,
 * timeout, or missing credentials. Callers may retry later but must never fabricate a result.
 */
public class DetectionUnavailableException extends TempoKeyException {

    private final int statusCode;
    private final boolean retryable;

    public DetectionUnavailableException(String message) {
        this(message, 0, true, null);
    }

    public DetectionUnavailableException(String message, Throwable cause) {
        this(message, 0, true, cause);
    }

    public DetectionUnavailableException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    /** @return upstream HTTP status, or 0 when no response was received */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
