package com.phillippitts.tempokey.exception;

/**
 * Thrown when caller input is missing or malformed. Fails fast and is never cached.
 */
public class InvalidRequestException extends TempoKeyException {

    private final String field;

    public InvalidRequestException(String message) {
        super(message);
        this.field = null;
    }

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    /** @return offending input field, or null when the problem is not field-specific */
    public String getField() {
        return field;
    }
}
