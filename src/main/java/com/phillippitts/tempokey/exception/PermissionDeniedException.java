package com.phillippitts.tempokey.exception;

/**
 * Thrown when the caller lacks the role an operation requires.
 */
public class PermissionDeniedException extends TempoKeyException {

    private final String requiredRole;

    public PermissionDeniedException(String operation, String requiredRole) {
        super(operation + " requires role " + requiredRole);
        this.requiredRole = requiredRole;
    }

    public String getRequiredRole() {
        return requiredRole;
    }
}
