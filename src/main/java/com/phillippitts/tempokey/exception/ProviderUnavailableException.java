package com.phillippitts.tempokey.exception;

/**
 * Thrown when a single preview provider cannot answer (timeout, non-2xx, unreadable payload).
 * The preview resolver records it as a failed candidate and moves on to the next provider.
 */
public class ProviderUnavailableException extends TempoKeyException {

    private final String provider;

    public ProviderUnavailableException(String provider, String message) {
        super(message + " (provider: " + provider + ")");
        this.provider = provider;
    }

    public ProviderUnavailableException(String provider, String message, Throwable cause) {
        super(message + " (provider: " + provider + ")", cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
