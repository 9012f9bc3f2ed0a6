package com.phillippitts.tempokey.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the remote tempo/key estimation service.
 *
 * <p>An empty {@code baseUrl} leaves the adapter unconfigured: every call then fails with
 * {@link com.phillippitts.tempokey.exception.DetectionUnavailableException}.
 */
@Validated
@ConfigurationProperties(prefix = "tempo.detection")
public class DetectionProperties {

    private final String baseUrl;

    @NotNull
    private final Duration timeout;

    @NotNull
    private final Duration streamTimeout;

    /** Static identity token; never logged. */
    private final String bearerToken;

    /** Forwarded on batch submission; the service skips the secondary detector above it. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double maxConfidence;

    @ConstructorBinding
    public DetectionProperties(String baseUrl,
                               Duration timeout,
                               Duration streamTimeout,
                               String bearerToken,
                               Double maxConfidence) {
        this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.streamTimeout = streamTimeout == null ? Duration.ofMinutes(10) : streamTimeout;
        this.bearerToken = bearerToken == null ? "" : bearerToken;
        this.maxConfidence = maxConfidence == null ? 0.65 : maxConfidence;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public boolean isConfigured() {
        return !baseUrl.isEmpty();
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getStreamTimeout() {
        return streamTimeout;
    }

    public String getBearerToken() {
        return bearerToken;
    }

    public double getMaxConfidence() {
        return maxConfidence;
    }

    @Override
    public String toString() {
        return "DetectionProperties{baseUrl=" + baseUrl + ", timeout=" + timeout
                + ", streamTimeout=" + streamTimeout + ", bearerToken=" + (bearerToken.isEmpty() ? "<none>" : "<set>")
                + ", maxConfidence=" + maxConfidence + '}';
    }
}
