package com.phillippitts.tempokey.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the preview provider chain.
 */
@Validated
@ConfigurationProperties(prefix = "tempo.preview")
public class PreviewProperties {

    /** Upper bound for a single provider attempt; an expired attempt counts as a failed candidate. */
    @NotNull
    private final Duration timeout;

    @Pattern(regexp = "[a-z]{2}")
    private final String defaultCountry;

    @NotBlank
    private final String itunesBaseUrl;

    @NotBlank
    private final String deezerBaseUrl;

    @NotBlank
    private final String userAgent;

    @ConstructorBinding
    public PreviewProperties(Duration timeout,
                             String defaultCountry,
                             String itunesBaseUrl,
                             String deezerBaseUrl,
                             String userAgent) {
        this.timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        this.defaultCountry = (defaultCountry == null || defaultCountry.isBlank()) ? "us" : defaultCountry;
        this.itunesBaseUrl = (itunesBaseUrl == null || itunesBaseUrl.isBlank())
                ? "https://itunes.apple.com" : itunesBaseUrl;
        this.deezerBaseUrl = (deezerBaseUrl == null || deezerBaseUrl.isBlank())
                ? "https://api.deezer.com" : deezerBaseUrl;
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? "TempoKeyResolver/1.0" : userAgent;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getDefaultCountry() {
        return defaultCountry;
    }

    public String getItunesBaseUrl() {
        return itunesBaseUrl;
    }

    public String getDeezerBaseUrl() {
        return deezerBaseUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }
}
