package com.phillippitts.tempokey.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Cache freshness policy and store selection.
 *
 * Freshness is evaluated when a record is read, so changing a TTL here applies to every
 * existing record on the next read.
 */
@Validated
@ConfigurationProperties(prefix = "tempo.cache")
public class CacheProperties {

    public enum StoreType { MEMORY, JDBC }

    /** Age after which a successful record is recomputed. */
    @NotNull
    private final Duration ttl;

    /** Age after which a failed or mismatch-suppressed record becomes eligible for retry. */
    @NotNull
    private final Duration failureTtl;

    @NotNull
    private final StoreType store;

    @Min(1)
    @Max(1000)
    private final int batchLimit;

    @ConstructorBinding
    public CacheProperties(Duration ttl, Duration failureTtl, StoreType store, Integer batchLimit) {
        this.ttl = ttl == null ? Duration.ofDays(90) : ttl;
        this.failureTtl = failureTtl == null ? Duration.ofDays(1) : failureTtl;
        this.store = store == null ? StoreType.MEMORY : store;
        this.batchLimit = batchLimit == null ? 200 : batchLimit;
    }

    public Duration getTtl() {
        return ttl;
    }

    public Duration getFailureTtl() {
        return failureTtl;
    }

    public StoreType getStore() {
        return store;
    }

    public int getBatchLimit() {
        return batchLimit;
    }
}
