package com.phillippitts.tempokey.service.cache;

import com.phillippitts.tempokey.config.properties.CacheProperties;
import com.phillippitts.tempokey.domain.AlgorithmResult;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Decides at read time whether a stored record can be served without recomputation.
 *
 * <p>Successful records live for {@code tempo.cache.ttl}. Terminal failures and unresolved
 * identity mismatches use the shorter {@code tempo.cache.failure-ttl}. A record with no tempo
 * and no error (only preview candidates from an interrupted pipeline) is never fresh.
 */
@Component
public class FreshnessPolicy {

    private final CacheProperties props;
    private final Clock clock;

    public FreshnessPolicy(CacheProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.clock = Objects.requireNonNull(clock);
    }

    public boolean isFresh(CacheRecord record) {
        if (record == null || !hasOutcome(record)) {
            return false;
        }
        return TimeUtils.age(record.updatedAt(), clock.instant()).compareTo(ttlFor(record)) < 0;
    }

    public Duration ttlFor(CacheRecord record) {
        return record.hasError() || record.isIsrcMismatch() ? props.getFailureTtl() : props.getTtl();
    }

    private static boolean hasOutcome(CacheRecord r) {
        return r.hasError()
                || r.isIsrcMismatch()
                || r.manualTempo() != null
                || r.results().values().stream().anyMatch(AlgorithmResult::hasTempo);
    }
}
