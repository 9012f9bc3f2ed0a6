package com.phillippitts.tempokey.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for tempo/key resolution.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Cache outcomes (hit, miss, stale, failure-served)</li>
 *   <li>Preview provider attempts per provider and outcome</li>
 *   <li>Detection latency and failures</li>
 *   <li>Callers that joined an in-flight resolution instead of starting one</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class ResolutionMetrics {

    private static final String METRIC_PREFIX = "tempokey";

    private final MeterRegistry registry;

    public ResolutionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome hit, miss, stale, isrc-hit or failure-served
     */
    public void incrementCacheOutcome(String outcome) {
        Counter.builder(METRIC_PREFIX + ".cache")
                .description("Cache lookups by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementProviderAttempt(String provider, String outcome) {
        Counter.builder(METRIC_PREFIX + ".preview.attempts")
                .description("Preview provider attempts")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementNoPreview() {
        Counter.builder(METRIC_PREFIX + ".preview.exhausted")
                .description("Resolutions where every provider failed")
                .register(registry)
                .increment();
    }

    public void recordDetectionLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".detection.latency")
                .description("Time taken by the estimation service")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementDetectionFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".detection.failure")
                .description("Failed estimation calls")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementDedupJoin() {
        Counter.builder(METRIC_PREFIX + ".dedup.joined")
                .description("Callers that awaited an in-flight resolution")
                .register(registry)
                .increment();
    }

    public void incrementMismatchFlagged(String provider) {
        Counter.builder(METRIC_PREFIX + ".mismatch.flagged")
                .description("Automatic identity mismatch flags")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }
}
