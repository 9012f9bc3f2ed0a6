package com.phillippitts.tempokey.service.bulk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which track each index of a submitted batch belongs to, so streamed and polled
 * results can be written back to the cache. Registrations expire after a day.
 */
@Component
public class BatchRegistry {
    private static final Logger LOG = LogManager.getLogger(BatchRegistry.class);

    static final Duration RETENTION = Duration.ofHours(24);

    private final Map<String, Registration> batches = new ConcurrentHashMap<>();
    private final Clock clock;

    public BatchRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    public void register(String batchId, List<String> indexToTrackId) {
        batches.put(batchId, new Registration(List.copyOf(indexToTrackId), clock.instant()));
    }

    /** @return the track behind {@code index}, or empty for unknown batches and indices */
    public Optional<String> trackFor(String batchId, int index) {
        Registration r = batches.get(batchId);
        if (r == null || index < 0 || index >= r.indexToTrackId().size()) {
            return Optional.empty();
        }
        return Optional.of(r.indexToTrackId().get(index));
    }

    public boolean isRegistered(String batchId) {
        return batches.containsKey(batchId);
    }

    @Scheduled(fixedDelayString = "PT1H", initialDelayString = "PT1H")
    public void evictExpired() {
        Instant cutoff = clock.instant().minus(RETENTION);
        int before = batches.size();
        batches.values().removeIf(r -> r.createdAt().isBefore(cutoff));
        int evicted = before - batches.size();
        if (evicted > 0) {
            LOG.debug("Evicted {} expired batch registrations", evicted);
        }
    }

    private record Registration(List<String> indexToTrackId, Instant createdAt) { }
}
