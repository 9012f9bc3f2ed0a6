package com.phillippitts.tempokey.service.cache;

import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.domain.ReviewStatus;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. {@link ConcurrentHashMap#compute} gives the per-record lock the merge
 * contract needs. Contents are lost on restart.
 */
public class InMemoryCacheStore implements CacheStore {

    private final ConcurrentHashMap<String, CacheRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public Optional<CacheRecord> get(String trackId) {
        return Optional.ofNullable(records.get(trackId));
    }

    @Override
    public Optional<CacheRecord> findByIsrc(String isrc) {
        if (isrc == null) {
            return Optional.empty();
        }
        return records.values().stream()
                .filter(r -> isrc.equals(r.isrc()))
                .max(Comparator.comparing(CacheRecord::updatedAt));
    }

    @Override
    public Map<String, CacheRecord> getBatchByIsrc(Collection<String> isrcs) {
        Set<String> wanted = new HashSet<>(isrcs);
        Map<String, CacheRecord> out = new HashMap<>();
        for (CacheRecord r : records.values()) {
            if (r.isrc() != null && wanted.contains(r.isrc())) {
                out.merge(r.isrc(), r, (a, b) -> a.updatedAt().isAfter(b.updatedAt()) ? a : b);
            }
        }
        return out;
    }

    @Override
    public CacheRecord merge(String trackId, CacheUpdate update) {
        return records.compute(trackId, (id, existing) -> update.applyTo(id, existing, clock.instant()));
    }

    @Override
    public Optional<CacheRecord> mergeExisting(String trackId, CacheUpdate update) {
        return Optional.ofNullable(records.computeIfPresent(trackId,
                (id, existing) -> update.applyTo(id, existing, clock.instant())));
    }

    @Override
    public boolean delete(String trackId) {
        return records.remove(trackId) != null;
    }

    @Override
    public List<CacheRecord> findMismatches(int limit) {
        return records.values().stream()
                .filter(r -> r.isAutoMismatchFlag() || r.reviewStatus() != null)
                .sorted(Comparator.comparing(CacheRecord::updatedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<CacheRecord> findPendingMismatches(int limit) {
        return records.values().stream()
                .filter(r -> r.isAutoMismatchFlag() && r.reviewStatus() != ReviewStatus.MATCH)
                .sorted(Comparator.comparing(CacheRecord::updatedAt).reversed())
                .limit(limit)
                .toList();
    }

    int size() {
        return records.size();
    }
}
