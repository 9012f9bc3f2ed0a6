package com.phillippitts.tempokey.service.cache;

import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable per-track tempo/key records.
 *
 * <p>All mutation goes through {@link #merge} / {@link #mergeExisting}: implementations read the
 * current record and apply the {@link CacheUpdate} under a per-record lock, so two writers
 * touching different fields of the same record never lose each other's values.
 *
 * <p>Stores do not judge freshness; that is {@link FreshnessPolicy}'s job at read time.
 */
public interface CacheStore {

    Optional<CacheRecord> get(String trackId);

    /** Most recently updated record carrying {@code isrc}. */
    Optional<CacheRecord> findByIsrc(String isrc);

    /**
     * Looks up many ISRCs at once. ISRCs without a record are absent from the result; when several
     * records share an ISRC the most recently updated one wins.
     */
    Map<String, CacheRecord> getBatchByIsrc(Collection<String> isrcs);

    /** Creates or updates the record and returns the merged state. */
    CacheRecord merge(String trackId, CacheUpdate update);

    /** Like {@link #merge} but never creates a record; empty when none exists. */
    Optional<CacheRecord> mergeExisting(String trackId, CacheUpdate update);

    /** @return true when a record was removed */
    boolean delete(String trackId);

    /** Records that are auto-flagged or carry any review decision, most recently updated first. */
    List<CacheRecord> findMismatches(int limit);

    /** Auto-flagged records nobody has confirmed as a match, most recently updated first. */
    List<CacheRecord> findPendingMismatches(int limit);
}
