package com.phillippitts.tempokey.domain;

import java.util.List;

/**
 * Result returned to callers of resolve and batch reads.
 *
 * @param trackId         catalog track the values belong to (null for an unknown ISRC)
 * @param isrc            ISRC of that track, if known
 * @param tempo           authoritative tempo, null when unavailable or suppressed
 * @param tempoRaw        detector output behind {@code tempo}
 * @param tempoConfidence confidence behind {@code tempo}
 * @param key             authoritative key
 * @param scale           authoritative scale
 * @param keyConfidence   confidence behind {@code key}
 * @param tempoSelected   which source {@code tempo} came from
 * @param keySelected     which source {@code key} came from
 * @param source          provider tag of the excerpt used, or {@code computed_failed}
 * @param cached          true when served from a fresh cache record
 * @param error           human-readable failure or mismatch description
 * @param status          outcome class
 * @param candidates      provider attempts behind this record
 */
public record TempoResolution(
        String trackId,
        String isrc,
        Double tempo,
        Double tempoRaw,
        Double tempoConfidence,
        String key,
        String scale,
        Double keyConfidence,
        ValueSource tempoSelected,
        ValueSource keySelected,
        String source,
        boolean cached,
        String error,
        ResolutionStatus status,
        List<PreviewCandidate> candidates
) {
    public TempoResolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    /** Entry for an ISRC that has no record at all. */
    public static TempoResolution notCached(String isrc) {
        return new TempoResolution(null, isrc, null, null, null, null, null, null, null, null,
                null, false, null, ResolutionStatus.NO_DATA, List.of());
    }

    /** Entry for a track neither the cache nor the catalog knows. */
    public static TempoResolution unknownTrack(String trackId, String error) {
        return new TempoResolution(trackId, null, null, null, null, null, null, null, null, null,
                null, false, error, ResolutionStatus.NO_DATA, List.of());
    }

    /** Transient failure that was deliberately not written to the cache. */
    public static TempoResolution retryableFailure(TrackIdentifiers ids, String source, String error,
                                                   List<PreviewCandidate> candidates) {
        return new TempoResolution(ids.trackId(), ids.isrc(), null, null, null, null, null, null,
                null, null, source, false, error, ResolutionStatus.FAILED_RETRYABLE, candidates);
    }
}
