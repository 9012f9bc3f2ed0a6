package com.phillippitts.tempokey.service.review;

import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.MismatchState;
import com.phillippitts.tempokey.domain.ReviewStatus;

import java.time.Instant;

/** Row of the mismatch review listing. */
public record MismatchEntry(
        String trackId,
        String isrc,
        String title,
        String artist,
        String previewUrl,
        String source,
        boolean autoFlag,
        ReviewStatus reviewStatus,
        MismatchState state,
        String reviewedBy,
        Instant reviewedAt,
        Instant updatedAt
) {
    public static MismatchEntry of(CacheRecord r) {
        return new MismatchEntry(r.trackId(), r.isrc(), r.title(), r.artist(), r.previewUrl(), r.source(),
                r.isAutoMismatchFlag(), r.reviewStatus(), r.mismatchState(), r.reviewedBy(), r.reviewedAt(),
                r.updatedAt());
    }
}
