package com.phillippitts.tempokey.presentation.dto;

import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.service.review.MismatchEntry;

import java.time.Instant;

/**
 * Review state of one record. {@code isrcMismatch} is the effective flag consumers see;
 * {@code autoFlag} is the raw detector output.
 */
public record MismatchResponse(
        String trackId,
        String isrc,
        String title,
        String artist,
        String previewUrl,
        String source,
        boolean isrcMismatch,
        boolean autoFlag,
        String reviewStatus,
        String state,
        String reviewedBy,
        Instant reviewedAt,
        Instant updatedAt
) {
    public static MismatchResponse from(MismatchEntry e) {
        return new MismatchResponse(e.trackId(), e.isrc(), e.title(), e.artist(), e.previewUrl(), e.source(),
                e.state().suppressesTempo(), e.autoFlag(),
                e.reviewStatus() == null ? null : e.reviewStatus().wireName(), e.state().name(),
                e.reviewedBy(), e.reviewedAt(), e.updatedAt());
    }

    public static MismatchResponse from(CacheRecord r) {
        return from(MismatchEntry.of(r));
    }
}
