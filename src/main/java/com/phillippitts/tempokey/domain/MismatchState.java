package com.phillippitts.tempokey.domain;

/**
 * Derived review state of a record's identity check.
 *
 * <pre>
 *   UNFLAGGED --(auto)--&gt; FLAGGED_PENDING --(review)--&gt; CONFIRMED_MATCH | CONFIRMED_MISMATCH
 * </pre>
 *
 * A review decision is sticky: automatic re-resolution never moves a record out of a confirmed
 * state. Only clearing the review fields does.
 */
public enum MismatchState {
    UNFLAGGED,
    FLAGGED_PENDING,
    CONFIRMED_MATCH,
    CONFIRMED_MISMATCH;

    /** Whether readers must withhold the tempo value. */
    public boolean suppressesTempo() {
        return this == FLAGGED_PENDING || this == CONFIRMED_MISMATCH;
    }

    public static MismatchState of(boolean autoFlag, ReviewStatus reviewStatus) {
        if (reviewStatus == ReviewStatus.MATCH) {
            return CONFIRMED_MATCH;
        }
        if (reviewStatus == ReviewStatus.MISMATCH) {
            return CONFIRMED_MISMATCH;
        }
        return autoFlag ? FLAGGED_PENDING : UNFLAGGED;
    }
}
