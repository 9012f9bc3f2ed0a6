package com.phillippitts.tempokey.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MismatchStateTest {

    @Test
    void reviewOverridesAutomaticFlag() {
        assertThat(MismatchState.of(true, ReviewStatus.MATCH)).isEqualTo(MismatchState.CONFIRMED_MATCH);
        assertThat(MismatchState.of(false, ReviewStatus.MISMATCH)).isEqualTo(MismatchState.CONFIRMED_MISMATCH);
    }

    @Test
    void unreviewedFollowsAutomaticFlag() {
        assertThat(MismatchState.of(true, null)).isEqualTo(MismatchState.FLAGGED_PENDING);
        assertThat(MismatchState.of(false, null)).isEqualTo(MismatchState.UNFLAGGED);
    }

    @Test
    void onlyPendingAndConfirmedMismatchSuppressTempo() {
        assertThat(MismatchState.FLAGGED_PENDING.suppressesTempo()).isTrue();
        assertThat(MismatchState.CONFIRMED_MISMATCH.suppressesTempo()).isTrue();
        assertThat(MismatchState.CONFIRMED_MATCH.suppressesTempo()).isFalse();
        assertThat(MismatchState.UNFLAGGED.suppressesTempo()).isFalse();
    }

    @Test
    void recordExposesEffectiveMismatch() {
        CacheRecord flagged = CacheRecord.builder("t1").autoMismatchFlag(true).build();
        CacheRecord confirmedMatch = flagged.toBuilder().reviewStatus(ReviewStatus.MATCH).build();

        assertThat(flagged.isIsrcMismatch()).isTrue();
        assertThat(confirmedMatch.isIsrcMismatch()).isFalse();
        assertThat(confirmedMatch.isAutoMismatchFlag()).isTrue();
    }
}
