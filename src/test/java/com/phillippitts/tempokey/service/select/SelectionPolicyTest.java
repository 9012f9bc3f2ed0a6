package com.phillippitts.tempokey.service.select;

import com.phillippitts.tempokey.domain.Algorithm;
import com.phillippitts.tempokey.domain.AlgorithmResult;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.ReviewStatus;
import com.phillippitts.tempokey.domain.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SelectionPolicyTest {

    private final SelectionPolicy policy = new SelectionPolicy();

    private static CacheRecord.Builder both() {
        return CacheRecord.builder("t1")
                .result(Algorithm.ESSENTIA, new AlgorithmResult(120.0, 60.0, 0.9, "A", "minor", 0.8))
                .result(Algorithm.LIBROSA, new AlgorithmResult(121.0, 121.0, 0.5, "C", "major", 0.4));
    }

    @Test
    void primaryWinsByDefault() {
        SelectedValues v = policy.select(both().build());

        assertThat(v.tempo()).isEqualTo(120.0);
        assertThat(v.tempoRaw()).isEqualTo(60.0);
        assertThat(v.tempoSource()).isEqualTo(ValueSource.ESSENTIA);
        assertThat(v.key()).isEqualTo("A");
        assertThat(v.keySource()).isEqualTo(ValueSource.ESSENTIA);
    }

    @Test
    void explicitSecondarySelectionIsHonoured() {
        SelectedValues v = policy.select(both().tempoSelected(ValueSource.LIBROSA).build());

        assertThat(v.tempo()).isEqualTo(121.0);
        assertThat(v.tempoSource()).isEqualTo(ValueSource.LIBROSA);
        assertThat(v.key()).isEqualTo("A");
    }

    @Test
    void manualValuesWinWhenSelected() {
        CacheRecord r = both().manualTempo(124.0).manualKey("D").manualScale("minor")
                .tempoSelected(ValueSource.MANUAL).keySelected(ValueSource.MANUAL).build();

        SelectedValues v = policy.select(r);

        assertThat(v.tempo()).isEqualTo(124.0);
        assertThat(v.tempoRaw()).isNull();
        assertThat(v.tempoSource()).isEqualTo(ValueSource.MANUAL);
        assertThat(v.key()).isEqualTo("D");
        assertThat(v.scale()).isEqualTo("minor");
    }

    @Test
    void fallsBackToAnyAlgorithmWithAValue() {
        CacheRecord r = CacheRecord.builder("t1")
                .result(Algorithm.LIBROSA, new AlgorithmResult(99.0, 99.0, 0.3, null, null, null))
                .tempoSelected(ValueSource.ESSENTIA)
                .build();

        assertThat(policy.select(r).tempo()).isEqualTo(99.0);
        assertThat(policy.select(r).tempoSource()).isEqualTo(ValueSource.LIBROSA);
    }

    @Test
    void pendingMismatchSuppressesTempoButKeepsKey() {
        SelectedValues v = policy.select(both().autoMismatchFlag(true).build());

        assertThat(v.tempo()).isNull();
        assertThat(v.tempoSource()).isNull();
        assertThat(v.tempoSuppressed()).isTrue();
        assertThat(v.error()).isEqualTo(SelectionPolicy.MISMATCH_ERROR);
        assertThat(v.key()).isEqualTo("A");
    }

    @Test
    void confirmedMatchLiftsSuppression() {
        SelectedValues v = policy.select(both().autoMismatchFlag(true).reviewStatus(ReviewStatus.MATCH).build());

        assertThat(v.tempo()).isEqualTo(120.0);
        assertThat(v.tempoSuppressed()).isFalse();
        assertThat(v.error()).isNull();
    }

    @Test
    void confirmedMismatchSuppressesEvenWithoutAutomaticFlag() {
        SelectedValues v = policy.select(both().reviewStatus(ReviewStatus.MISMATCH).build());

        assertThat(v.tempo()).isNull();
        assertThat(v.tempoSuppressed()).isTrue();
    }

    @Test
    void emptyRecordSelectsNothing() {
        SelectedValues v = policy.select(CacheRecord.builder("t1").error("boom").build());

        assertThat(v.hasTempo()).isFalse();
        assertThat(v.key()).isNull();
        assertThat(v.error()).isEqualTo("boom");
    }
}
