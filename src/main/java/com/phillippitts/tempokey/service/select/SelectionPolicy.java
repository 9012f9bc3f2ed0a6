package com.phillippitts.tempokey.service.select;

import com.phillippitts.tempokey.domain.Algorithm;
import com.phillippitts.tempokey.domain.AlgorithmResult;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.ValueSource;
import org.springframework.stereotype.Component;

/**
 * Picks the one authoritative tempo and key/scale from a record.
 *
 * <p>Tempo and key are chosen independently with the same precedence: the selected manual value
 * if present, else the selected algorithm if it has a value, else the first algorithm (primary,
 * then secondary) that has one. An unresolved identity mismatch withholds the tempo but still
 * exposes key/scale.
 */
@Component
public class SelectionPolicy {

    public static final String MISMATCH_ERROR =
            "Identity mismatch: found a preview but its ISRC does not match the catalog track (wrong audio file)";

    public SelectedValues select(CacheRecord record) {
        Double tempo = null;
        Double tempoRaw = null;
        Double tempoConfidence = null;
        ValueSource tempoSource = null;
        if (record.tempoSelected() == ValueSource.MANUAL && record.manualTempo() != null) {
            tempo = record.manualTempo();
            tempoSource = ValueSource.MANUAL;
        } else {
            Algorithm alg = pick(record, record.tempoSelected(), true);
            if (alg != null) {
                AlgorithmResult r = record.result(alg);
                tempo = r.tempo();
                tempoRaw = r.tempoRaw();
                tempoConfidence = r.tempoConfidence();
                tempoSource = ValueSource.of(alg);
            }
        }

        String key = null;
        String scale = null;
        Double keyConfidence = null;
        ValueSource keySource = null;
        if (record.keySelected() == ValueSource.MANUAL && record.manualKey() != null) {
            key = record.manualKey();
            scale = record.manualScale();
            keySource = ValueSource.MANUAL;
        } else {
            Algorithm alg = pick(record, record.keySelected(), false);
            if (alg != null) {
                AlgorithmResult r = record.result(alg);
                key = r.key();
                scale = r.scale();
                keyConfidence = r.keyConfidence();
                keySource = ValueSource.of(alg);
            }
        }

        if (record.isIsrcMismatch()) {
            return new SelectedValues(null, null, null, null, key, scale, keyConfidence, keySource,
                    true, MISMATCH_ERROR);
        }
        return new SelectedValues(tempo, tempoRaw, tempoConfidence, tempoSource, key, scale, keyConfidence,
                keySource, false, record.error());
    }

    private static Algorithm pick(CacheRecord record, ValueSource selected, boolean tempo) {
        Algorithm preferred = selected == null ? null : selected.algorithm();
        if (preferred != null && has(record.result(preferred), tempo)) {
            return preferred;
        }
        for (Algorithm a : Algorithm.values()) {
            if (has(record.result(a), tempo)) {
                return a;
            }
        }
        return null;
    }

    private static boolean has(AlgorithmResult r, boolean tempo) {
        return tempo ? r.hasTempo() : r.hasKey();
    }
}
