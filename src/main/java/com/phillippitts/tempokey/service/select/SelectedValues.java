package com.phillippitts.tempokey.service.select;

import com.phillippitts.tempokey.domain.ValueSource;

/**
 * Authoritative values picked from a record. Sources are null when nothing was available.
 */
public record SelectedValues(
        Double tempo,
        Double tempoRaw,
        Double tempoConfidence,
        ValueSource tempoSource,
        String key,
        String scale,
        Double keyConfidence,
        ValueSource keySource,
        boolean tempoSuppressed,
        String error
) {
    public boolean hasTempo() {
        return tempo != null;
    }
}
