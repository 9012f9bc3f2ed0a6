package com.phillippitts.tempokey.presentation.dto;

import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.domain.TempoResolution;
import com.phillippitts.tempokey.domain.ValueSource;

import java.util.List;

/**
 * Wire shape of a resolution. Selections use their lower-case wire names.
 */
public record TempoResponse(
        String trackId,
        String isrc,
        Double tempo,
        Double tempoRaw,
        Double tempoConfidence,
        String key,
        String scale,
        Double keyConfidence,
        String tempoSelected,
        String keySelected,
        String source,
        boolean cached,
        String error,
        String status,
        List<PreviewCandidate> previewCandidates
) {
    public static TempoResponse from(TempoResolution r) {
        return new TempoResponse(r.trackId(), r.isrc(), r.tempo(), r.tempoRaw(), r.tempoConfidence(),
                r.key(), r.scale(), r.keyConfidence(), wire(r.tempoSelected()), wire(r.keySelected()),
                r.source(), r.cached(), r.error(), r.status().name(), r.candidates());
    }

    private static String wire(ValueSource s) {
        return s == null ? null : s.wireName();
    }
}
