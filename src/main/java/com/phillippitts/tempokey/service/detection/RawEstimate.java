package com.phillippitts.tempokey.service.detection;

import com.phillippitts.tempokey.domain.Algorithm;

import java.util.Objects;

/**
 * Un-normalized output of one detection algorithm for one excerpt.
 *
 * @param algorithm       detector that produced the values
 * @param tempoRaw        tempo as reported, before octave correction
 * @param tempoConfidence 0..1
 * @param key             e.g. "F#"
 * @param scale           "major" or "minor"
 * @param keyConfidence   0..1
 */
public record RawEstimate(
        Algorithm algorithm,
        Double tempoRaw,
        Double tempoConfidence,
        String key,
        String scale,
        Double keyConfidence
) {
    public RawEstimate {
        Objects.requireNonNull(algorithm, "algorithm");
    }

    public boolean isEmpty() {
        return tempoRaw == null && key == null && scale == null;
    }
}
