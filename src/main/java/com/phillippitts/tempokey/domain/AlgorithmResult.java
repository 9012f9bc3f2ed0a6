package com.phillippitts.tempokey.domain;

/**
 * Per-algorithm tempo and key fields stored on a cache record. Every component is independently
 * nullable.
 *
 * @param tempo           normalized tempo (octave-corrected, one decimal)
 * @param tempoRaw        tempo as reported by the detector, before normalization
 * @param tempoConfidence detector confidence for the tempo, 0..1
 * @param key             musical key, e.g. "C#"
 * @param scale           "major" or "minor"
 * @param keyConfidence   detector confidence for key/scale, 0..1
 */
public record AlgorithmResult(
        Double tempo,
        Double tempoRaw,
        Double tempoConfidence,
        String key,
        String scale,
        Double keyConfidence
) {

    public static final AlgorithmResult EMPTY = new AlgorithmResult(null, null, null, null, null, null);

    public boolean hasTempo() {
        return tempo != null;
    }

    public boolean hasKey() {
        return key != null;
    }

    boolean carriesTempo() {
        return tempo != null || tempoRaw != null;
    }

    boolean carriesKey() {
        return key != null || scale != null;
    }

    /**
     * Overlays {@code update} onto this result. The tempo triple and the key triple are replaced
     * as groups, and only when the update carries that group; an update with no key leaves a
     * previously stored key in place.
     */
    public AlgorithmResult overlay(AlgorithmResult update) {
        if (update == null) {
            return this;
        }
        boolean tempoGroup = update.carriesTempo();
        boolean keyGroup = update.carriesKey();
        return new AlgorithmResult(
                tempoGroup ? update.tempo : tempo,
                tempoGroup ? update.tempoRaw : tempoRaw,
                tempoGroup ? update.tempoConfidence : tempoConfidence,
                keyGroup ? update.key : key,
                keyGroup ? update.scale : scale,
                keyGroup ? update.keyConfidence : keyConfidence
        );
    }
}
