package com.phillippitts.tempokey.domain;

import java.util.Locale;

/**
 * Which field set is authoritative for a record's tempo or key: one of the detection
 * algorithms, or the manual override.
 */
public enum ValueSource {
    ESSENTIA("essentia"),
    LIBROSA("librosa"),
    MANUAL("manual");

    private final String wireName;

    ValueSource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ValueSource of(Algorithm algorithm) {
        return algorithm == Algorithm.ESSENTIA ? ESSENTIA : LIBROSA;
    }

    /** @return the algorithm behind this source, or null for {@link #MANUAL} */
    public Algorithm algorithm() {
        return switch (this) {
            case ESSENTIA -> Algorithm.ESSENTIA;
            case LIBROSA -> Algorithm.LIBROSA;
            case MANUAL -> null;
        };
    }

    public static ValueSource fromWireName(String name) {
        if (name != null) {
            String n = name.trim().toLowerCase(Locale.ROOT);
            for (ValueSource s : values()) {
                if (s.wireName.equals(n)) {
                    return s;
                }
            }
        }
        throw new IllegalArgumentException("Unknown value source: " + name);
    }
}
