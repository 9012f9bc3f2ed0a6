package com.phillippitts.tempokey.domain;

import java.util.Locale;

/**
 * Tempo/key detection algorithms whose outputs are tracked independently on a cache record.
 *
 * <p>{@link #ESSENTIA} is the primary detector and {@link #LIBROSA} the secondary one. The
 * declaration order is the default precedence used when no explicit selection applies.
 */
public enum Algorithm {
    ESSENTIA("essentia"),
    LIBROSA("librosa");

    private final String wireName;

    Algorithm(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Algorithm primary() {
        return ESSENTIA;
    }

    public static Algorithm secondary() {
        return LIBROSA;
    }

    /**
     * Parses the lower-case name used on the wire and in storage.
     *
     * @throws IllegalArgumentException if the name matches no algorithm
     */
    public static Algorithm fromWireName(String name) {
        if (name != null) {
            String n = name.trim().toLowerCase(Locale.ROOT);
            for (Algorithm a : values()) {
                if (a.wireName.equals(n)) {
                    return a;
                }
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: " + name);
    }
}
