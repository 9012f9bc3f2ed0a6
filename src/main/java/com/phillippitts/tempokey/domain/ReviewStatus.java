package com.phillippitts.tempokey.domain;

import java.util.Locale;

/** Human review decision on an identity mismatch. */
public enum ReviewStatus {
    MATCH("match"),
    MISMATCH("mismatch");

    private final String wireName;

    ReviewStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ReviewStatus fromWireName(String name) {
        if (name == null) {
            return null;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
