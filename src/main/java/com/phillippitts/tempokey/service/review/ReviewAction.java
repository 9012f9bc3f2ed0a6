package com.phillippitts.tempokey.service.review;

import com.phillippitts.tempokey.domain.ReviewStatus;
import com.phillippitts.tempokey.exception.InvalidRequestException;

import java.util.Locale;

/** Human decision on a flagged record. */
public enum ReviewAction {
    CONFIRM_MATCH("confirm_match", ReviewStatus.MATCH),
    CONFIRM_MISMATCH("confirm_mismatch", ReviewStatus.MISMATCH);

    private final String wireName;
    private final ReviewStatus status;

    ReviewAction(String wireName, ReviewStatus status) {
        this.wireName = wireName;
        this.status = status;
    }

    public String wireName() {
        return wireName;
    }

    public ReviewStatus status() {
        return status;
    }

    /**
     * @throws InvalidRequestException for anything but {@code confirm_match} / {@code confirm_mismatch}
     */
    public static ReviewAction fromWireName(String name) {
        if (name != null) {
            String n = name.trim().toLowerCase(Locale.ROOT);
            for (ReviewAction a : values()) {
                if (a.wireName.equals(n)) {
                    return a;
                }
            }
        }
        throw new InvalidRequestException("action", "action must be confirm_match or confirm_mismatch");
    }
}
