package com.phillippitts.tempokey.util;

/** Utility for privacy-safe logging of URLs and free-text identifiers. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Drops the query string (signed preview URLs carry tokens there) and truncates.
     */
    public static String url(String url) {
        if (url == null) {
            return "";
        }
        int q = url.indexOf('?');
        return truncate(q >= 0 ? url.substring(0, q) : url, 120);
    }
}
