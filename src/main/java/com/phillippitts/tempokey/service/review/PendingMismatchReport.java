package com.phillippitts.tempokey.service.review;

import java.util.List;
import java.util.Locale;

/**
 * Per-track outcome of re-resolving pending mismatches, with totals.
 */
public record PendingMismatchReport(int processed, int resolved, int skipped, int failed, List<Outcome> results) {

    public PendingMismatchReport {
        results = List.copyOf(results);
    }

    static PendingMismatchReport of(List<Outcome> results) {
        int resolved = 0;
        int skipped = 0;
        int failed = 0;
        for (Outcome o : results) {
            switch (o.status()) {
                case RESOLVED -> resolved++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        return new PendingMismatchReport(results.size(), resolved, skipped, failed, results);
    }

    public enum Status {
        RESOLVED,
        SKIPPED,
        FAILED;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * @param reason why the track was skipped or failed; null when resolved
     */
    public record Outcome(String trackId, Status status, String reason, String previewUrl, String isrc) {

        static Outcome resolved(String trackId, String previewUrl, String isrc) {
            return new Outcome(trackId, Status.RESOLVED, null, previewUrl, isrc);
        }

        static Outcome skipped(String trackId, String reason, String isrc) {
            return new Outcome(trackId, Status.SKIPPED, reason, null, isrc);
        }

        static Outcome failed(String trackId, String reason, String isrc) {
            return new Outcome(trackId, Status.FAILED, reason, null, isrc);
        }
    }
}
