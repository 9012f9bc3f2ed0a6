package com.phillippitts.tempokey.service.detection;

import java.util.List;

/** Snapshot returned by the polling fallback. */
public record BatchPoll(List<BatchRecord> results, boolean done) {
    public BatchPoll {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
