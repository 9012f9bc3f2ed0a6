package com.phillippitts.tempokey.service.bulk;

import java.util.List;
import java.util.Map;

/**
 * Polled state of a batch; each result has the same fields as a stream line.
 */
public record BatchProgress(String batchId, List<Map<String, Object>> results, boolean done) {
    public BatchProgress {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
