package com.phillippitts.tempokey.service.detection;

import java.util.List;

/**
 * One line of a batch result stream.
 *
 * @param index       position of the excerpt URL in the submitted batch
 * @param finalRecord true once every algorithm has reported for this index
 * @param error       per-item failure reported by the service, if any
 * @param estimates   algorithm outputs present on this line
 */
public record BatchRecord(int index, boolean finalRecord, String error, List<RawEstimate> estimates) {
    public BatchRecord {
        estimates = estimates == null ? List.of() : List.copyOf(estimates);
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }
}
