package com.phillippitts.tempokey.service.bulk;

import com.phillippitts.tempokey.domain.TempoResolution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response of bulk preparation.
 *
 * @param batchId          estimation batch, or null when nothing needed computing
 * @param indexToTrackId   track behind each stream index
 * @param previewMeta      chosen preview per queued track, keyed by trackId
 * @param immediateResults fresh cache hits and terminal failures, keyed by trackId
 */
public record BulkSubmission(
        String batchId,
        List<String> indexToTrackId,
        Map<String, PreviewMeta> previewMeta,
        Map<String, TempoResolution> immediateResults
) {
    public BulkSubmission {
        indexToTrackId = indexToTrackId == null ? List.of() : List.copyOf(indexToTrackId);
        previewMeta = previewMeta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(previewMeta));
        immediateResults = immediateResults == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(immediateResults));
    }
}
