package com.phillippitts.tempokey.presentation.dto;

import com.phillippitts.tempokey.service.bulk.BulkSubmission;
import com.phillippitts.tempokey.service.bulk.PreviewMeta;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record BulkResponse(
        String batchId,
        List<String> indexToTrackId,
        Map<String, PreviewMeta> previewMeta,
        Map<String, TempoResponse> immediateResults
) {
    public static BulkResponse from(BulkSubmission s) {
        Map<String, TempoResponse> immediate = new LinkedHashMap<>();
        s.immediateResults().forEach((id, r) -> immediate.put(id, TempoResponse.from(r)));
        return new BulkResponse(s.batchId(), s.indexToTrackId(), s.previewMeta(), immediate);
    }
}
