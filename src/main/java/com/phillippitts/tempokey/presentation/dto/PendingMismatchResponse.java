package com.phillippitts.tempokey.presentation.dto;

import com.phillippitts.tempokey.service.review.PendingMismatchReport;

import java.util.List;

public record PendingMismatchResponse(int processed, int resolved, int skipped, int failed, List<Item> results) {

    public record Item(String trackId, String status, String reason, String previewUrl, String isrc) { }

    public static PendingMismatchResponse from(PendingMismatchReport report) {
        List<Item> items = report.results().stream()
                .map(o -> new Item(o.trackId(), o.status().wireName(), o.reason(), o.previewUrl(), o.isrc()))
                .toList();
        return new PendingMismatchResponse(report.processed(), report.resolved(), report.skipped(), report.failed(),
                items);
    }
}
