package com.phillippitts.tempokey.presentation.dto;

import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.service.resolve.IngestCommand;

/**
 * Body of {@code POST /api/tempo/ingest}: an externally computed result plus the provenance of
 * the excerpt it was computed from.
 */
public record IngestRequest(
        String trackId,
        String isrc,
        String title,
        String artist,
        PreviewProvenance previewProvenance,
        Result result
) {
    public record PreviewProvenance(String source, String url) { }

    public record Result(
            String algorithm,
            Double tempo,
            Double tempoRaw,
            Double confidence,
            String key,
            String scale,
            Double keyConfidence
    ) { }

    public IngestCommand toCommand() {
        if (result == null) {
            throw new InvalidRequestException("result", "result is required");
        }
        if (previewProvenance == null) {
            throw new InvalidRequestException("source", "previewProvenance.source is required");
        }
        return new IngestCommand(trackId, isrc, title, artist, previewProvenance.source(), previewProvenance.url(),
                result.algorithm(), result.tempo(), result.tempoRaw(), result.confidence(), result.key(),
                result.scale(), result.keyConfidence());
    }
}
