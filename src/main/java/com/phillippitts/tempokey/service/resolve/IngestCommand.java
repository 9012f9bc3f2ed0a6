package com.phillippitts.tempokey.service.resolve;

/**
 * Externally computed result to store.
 *
 * @param trackId         target record
 * @param isrc            optional identity fields, stored when present
 * @param title           optional
 * @param artist          optional
 * @param source          provenance tag of the excerpt the result was computed from (required)
 * @param previewUrl      excerpt URL, optional; replaces the candidate list when present
 * @param algorithm       detector wire name (required)
 * @param tempo           tempo as computed; used as the raw value when {@code tempoRaw} is absent
 * @param tempoRaw        detector output before any octave correction
 * @param confidence      tempo confidence
 * @param key             optional
 * @param scale           optional
 * @param keyConfidence   optional
 */
public record IngestCommand(
        String trackId,
        String isrc,
        String title,
        String artist,
        String source,
        String previewUrl,
        String algorithm,
        Double tempo,
        Double tempoRaw,
        Double confidence,
        String key,
        String scale,
        Double keyConfidence
) { }
