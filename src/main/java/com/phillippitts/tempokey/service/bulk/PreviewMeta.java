package com.phillippitts.tempokey.service.bulk;

/** Preview chosen for a queued track, reported back with the submission. */
public record PreviewMeta(String trackId, String url, String source, boolean isrcMismatch) { }
