package com.phillippitts.tempokey.service.events;

import java.time.Instant;

/** Published when every preview provider was exhausted without an excerpt. */
public record NoPreviewFoundEvent(String trackId, int attempts, Instant at) { }
