package com.phillippitts.tempokey.service.events;

import java.time.Instant;

/** Published when a preview provider attempt fails and the resolver falls through to the next one. */
public record PreviewAttemptFailedEvent(String trackId, String provider, String reason, Instant at) { }
