package com.phillippitts.tempokey.service.events;

import java.time.Instant;

/**
 * Published when the excerpt chosen for a track reports an identity that disagrees with the track.
 */
public record IdentityMismatchFlaggedEvent(String trackId, String provider, String requestedIsrc,
                                           String detectedIsrc, Instant at) { }
