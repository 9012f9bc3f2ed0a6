package com.phillippitts.tempokey.domain;

import java.util.Objects;

/**
 * One provider attempt made while resolving a preview excerpt. Failed attempts are recorded too,
 * so the candidate list doubles as a diagnostic trail.
 *
 * <p>The {@code detected*} fields describe the identity the provider reported for the returned
 * audio; they are compared against the requested track to detect identity mismatches.
 */
public record PreviewCandidate(
        String url,
        String provider,
        boolean success,
        String detectedIsrc,
        String detectedTitle,
        String detectedArtist
) {
    public PreviewCandidate {
        Objects.requireNonNull(provider, "provider");
    }

    public static PreviewCandidate succeeded(String url, String provider,
                                             String detectedIsrc, String detectedTitle, String detectedArtist) {
        return new PreviewCandidate(Objects.requireNonNull(url, "url"), provider, true,
                detectedIsrc, detectedTitle, detectedArtist);
    }

    public static PreviewCandidate failed(String provider, String attemptedUrl) {
        return new PreviewCandidate(attemptedUrl, provider, false, null, null, null);
    }
}
