package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.domain.PreviewCandidate;

import java.util.List;

/**
 * Outcome of running the provider chain once.
 *
 * @param candidates every attempt made, in order, including failures
 * @param selected   the first successful candidate, or null when all providers were exhausted
 */
public record PreviewResolution(List<PreviewCandidate> candidates, PreviewCandidate selected) {

    /** Source tag stored when no provider produced an excerpt. */
    public static final String NO_PREVIEW_SOURCE = "computed_failed";

    public PreviewResolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public boolean found() {
        return selected != null;
    }

    public String source() {
        return selected == null ? NO_PREVIEW_SOURCE : selected.provider();
    }

    public String url() {
        return selected == null ? null : selected.url();
    }
}
