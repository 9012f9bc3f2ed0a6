package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.domain.PreviewCandidate;

/**
 * One source of preview excerpts. Implementations are tried by {@link PreviewResolver} in
 * ascending {@link #priority()} order.
 */
public interface PreviewProvider {

    /** Provenance tag recorded on candidates and as a record's {@code source}. */
    String name();

    /** Lower runs first. */
    int priority();

    /** @return false when the query lacks what this provider needs (e.g. no ISRC) */
    boolean canResolve(PreviewQuery query);

    /**
     * Looks up an excerpt.
     *
     * @return a successful candidate, or a failed one when the provider answered without a preview
     * @throws com.phillippitts.tempokey.exception.ProviderUnavailableException when the provider
     *         could not be reached or answered with garbage
     */
    PreviewCandidate resolve(PreviewQuery query);
}
