package com.phillippitts.tempokey.domain;

/**
 * Outcome class of a resolution, so callers can tell "nothing yet" from "failed" from
 * "withheld pending review" without inspecting error strings.
 */
public enum ResolutionStatus {
    /** A tempo value is available. */
    RESOLVED,
    /** No record exists and nothing has been computed. */
    NO_DATA,
    /** Terminal failure (e.g. no preview anywhere); cached and retried after the failure TTL. */
    FAILED,
    /** Transient failure of the estimation service; not cached, retry any time. */
    FAILED_RETRYABLE,
    /** The excerpt's identity disagrees with the track; tempo withheld until review. */
    SUPPRESSED_PENDING_REVIEW
}
