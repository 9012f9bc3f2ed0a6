package com.phillippitts.tempokey.presentation.dto;

/**
 * Body of a pending-mismatch run. Both fields are optional.
 *
 * @param limit   most records to process; defaults to {@link #DEFAULT_LIMIT}
 * @param country storefront country for the preview lookups
 */
public record ResolvePendingRequest(Integer limit, String country) {

    public static final int DEFAULT_LIMIT = 100;

    public int limitOrDefault() {
        return limit == null ? DEFAULT_LIMIT : limit;
    }
}
