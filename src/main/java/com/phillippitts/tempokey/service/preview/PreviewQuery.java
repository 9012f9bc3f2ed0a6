package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.domain.TrackIdentifiers;

import java.util.Objects;

/**
 * Input to a preview lookup.
 *
 * @param ids     requested track identity
 * @param country two-letter storefront country, lower case
 */
public record PreviewQuery(TrackIdentifiers ids, String country) {
    public PreviewQuery {
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(country, "country");
    }
}
