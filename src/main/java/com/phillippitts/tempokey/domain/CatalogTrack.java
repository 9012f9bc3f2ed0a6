package com.phillippitts.tempokey.domain;

import java.util.List;

/**
 * Track metadata as supplied by the catalog. Only the fields the resolver needs are modelled.
 *
 * @param id         catalog track ID
 * @param name       track title
 * @param artists    artist names in catalog order
 * @param isrc       ISRC from the catalog's external IDs, may be null
 * @param previewUrl catalog-native preview URL, may be null
 */
public record CatalogTrack(
        String id,
        String name,
        List<String> artists,
        String isrc,
        String previewUrl
) {
    public CatalogTrack {
        artists = artists == null ? List.of() : List.copyOf(artists);
    }
}
