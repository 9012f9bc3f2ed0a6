package com.phillippitts.tempokey.service.catalog;

import com.phillippitts.tempokey.domain.CatalogTrack;

import java.util.Optional;

/**
 * Track metadata source. Deployments provide a bean talking to the real catalog API.
 */
public interface CatalogClient {

    Optional<CatalogTrack> findTrack(String trackId);
}
