package com.phillippitts.tempokey.service.catalog;

import com.phillippitts.tempokey.domain.CatalogTrack;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Fallback used when no catalog integration is deployed: knows no tracks, so lookups by ID only
 * succeed from the cache.
 */
public class UnconfiguredCatalogClient implements CatalogClient {
    private static final Logger LOG = LogManager.getLogger(UnconfiguredCatalogClient.class);

    @Override
    public Optional<CatalogTrack> findTrack(String trackId) {
        LOG.debug("No catalog client configured; track {} unknown", trackId);
        return Optional.empty();
    }
}
