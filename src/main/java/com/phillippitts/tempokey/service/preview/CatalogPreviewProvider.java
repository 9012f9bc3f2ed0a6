package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.domain.TrackIdentifiers;
import org.springframework.stereotype.Component;

/**
 * Uses the preview URL the catalog itself supplied. Trusted without a network round trip, and
 * its detected identity is by definition the requested one.
 */
@Component
class CatalogPreviewProvider implements PreviewProvider {

    static final String NAME = "catalog_preview";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public boolean canResolve(PreviewQuery query) {
        return query.ids().catalogPreviewUrl() != null;
    }

    @Override
    public PreviewCandidate resolve(PreviewQuery query) {
        TrackIdentifiers ids = query.ids();
        return PreviewCandidate.succeeded(ids.catalogPreviewUrl(), NAME, ids.isrc(), ids.title(), ids.artistLine());
    }
}
