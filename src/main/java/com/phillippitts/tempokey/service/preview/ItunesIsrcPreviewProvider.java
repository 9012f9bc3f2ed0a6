package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.config.properties.PreviewProperties;
import com.phillippitts.tempokey.domain.PreviewCandidate;
import org.json.JSONObject;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Storefront lookup by ISRC (provider A, exact match).
 */
@Component
class ItunesIsrcPreviewProvider implements PreviewProvider {

    static final String NAME = "itunes_isrc";

    private final StorefrontHttpClient http;
    private final PreviewProperties props;

    ItunesIsrcPreviewProvider(StorefrontHttpClient http, PreviewProperties props) {
        this.http = http;
        this.props = props;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean canResolve(PreviewQuery query) {
        return query.ids().hasIsrc();
    }

    @Override
    public PreviewCandidate resolve(PreviewQuery query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(props.getItunesBaseUrl())
                .path("/lookup")
                .queryParam("isrc", "{isrc}")
                .queryParam("country", "{country}")
                .encode()
                .buildAndExpand(query.ids().isrc(), query.country())
                .toUri();
        JSONObject hit = ItunesResults.firstWithPreview(http.getJson(NAME, uri));
        if (hit == null) {
            return PreviewCandidate.failed(NAME, uri.toString());
        }
        // A lookup by ISRC returns that recording unless the store says otherwise.
        String detectedIsrc = hit.optString("isrc", query.ids().isrc());
        return PreviewCandidate.succeeded(hit.getString("previewUrl"), NAME, detectedIsrc,
                ItunesResults.optText(hit, "trackName"), ItunesResults.optText(hit, "artistName"));
    }
}
