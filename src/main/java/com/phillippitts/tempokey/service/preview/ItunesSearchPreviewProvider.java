package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.config.properties.PreviewProperties;
import com.phillippitts.tempokey.domain.PreviewCandidate;
import org.json.JSONObject;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Storefront text search on "artists title" (provider A, fuzzy). The top hit may be a different
 * recording, which is what mismatch detection is for.
 */
@Component
class ItunesSearchPreviewProvider implements PreviewProvider {

    static final String NAME = "itunes_search";

    private final StorefrontHttpClient http;
    private final PreviewProperties props;

    ItunesSearchPreviewProvider(StorefrontHttpClient http, PreviewProperties props) {
        this.http = http;
        this.props = props;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public boolean canResolve(PreviewQuery query) {
        return !query.ids().title().isBlank();
    }

    @Override
    public PreviewCandidate resolve(PreviewQuery query) {
        String term = (query.ids().searchArtists() + " " + query.ids().title()).trim();
        URI uri = UriComponentsBuilder.fromHttpUrl(props.getItunesBaseUrl())
                .path("/search")
                .queryParam("term", "{term}")
                .queryParam("entity", "song")
                .queryParam("limit", "1")
                .queryParam("country", "{country}")
                .encode()
                .buildAndExpand(term, query.country())
                .toUri();
        JSONObject hit = ItunesResults.firstWithPreview(http.getJson(NAME, uri));
        if (hit == null) {
            return PreviewCandidate.failed(NAME, uri.toString());
        }
        return PreviewCandidate.succeeded(hit.getString("previewUrl"), NAME,
                ItunesResults.optText(hit, "isrc"),
                ItunesResults.optText(hit, "trackName"),
                ItunesResults.optText(hit, "artistName"));
    }
}
