package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.config.properties.PreviewProperties;
import com.phillippitts.tempokey.domain.PreviewCandidate;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Fielded text search on the second storefront (provider B). Last resort of the chain.
 */
@Component
class DeezerSearchPreviewProvider implements PreviewProvider {

    static final String NAME = "deezer";

    private final StorefrontHttpClient http;
    private final PreviewProperties props;

    DeezerSearchPreviewProvider(StorefrontHttpClient http, PreviewProperties props) {
        this.http = http;
        this.props = props;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public boolean canResolve(PreviewQuery query) {
        return !query.ids().title().isBlank();
    }

    @Override
    public PreviewCandidate resolve(PreviewQuery query) {
        String q = "artist:\"" + query.ids().searchArtists() + "\" track:\"" + query.ids().title() + "\"";
        URI uri = UriComponentsBuilder.fromHttpUrl(props.getDeezerBaseUrl())
                .path("/search")
                .queryParam("q", "{q}")
                .encode()
                .buildAndExpand(q)
                .toUri();
        JSONObject body = http.getJson(NAME, uri);
        JSONArray data = body.optJSONArray("data");
        JSONObject hit = data == null || data.isEmpty() ? null : data.optJSONObject(0);
        String preview = hit == null ? null : ItunesResults.optText(hit, "preview");
        if (preview == null) {
            return PreviewCandidate.failed(NAME, uri.toString());
        }
        JSONObject artist = hit.optJSONObject("artist");
        return PreviewCandidate.succeeded(preview, NAME,
                ItunesResults.optText(hit, "isrc"),
                ItunesResults.optText(hit, "title"),
                artist == null ? null : ItunesResults.optText(artist, "name"));
    }
}
