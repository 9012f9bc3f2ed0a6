package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.exception.ProviderUnavailableException;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.Objects;

/**
 * JSON GET against a public storefront API. The underlying client enforces the per-attempt
 * timeout; every failure mode surfaces as {@link ProviderUnavailableException}.
 */
@Component
public class StorefrontHttpClient {

    private final RestClient restClient;

    public StorefrontHttpClient(@Qualifier("previewRestClient") RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient);
    }

    public JSONObject getJson(String provider, URI uri) {
        String body;
        try {
            body = restClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw new ProviderUnavailableException(provider, "HTTP " + res.getStatusCode().value());
                    })
                    .body(String.class);
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(provider, "request failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new ProviderUnavailableException(provider, "empty response body");
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new ProviderUnavailableException(provider, "malformed payload", e);
        }
    }
}
