package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.exception.ProviderUnavailableException;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class StorefrontHttpClientTest {

    private static final URI URL = URI.create("https://itunes.test/lookup?isrc=X");

    private MockRestServiceServer server;
    private StorefrontHttpClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new StorefrontHttpClient(builder.build());
    }

    @Test
    void parsesJsonBody() {
        server.expect(requestTo(URL)).andExpect(method(GET))
                .andRespond(withSuccess("{\"resultCount\":1}", MediaType.APPLICATION_JSON));

        JSONObject body = client.getJson("itunes_isrc", URL);

        assertThat(body.getInt("resultCount")).isEqualTo(1);
        server.verify();
    }

    @Test
    void rateLimitIsProviderUnavailable() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.getJson("itunes_isrc", URL))
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessageContaining("429");
    }

    @Test
    void malformedBodyIsProviderUnavailable() {
        server.expect(requestTo(URL)).andRespond(withSuccess("<html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.getJson("itunes_isrc", URL))
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    void emptyBodyIsProviderUnavailable() {
        server.expect(requestTo(URL)).andRespond(withSuccess("", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.getJson("itunes_isrc", URL))
                .isInstanceOf(ProviderUnavailableException.class);
    }
}
