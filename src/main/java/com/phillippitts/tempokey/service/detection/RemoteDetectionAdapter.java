package com.phillippitts.tempokey.service.detection;

import com.phillippitts.tempokey.config.properties.DetectionProperties;
import com.phillippitts.tempokey.exception.DetectionUnavailableException;
import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.service.metrics.ResolutionMetrics;
import com.phillippitts.tempokey.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * HTTP client for the remote estimation service.
 *
 * <p>Endpoints: {@code POST /bpm}, {@code POST /analyze/batch}, {@code GET /stream/{id}} (NDJSON),
 * {@code GET /batch/{id}}, {@code GET /health}. Requests carry a bearer token when the
 * {@link IdentityTokenProvider} has one.
 */
@Component
public class RemoteDetectionAdapter implements DetectionAdapter {
    private static final Logger LOG = LogManager.getLogger(RemoteDetectionAdapter.class);

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final RestClient restClient;
    private final RestClient streamClient;
    private final DetectionProperties props;
    private final IdentityTokenProvider tokens;
    private final ResolutionMetrics metrics;

    public RemoteDetectionAdapter(@Qualifier("detectionRestClient") RestClient restClient,
                                  @Qualifier("detectionStreamRestClient") RestClient streamClient,
                                  DetectionProperties props,
                                  IdentityTokenProvider tokens,
                                  ResolutionMetrics metrics) {
        this.restClient = Objects.requireNonNull(restClient);
        this.streamClient = Objects.requireNonNull(streamClient);
        this.props = Objects.requireNonNull(props);
        this.tokens = Objects.requireNonNull(tokens);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public List<RawEstimate> analyze(String excerptUrl) {
        requireConfigured();
        long start = System.nanoTime();
        try {
            String body = restClient.post()
                    .uri("/bpm")
                    .headers(this::authorize)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new JSONObject().put("url", excerptUrl).toString())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw rejected("Analysis", res.getStatusCode().value());
                    })
                    .body(String.class);
            List<RawEstimate> estimates = DetectionJsonParser.parseAnalysis(body);
            metrics.recordDetectionLatency(System.nanoTime() - start);
            LOG.debug("Analyzed {} -> {} estimate(s)", LogSanitizer.url(excerptUrl), estimates.size());
            return estimates;
        } catch (DetectionUnavailableException e) {
            fail("analyze", e);
            throw e;
        } catch (RestClientException e) {
            DetectionUnavailableException ex = new DetectionUnavailableException("Analysis request failed", e);
            fail("analyze", ex);
            throw ex;
        }
    }

    @Override
    public String submitBatch(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new InvalidRequestException("urls", "at least one URL is required");
        }
        requireConfigured();
        JSONObject payload = new JSONObject()
                .put("urls", new JSONArray(urls))
                .put("max_confidence", props.getMaxConfidence())
                .put("debug_level", "normal");
        try {
            String body = restClient.post()
                    .uri("/analyze/batch")
                    .headers(this::authorize)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload.toString())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw rejected("Batch submission", res.getStatusCode().value());
                    })
                    .body(String.class);
            String batchId = DetectionJsonParser.parseBatchId(body);
            LOG.info("Submitted batch {} ({} urls)", batchId, urls.size());
            return batchId;
        } catch (DetectionUnavailableException e) {
            fail("submit", e);
            throw e;
        } catch (RestClientException e) {
            DetectionUnavailableException ex = new DetectionUnavailableException("Batch submission failed", e);
            fail("submit", ex);
            throw ex;
        }
    }

    @Override
    public BatchResultStream openStream(String batchId) {
        requireConfigured();
        try {
            return streamClient.get()
                    .uri("/stream/{batchId}", batchId)
                    .headers(this::authorize)
                    .accept(NDJSON, MediaType.ALL)
                    .exchange((req, res) -> {
                        if (res.getStatusCode().isError()) {
                            int status = res.getStatusCode().value();
                            res.close();
                            throw rejected("Stream", status);
                        }
                        return new BatchResultStream(res.getBody(), res);
                    }, false);
        } catch (DetectionUnavailableException e) {
            fail("stream", e);
            throw e;
        } catch (RestClientException e) {
            DetectionUnavailableException ex = new DetectionUnavailableException("Stream request failed", e);
            fail("stream", ex);
            throw ex;
        }
    }

    @Override
    public BatchPoll pollBatch(String batchId) {
        requireConfigured();
        try {
            String body = restClient.get()
                    .uri("/batch/{batchId}", batchId)
                    .headers(this::authorize)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw rejected("Poll", res.getStatusCode().value());
                    })
                    .body(String.class);
            return DetectionJsonParser.parsePoll(body);
        } catch (DetectionUnavailableException e) {
            fail("poll", e);
            throw e;
        } catch (RestClientException e) {
            DetectionUnavailableException ex = new DetectionUnavailableException("Poll request failed", e);
            fail("poll", ex);
            throw ex;
        }
    }

    @Override
    public void checkHealth() {
        requireConfigured();
        String body;
        try {
            body = restClient.get()
                    .uri("/health")
                    .headers(this::authorize)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw rejected("Health check", res.getStatusCode().value());
                    })
                    .body(String.class);
        } catch (RestClientException e) {
            throw new DetectionUnavailableException("Health check failed", e);
        }
        if (body != null && !body.isBlank() && !isOkBody(body.trim())) {
            throw new DetectionUnavailableException("Health check answered: " + LogSanitizer.truncate(body, 80));
        }
    }

    private static boolean isOkBody(String body) {
        String b = body.toLowerCase(Locale.ROOT);
        return b.equals("ok") || b.equals("\"ok\"") || b.replace(" ", "").contains("\"status\":\"ok\"");
    }

    private void authorize(HttpHeaders headers) {
        tokens.currentToken().ifPresent(headers::setBearerAuth);
    }

    private void requireConfigured() {
        if (!props.isConfigured()) {
            throw new DetectionUnavailableException("Estimation service not configured (tempo.detection.base-url)",
                    0, false, null);
        }
    }

    private void fail(String operation, DetectionUnavailableException e) {
        metrics.incrementDetectionFailure(e.getStatusCode() > 0 ? "http_" + e.getStatusCode() : operation);
        LOG.warn("Estimation service {} failed: {}", operation, e.getMessage());
    }

    static DetectionUnavailableException rejected(String what, int status) {
        boolean retryable = status >= 500 || status == 429 || status == 408;
        return new DetectionUnavailableException(what + " rejected: HTTP " + status, status, retryable, null);
    }
}
