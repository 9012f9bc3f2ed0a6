package com.phillippitts.tempokey.presentation.controller;

import com.phillippitts.tempokey.config.properties.PreviewProperties;
import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.presentation.dto.BulkRequest;
import com.phillippitts.tempokey.presentation.dto.BulkResponse;
import com.phillippitts.tempokey.presentation.dto.UrlBatchRequest;
import com.phillippitts.tempokey.service.bulk.BatchProgress;
import com.phillippitts.tempokey.service.bulk.BulkAnalysisService;
import com.phillippitts.tempokey.service.bulk.BulkStream;
import com.phillippitts.tempokey.util.CountryCodes;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bulk analysis: batch preparation and submission, NDJSON read-back, polling fallback.
 */
@RestController
@RequestMapping("/api/tempo/bulk")
class BulkController {
    private static final Logger LOG = LogManager.getLogger(BulkController.class);

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final BulkAnalysisService bulk;
    private final PreviewProperties previewProps;

    BulkController(BulkAnalysisService bulk, PreviewProperties previewProps) {
        this.bulk = bulk;
        this.previewProps = previewProps;
    }

    @PostMapping
    BulkResponse prepare(@RequestBody BulkRequest request,
                         @RequestHeader(value = HttpHeaders.ACCEPT_LANGUAGE, required = false) String acceptLanguage) {
        String country = request.country() != null && !request.country().isBlank()
                ? CountryCodes.normalize(request.country(), previewProps.getDefaultCountry())
                : CountryCodes.fromAcceptLanguage(acceptLanguage, previewProps.getDefaultCountry());
        return BulkResponse.from(bulk.prepare(request.tracks(), request.trackIds(), country));
    }

    @PostMapping("/urls")
    Map<String, String> submitUrls(@Valid @RequestBody UrlBatchRequest request) {
        return Map.of("batchId", bulk.submitUrls(request.urls()));
    }

    /**
     * @param skip indices the consumer already received as final (restarted stream)
     */
    @GetMapping("/{batchId}/stream")
    ResponseEntity<StreamingResponseBody> stream(@PathVariable String batchId,
                                                 @RequestParam(required = false) List<String> skip) {
        BulkStream stream = bulk.openStream(batchId, parseIndices(skip));
        StreamingResponseBody body = out -> {
            int n = stream.writeTo(out);
            LOG.debug("Wrote {} records for batch {}", n, batchId);
        };
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .body(body);
    }

    @GetMapping("/{batchId}")
    BatchProgress poll(@PathVariable String batchId) {
        return bulk.poll(batchId);
    }

    static Set<Integer> parseIndices(List<String> values) {
        Set<Integer> out = new HashSet<>();
        if (values == null) {
            return out;
        }
        for (String v : values) {
            for (String part : v.split(",")) {
                String p = part.trim();
                if (p.isEmpty()) {
                    continue;
                }
                try {
                    out.add(Integer.parseInt(p));
                } catch (NumberFormatException e) {
                    throw new InvalidRequestException("skip", "skip must be a list of integers");
                }
            }
        }
        return out;
    }
}
