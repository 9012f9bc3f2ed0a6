package com.phillippitts.tempokey.presentation.controller;

import com.phillippitts.tempokey.config.logging.MdcFilter;
import com.phillippitts.tempokey.config.properties.PreviewProperties;
import com.phillippitts.tempokey.domain.TempoResolution;
import com.phillippitts.tempokey.presentation.dto.IngestRequest;
import com.phillippitts.tempokey.presentation.dto.IsrcBatchRequest;
import com.phillippitts.tempokey.presentation.dto.ResolveRequest;
import com.phillippitts.tempokey.presentation.dto.SelectionRequest;
import com.phillippitts.tempokey.presentation.dto.TempoResponse;
import com.phillippitts.tempokey.service.health.DetectionServiceHealthIndicator;
import com.phillippitts.tempokey.service.resolve.TempoResolutionService;
import com.phillippitts.tempokey.service.security.CallerContext;
import com.phillippitts.tempokey.util.CountryCodes;
import jakarta.validation.Valid;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tempo/key reads, batch reads by ISRC, external ingest and operator selection.
 */
@RestController
@RequestMapping("/api/tempo")
class TempoController {

    private final TempoResolutionService service;
    private final DetectionServiceHealthIndicator health;
    private final PreviewProperties previewProps;

    TempoController(TempoResolutionService service,
                    DetectionServiceHealthIndicator health,
                    PreviewProperties previewProps) {
        this.service = service;
        this.health = health;
        this.previewProps = previewProps;
    }

    @GetMapping("/tracks/{trackId}")
    TempoResponse byTrackId(@PathVariable String trackId,
                            @RequestParam(required = false) String country,
                            @RequestHeader(value = HttpHeaders.ACCEPT_LANGUAGE, required = false) String acceptLanguage) {
        return TempoResponse.from(service.resolveTrackId(trackId, country(country, acceptLanguage)));
    }

    @PostMapping("/resolve")
    TempoResponse resolve(@Valid @RequestBody ResolveRequest request,
                          @RequestHeader(value = HttpHeaders.ACCEPT_LANGUAGE, required = false) String acceptLanguage) {
        return TempoResponse.from(service.resolve(request.track(), country(request.country(), acceptLanguage)));
    }

    @PostMapping("/by-isrc/batch")
    Map<String, TempoResponse> byIsrc(@Valid @RequestBody IsrcBatchRequest request) {
        Map<String, TempoResponse> out = new LinkedHashMap<>();
        for (Map.Entry<String, TempoResolution> e : service.batchByIsrc(request.isrcs()).entrySet()) {
            out.put(e.getKey(), TempoResponse.from(e.getValue()));
        }
        return out;
    }

    @PostMapping("/ingest")
    TempoResponse ingest(@RequestBody IngestRequest request) {
        return TempoResponse.from(service.ingest(request.toCommand()));
    }

    @PostMapping("/selection")
    TempoResponse selection(@RequestBody SelectionRequest request,
                            @RequestAttribute(MdcFilter.CALLER_ATTRIBUTE) CallerContext caller) {
        return TempoResponse.from(service.updateSelection(caller, request.toCommand()));
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        Health h = health.health();
        HttpStatus status = Status.UP.equals(h.getStatus()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", h.getStatus().getCode());
        body.putAll(h.getDetails());
        return ResponseEntity.status(status).body(body);
    }

    private String country(String explicit, String acceptLanguage) {
        if (explicit != null && !explicit.isBlank()) {
            return CountryCodes.normalize(explicit, previewProps.getDefaultCountry());
        }
        return CountryCodes.fromAcceptLanguage(acceptLanguage, previewProps.getDefaultCountry());
    }
}
