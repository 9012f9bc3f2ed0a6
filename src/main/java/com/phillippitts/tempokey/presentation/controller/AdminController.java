package com.phillippitts.tempokey.presentation.controller;

import com.phillippitts.tempokey.config.logging.MdcFilter;
import com.phillippitts.tempokey.presentation.dto.InvalidateRequest;
import com.phillippitts.tempokey.presentation.dto.MismatchResponse;
import com.phillippitts.tempokey.presentation.dto.PendingMismatchResponse;
import com.phillippitts.tempokey.presentation.dto.RefreshPreviewRequest;
import com.phillippitts.tempokey.presentation.dto.ResolvePendingRequest;
import com.phillippitts.tempokey.presentation.dto.ReviewRequest;
import com.phillippitts.tempokey.presentation.dto.TempoResponse;
import com.phillippitts.tempokey.service.resolve.TempoResolutionService;
import com.phillippitts.tempokey.service.review.MismatchReviewService;
import com.phillippitts.tempokey.service.review.PendingMismatchResolver;
import com.phillippitts.tempokey.service.review.ReviewAction;
import com.phillippitts.tempokey.service.security.CallerContext;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Privileged operations. The caller is identified by {@link MdcFilter} from {@code X-User-ID};
 * roles come from the configured admin lists.
 */
@RestController
@RequestMapping("/api/admin")
class AdminController {

    private final TempoResolutionService resolution;
    private final MismatchReviewService review;
    private final PendingMismatchResolver pending;

    AdminController(TempoResolutionService resolution, MismatchReviewService review, PendingMismatchResolver pending) {
        this.resolution = resolution;
        this.review = review;
        this.pending = pending;
    }

    @PostMapping("/cache/invalidate")
    Map<String, Integer> invalidate(@Valid @RequestBody InvalidateRequest request,
                                    @RequestAttribute(MdcFilter.CALLER_ATTRIBUTE) CallerContext caller) {
        return Map.of("removed", resolution.invalidate(caller, request.trackIds()));
    }

    @PostMapping("/preview/refresh")
    TempoResponse refreshPreview(@Valid @RequestBody RefreshPreviewRequest request,
                                 @RequestAttribute(MdcFilter.CALLER_ATTRIBUTE) CallerContext caller) {
        return TempoResponse.from(resolution.refreshPreview(caller, request.trackId(), request.country()));
    }

    @GetMapping("/mismatches")
    List<MismatchResponse> mismatches(@RequestParam(defaultValue = "50") int limit,
                                      @RequestAttribute(MdcFilter.CALLER_ATTRIBUTE) CallerContext caller) {
        return review.list(caller, limit).stream().map(MismatchResponse::from).toList();
    }

    @PatchMapping("/mismatches")
    MismatchResponse review(@Valid @RequestBody ReviewRequest request,
                            @RequestAttribute(MdcFilter.CALLER_ATTRIBUTE) CallerContext caller) {
        ReviewAction action = ReviewAction.fromWireName(request.action());
        return MismatchResponse.from(review.review(caller, request.trackId(), action));
    }

    @DeleteMapping("/mismatches/{trackId}/review")
    MismatchResponse clearReview(@PathVariable String trackId,
                                 @RequestAttribute(MdcFilter.CALLER_ATTRIBUTE) CallerContext caller) {
        return MismatchResponse.from(review.clearReview(caller, trackId));
    }

    @PostMapping("/mismatches/resolve-all")
    PendingMismatchResponse resolvePending(@RequestBody(required = false) ResolvePendingRequest request,
                                           @RequestAttribute(MdcFilter.CALLER_ATTRIBUTE) CallerContext caller) {
        ResolvePendingRequest body = request == null ? new ResolvePendingRequest(null, null) : request;
        return PendingMismatchResponse.from(pending.resolveAll(caller, body.limitOrDefault(), body.country()));
    }
}
