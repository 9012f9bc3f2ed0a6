package com.phillippitts.tempokey.presentation.controller;

import com.phillippitts.tempokey.config.ThreadPoolConfig;
import com.phillippitts.tempokey.config.properties.ThreadPoolProperties;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.MismatchState;
import com.phillippitts.tempokey.domain.ReviewStatus;
import com.phillippitts.tempokey.exception.PermissionDeniedException;
import com.phillippitts.tempokey.exception.TrackNotFoundException;
import com.phillippitts.tempokey.service.resolve.TempoResolutionService;
import com.phillippitts.tempokey.service.review.MismatchEntry;
import com.phillippitts.tempokey.service.review.MismatchReviewService;
import com.phillippitts.tempokey.service.review.PendingMismatchReport;
import com.phillippitts.tempokey.service.review.PendingMismatchReport.Outcome;
import com.phillippitts.tempokey.service.review.PendingMismatchReport.Status;
import com.phillippitts.tempokey.service.review.PendingMismatchResolver;
import com.phillippitts.tempokey.service.review.ReviewAction;
import com.phillippitts.tempokey.service.security.CallerContextResolver;
import com.phillippitts.tempokey.service.security.Role;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AdminController.class,
        properties = {"tempo.admin.user-ids=ops-1", "tempo.admin.super-user-ids=root-1"})
@Import({CallerContextResolver.class, ThreadPoolConfig.class, ThreadPoolProperties.class})
class AdminControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private TempoResolutionService resolution;

    @MockBean
    private MismatchReviewService review;

    @MockBean
    private PendingMismatchResolver pending;

    @Test
    void invalidateReportsRemovedCount() throws Exception {
        when(resolution.invalidate(argThat(c -> c.has(Role.ADMIN)), eq(List.of("trk-1", "trk-2")))).thenReturn(1);

        mvc.perform(post("/api/admin/cache/invalidate")
                        .header("X-User-ID", "ops-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trackIds\":[\"trk-1\",\"trk-2\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(1));
    }

    @Test
    void anonymousInvalidateIsForbidden() throws Exception {
        when(resolution.invalidate(argThat(c -> c.userId() == null), any()))
                .thenThrow(new PermissionDeniedException("invalidate", "ADMIN"));

        mvc.perform(post("/api/admin/cache/invalidate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trackIds\":[\"trk-1\"]}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void listsMismatches() throws Exception {
        MismatchEntry entry = new MismatchEntry("trk-3", "ISRC3", "Song", "Band", "https://p/3.mp3", "deezer",
                true, null, MismatchState.FLAGGED_PENDING, null, null, Instant.parse("2026-01-02T00:00:00Z"));
        when(review.list(argThat(c -> c.has(Role.ADMIN)), eq(10))).thenReturn(List.of(entry));

        mvc.perform(get("/api/admin/mismatches").param("limit", "10").header("X-User-ID", "ops-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].trackId").value("trk-3"))
                .andExpect(jsonPath("$[0].isrcMismatch").value(true))
                .andExpect(jsonPath("$[0].state").value("FLAGGED_PENDING"));
    }

    @Test
    void nonNumericLimitIsRejected() throws Exception {
        mvc.perform(get("/api/admin/mismatches").param("limit", "lots").header("X-User-ID", "ops-1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(review);
    }

    @Test
    void confirmsMatch() throws Exception {
        CacheRecord reviewed = CacheRecord.builder("trk-3")
                .isrc("ISRC3")
                .autoMismatchFlag(true)
                .reviewStatus(ReviewStatus.MATCH)
                .reviewedBy("ops-1")
                .reviewedAt(Instant.parse("2026-01-03T00:00:00Z"))
                .updatedAt(Instant.parse("2026-01-02T00:00:00Z"))
                .build();
        when(review.review(any(), eq("trk-3"), eq(ReviewAction.CONFIRM_MATCH))).thenReturn(reviewed);

        mvc.perform(patch("/api/admin/mismatches")
                        .header("X-User-ID", "ops-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trackId\":\"trk-3\",\"action\":\"confirm_match\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isrcMismatch").value(false))
                .andExpect(jsonPath("$.autoFlag").value(true))
                .andExpect(jsonPath("$.reviewStatus").value("match"))
                .andExpect(jsonPath("$.reviewedBy").value("ops-1"));
    }

    @Test
    void unknownActionIsRejected() throws Exception {
        mvc.perform(patch("/api/admin/mismatches")
                        .header("X-User-ID", "ops-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trackId\":\"trk-3\",\"action\":\"maybe\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequestException"));

        verifyNoInteractions(review);
    }

    @Test
    void clearReviewOfMissingTrackIs404() throws Exception {
        when(review.clearReview(argThat(c -> c.has(Role.SUPER_ADMIN)), eq("trk-404")))
                .thenThrow(new TrackNotFoundException("trk-404"));

        mvc.perform(delete("/api/admin/mismatches/trk-404/review").header("X-User-ID", "root-1"))
                .andExpect(status().isNotFound());

        verify(review).clearReview(any(), eq("trk-404"));
    }

    @Test
    void refreshPreviewRequiresTrackId() throws Exception {
        mvc.perform(post("/api/admin/preview/refresh")
                        .header("X-User-ID", "ops-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"country\":\"us\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(resolution);
    }

    @Test
    void resolvesPendingMismatchesWithRequestedLimit() throws Exception {
        PendingMismatchReport report = new PendingMismatchReport(2, 1, 1, 0, List.of(
                new Outcome("trk-5", Status.RESOLVED, null, "https://p/5.m4a", "ISRC5"),
                new Outcome("trk-6", Status.SKIPPED, PendingMismatchResolver.NO_PREVIEW, null, "ISRC6")));
        when(pending.resolveAll(argThat(c -> c.has(Role.ADMIN)), eq(25), eq("gb"))).thenReturn(report);

        mvc.perform(post("/api/admin/mismatches/resolve-all")
                        .header("X-User-ID", "ops-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limit\":25,\"country\":\"gb\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(2))
                .andExpect(jsonPath("$.resolved").value(1))
                .andExpect(jsonPath("$.skipped").value(1))
                .andExpect(jsonPath("$.results[0].status").value("resolved"))
                .andExpect(jsonPath("$.results[1].reason").value("no_preview"));
    }

    @Test
    void resolvePendingWithoutBodyUsesDefaultLimit() throws Exception {
        when(pending.resolveAll(any(), eq(100), isNull()))
                .thenReturn(new PendingMismatchReport(0, 0, 0, 0, List.of()));

        mvc.perform(post("/api/admin/mismatches/resolve-all").header("X-User-ID", "root-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(0));

        verify(pending).resolveAll(argThat(c -> c.has(Role.SUPER_ADMIN)), eq(100), isNull());
    }

    @Test
    void anonymousResolvePendingIsForbidden() throws Exception {
        when(pending.resolveAll(argThat(c -> c.userId() == null), eq(100), isNull()))
                .thenThrow(new PermissionDeniedException("Resolving pending mismatches", "ADMIN"));

        mvc.perform(post("/api/admin/mismatches/resolve-all"))
                .andExpect(status().isForbidden());
    }
}
