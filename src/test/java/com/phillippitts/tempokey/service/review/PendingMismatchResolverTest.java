package com.phillippitts.tempokey.service.review;

import com.phillippitts.tempokey.domain.Algorithm;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.domain.CatalogTrack;
import com.phillippitts.tempokey.domain.ResolutionStatus;
import com.phillippitts.tempokey.domain.ReviewStatus;
import com.phillippitts.tempokey.domain.TrackIdentifiers;
import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.exception.PermissionDeniedException;
import com.phillippitts.tempokey.service.detection.RawEstimate;
import com.phillippitts.tempokey.service.review.PendingMismatchReport.Outcome;
import com.phillippitts.tempokey.service.review.PendingMismatchReport.Status;
import com.phillippitts.tempokey.service.security.CallerContext;
import com.phillippitts.tempokey.service.security.Role;
import com.phillippitts.tempokey.testutil.FakePreviewProvider;
import com.phillippitts.tempokey.testutil.FakePreviewProvider.Mode;
import com.phillippitts.tempokey.testutil.ResolutionHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class PendingMismatchResolverTest {

    private static final CallerContext ADMIN = CallerContext.of("ops", Role.ADMIN);
    private static final String ISRC = "USABC1234567";
    private static final TrackIdentifiers IDS = new TrackIdentifiers("t1", ISRC, "Song", List.of("Band"), null);

    private FakePreviewProvider search;
    private FakePreviewProvider isrcLookup;
    private ResolutionHarness h;
    private PendingMismatchResolver resolver;

    @BeforeEach
    void setUp() {
        search = new FakePreviewProvider("itunes_search", 5, Mode.HIT).detectedIsrc("GBXYZ9900001");
        isrcLookup = new FakePreviewProvider("itunes_isrc", 10, Mode.HIT).detectedIsrc(ISRC);
        h = new ResolutionHarness(search, isrcLookup);
        h.detection.estimates(new RawEstimate(Algorithm.ESSENTIA, 120.0, 0.9, "A", "minor", 0.8));
        resolver = h.pendingMismatches();
    }

    @Test
    void flaggedTrackIsReResolvedFromExactIsrcPreview() {
        assertThat(h.pipeline.run(IDS, "us").status()).isEqualTo(ResolutionStatus.SUPPRESSED_PENDING_REVIEW);
        h.clock.advance(Duration.ofMinutes(10));
        h.detection.estimates(new RawEstimate(Algorithm.ESSENTIA, 98.0, 0.9, "C", "major", 0.8));

        PendingMismatchReport report = resolver.resolveAll(ADMIN, 50, "us");

        assertThat(report.processed()).isEqualTo(1);
        assertThat(report.resolved()).isEqualTo(1);
        assertThat(report.results()).singleElement().satisfies(o -> {
            assertThat(o.status()).isEqualTo(Status.RESOLVED);
            assertThat(o.previewUrl()).isEqualTo(isrcLookup.url());
            assertThat(o.isrc()).isEqualTo(ISRC);
        });
        CacheRecord stored = h.store.get("t1").orElseThrow();
        assertThat(stored.isAutoMismatchFlag()).isFalse();
        assertThat(stored.isIsrcMismatch()).isFalse();
        assertThat(stored.reviewStatus()).isEqualTo(ReviewStatus.MATCH);
        assertThat(stored.reviewedBy()).isEqualTo("ops");
        assertThat(stored.source()).isEqualTo("itunes_isrc");
        assertThat(stored.result(Algorithm.ESSENTIA).tempo()).isEqualTo(98.0);
        assertThat(h.assembler.assemble(stored, true).status()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(resolver.resolveAll(ADMIN, 50, "us").processed()).isZero();
    }

    @Test
    void tracksWithoutIsrcOrExactPreviewAreSkipped() {
        isrcLookup.mode(Mode.MISS);
        h.store.merge("no-isrc", CacheUpdate.builder().title("Untitled").autoMismatchFlag(true).build());
        h.clock.advance(Duration.ofMinutes(1));
        h.store.merge("t1", CacheUpdate.builder().identifiers(IDS).autoMismatchFlag(true).build());
        h.clock.advance(Duration.ofMinutes(1));
        h.store.merge("confirmed", CacheUpdate.builder().isrc("USZZZ0000009").autoMismatchFlag(true)
                .review(ReviewStatus.MATCH, "ops", h.clock.instant()).build());

        PendingMismatchReport report = resolver.resolveAll(ADMIN, 50, null);

        assertThat(report.processed()).isEqualTo(2);
        assertThat(report.skipped()).isEqualTo(2);
        assertThat(report.results()).extracting(Outcome::trackId, Outcome::reason).containsExactly(
                tuple("t1", PendingMismatchResolver.NO_PREVIEW),
                tuple("no-isrc", PendingMismatchResolver.MISSING_ISRC));
        assertThat(h.detection.analyzeCalls()).isZero();
        assertThat(h.store.get("t1").orElseThrow().isAutoMismatchFlag()).isTrue();
    }

    @Test
    void catalogSuppliesMissingIsrc() {
        h.catalog.add(new CatalogTrack("t2", "Other", List.of("Band"), ISRC, null));
        h.store.merge("t2", CacheUpdate.builder().title("Other").autoMismatchFlag(true).build());

        PendingMismatchReport report = resolver.resolveAll(ADMIN, 10, "us");

        assertThat(report.resolved()).isEqualTo(1);
        assertThat(h.store.get("t2").orElseThrow().isrc()).isEqualTo(ISRC);
    }

    @Test
    void estimationFailureIsReportedAndRunContinues() {
        h.store.merge("t1", CacheUpdate.builder().identifiers(IDS).autoMismatchFlag(true).build());
        h.clock.advance(Duration.ofMinutes(1));
        h.store.merge("no-isrc", CacheUpdate.builder().autoMismatchFlag(true).build());
        h.detection.down(true);

        PendingMismatchReport report = resolver.resolveAll(ADMIN, 10, "us");

        assertThat(report.processed()).isEqualTo(2);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.skipped()).isEqualTo(1);
        Outcome failed = report.results().stream().filter(o -> o.status() == Status.FAILED).findFirst().orElseThrow();
        assertThat(failed.trackId()).isEqualTo("t1");
        assertThat(failed.reason()).contains("HTTP 503");
        assertThat(h.store.get("t1").orElseThrow().reviewStatus()).isNull();
    }

    @Test
    void requiresAdminAndBoundedLimit() {
        assertThatThrownBy(() -> resolver.resolveAll(CallerContext.anonymous(), 10, "us"))
                .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> resolver.resolveAll(ADMIN, 0, "us"))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> resolver.resolveAll(ADMIN, PendingMismatchResolver.MAX_LIMIT + 1, "us"))
                .isInstanceOf(InvalidRequestException.class);
    }
}
