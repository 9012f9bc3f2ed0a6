package com.phillippitts.tempokey.service.cache;

import com.phillippitts.tempokey.domain.Algorithm;
import com.phillippitts.tempokey.domain.AlgorithmResult;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.domain.ReviewStatus;
import com.phillippitts.tempokey.domain.ValueSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour every {@link CacheStore} must share.
 */
abstract class CacheStoreContractTest {

    protected abstract CacheStore store();

    protected abstract void advance(Duration d);

    private static AlgorithmResult tempo(double bpm) {
        return new AlgorithmResult(bpm, bpm / 2, 0.8, null, null, null);
    }

    @Test
    void mergeCreatesThenOverlays() {
        store().merge("t1", CacheUpdate.builder().isrc("USAAA0000001").title("One").artist("A")
                .result(Algorithm.ESSENTIA, tempo(120.0)).build());
        advance(Duration.ofMinutes(1));
        CacheRecord r = store().merge("t1", CacheUpdate.builder()
                .result(Algorithm.LIBROSA, new AlgorithmResult(121.0, 60.5, 0.4, "C", "major", 0.6))
                .build());

        CacheRecord stored = store().get("t1").orElseThrow();
        assertThat(stored).isEqualTo(r);
        assertThat(stored.result(Algorithm.ESSENTIA).tempo()).isEqualTo(120.0);
        assertThat(stored.result(Algorithm.LIBROSA).key()).isEqualTo("C");
        assertThat(stored.isrc()).isEqualTo("USAAA0000001");
        assertThat(stored.tempoSelected()).isEqualTo(ValueSource.ESSENTIA);
    }

    @Test
    void concurrentMergesOfDifferentAlgorithmsKeepBoth() throws Exception {
        List<String> trackIds = List.of("c1", "c2", "c3", "c4", "c5");
        for (String id : trackIds) {
            store().merge(id, CacheUpdate.builder().isrc("USAAA0000001").title("Seed").build());
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CacheRecord>> futures = new ArrayList<>();
            for (String id : trackIds) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return store().merge(id, CacheUpdate.builder().result(Algorithm.ESSENTIA, tempo(120.0)).build());
                }));
                futures.add(pool.submit(() -> {
                    start.await();
                    return store().merge(id, CacheUpdate.builder()
                            .result(Algorithm.LIBROSA, new AlgorithmResult(121.0, 60.5, 0.4, "C", "major", 0.6))
                            .build());
                }));
            }
            start.countDown();
            for (Future<CacheRecord> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        for (String id : trackIds) {
            CacheRecord r = store().get(id).orElseThrow();
            assertThat(r.results()).containsOnlyKeys(Algorithm.ESSENTIA, Algorithm.LIBROSA);
            assertThat(r.result(Algorithm.ESSENTIA).tempo()).isEqualTo(120.0);
            assertThat(r.result(Algorithm.LIBROSA).key()).isEqualTo("C");
            assertThat(r.title()).isEqualTo("Seed");
        }
    }

    @Test
    void previewCandidatesRoundTrip() {
        List<PreviewCandidate> candidates = List.of(
                PreviewCandidate.failed("itunes_isrc", "https://itunes.test/lookup?isrc=X"),
                PreviewCandidate.succeeded("https://cdn.test/p.m4a", "deezer", "USAAA0000001", "One", "A"));

        store().merge("t1", CacheUpdate.builder().previewCandidates(candidates).source("deezer").build());

        CacheRecord r = store().get("t1").orElseThrow();
        assertThat(r.previewCandidates()).containsExactlyElementsOf(candidates);
        assertThat(r.previewUrl()).isEqualTo("https://cdn.test/p.m4a");
    }

    @Test
    void mergeExistingIgnoresUnknownTrack() {
        assertThat(store().mergeExisting("missing", CacheUpdate.builder().source("x").build())).isEmpty();
        assertThat(store().get("missing")).isEmpty();
    }

    @Test
    void findByIsrcReturnsMostRecentlyUpdated() {
        store().merge("old", CacheUpdate.builder().isrc("USAAA0000001").result(Algorithm.ESSENTIA, tempo(100.0)).build());
        advance(Duration.ofMinutes(5));
        store().merge("new", CacheUpdate.builder().isrc("USAAA0000001").result(Algorithm.ESSENTIA, tempo(101.0)).build());

        assertThat(store().findByIsrc("USAAA0000001")).map(CacheRecord::trackId).contains("new");
        assertThat(store().findByIsrc("USZZZ9999999")).isEmpty();
    }

    @Test
    void batchByIsrcReturnsOnlyKnownIsrcs() {
        store().merge("t1", CacheUpdate.builder().isrc("USAAA0000001").build());
        store().merge("t2", CacheUpdate.builder().isrc("USAAA0000002").build());

        Map<String, CacheRecord> found = store().getBatchByIsrc(List.of("USAAA0000001", "USAAA0000002", "USAAA0000003"));

        assertThat(found).containsOnlyKeys("USAAA0000001", "USAAA0000002");
        assertThat(found.get("USAAA0000002").trackId()).isEqualTo("t2");
    }

    @Test
    void deleteRemovesRecord() {
        store().merge("t1", CacheUpdate.builder().source("x").build());

        assertThat(store().delete("t1")).isTrue();
        assertThat(store().delete("t1")).isFalse();
        assertThat(store().get("t1")).isEmpty();
    }

    @Test
    void findMismatchesListsFlaggedAndReviewedRecords() {
        store().merge("clean", CacheUpdate.builder().autoMismatchFlag(false).build());
        store().merge("flagged", CacheUpdate.builder().autoMismatchFlag(true).build());
        advance(Duration.ofMinutes(1));
        store().merge("reviewed", CacheUpdate.builder().autoMismatchFlag(false)
                .review(ReviewStatus.MISMATCH, "ops", Instant.parse("2024-05-01T12:01:00Z")).build());

        List<CacheRecord> mismatches = store().findMismatches(10);

        assertThat(mismatches).extracting(CacheRecord::trackId).containsExactly("reviewed", "flagged");
        assertThat(store().findMismatches(1)).hasSize(1);
    }

    @Test
    void findPendingMismatchesSkipsConfirmedMatches() {
        store().merge("flagged", CacheUpdate.builder().autoMismatchFlag(true).build());
        advance(Duration.ofMinutes(1));
        store().merge("confirmed-mismatch", CacheUpdate.builder().autoMismatchFlag(true)
                .review(ReviewStatus.MISMATCH, "ops", Instant.parse("2024-05-01T12:01:00Z")).build());
        store().merge("confirmed-match", CacheUpdate.builder().autoMismatchFlag(true)
                .review(ReviewStatus.MATCH, "ops", Instant.parse("2024-05-01T12:01:00Z")).build());
        store().merge("clean", CacheUpdate.builder().autoMismatchFlag(false).build());

        assertThat(store().findPendingMismatches(10)).extracting(CacheRecord::trackId)
                .containsExactlyInAnyOrder("confirmed-mismatch", "flagged");
        assertThat(store().findPendingMismatches(1)).extracting(CacheRecord::trackId)
                .containsExactly("confirmed-mismatch");
    }

    @Test
    void reviewDoesNotExtendUpdatedAt() {
        CacheRecord before = store().merge("t1", CacheUpdate.builder().autoMismatchFlag(true).build());
        advance(Duration.ofHours(3));

        CacheRecord after = store().mergeExisting("t1", CacheUpdate.builder()
                .review(ReviewStatus.MATCH, "ops", before.updatedAt().plusSeconds(10)).withoutTouch().build())
                .orElseThrow();

        assertThat(after.updatedAt()).isEqualTo(before.updatedAt());
        assertThat(store().get("t1").orElseThrow().reviewStatus()).isEqualTo(ReviewStatus.MATCH);
    }
}
