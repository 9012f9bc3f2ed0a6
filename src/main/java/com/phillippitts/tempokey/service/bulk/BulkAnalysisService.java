package com.phillippitts.tempokey.service.bulk;

import com.phillippitts.tempokey.config.properties.CacheProperties;
import com.phillippitts.tempokey.config.properties.PreviewProperties;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.domain.CatalogTrack;
import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.domain.TempoResolution;
import com.phillippitts.tempokey.domain.TrackIdentifiers;
import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.exception.TempoKeyException;
import com.phillippitts.tempokey.service.cache.CacheStore;
import com.phillippitts.tempokey.service.cache.FreshnessPolicy;
import com.phillippitts.tempokey.service.catalog.CatalogClient;
import com.phillippitts.tempokey.service.dedup.InFlightCoordinator;
import com.phillippitts.tempokey.service.detection.BatchPoll;
import com.phillippitts.tempokey.service.detection.BatchRecord;
import com.phillippitts.tempokey.service.detection.DetectionAdapter;
import com.phillippitts.tempokey.service.events.IdentityMismatchFlaggedEvent;
import com.phillippitts.tempokey.service.identity.IdentifierExtractor;
import com.phillippitts.tempokey.service.normalize.TempoNormalizer;
import com.phillippitts.tempokey.service.preview.PreviewQuery;
import com.phillippitts.tempokey.service.preview.PreviewResolution;
import com.phillippitts.tempokey.service.preview.PreviewResolver;
import com.phillippitts.tempokey.service.resolve.ResolutionAssembler;
import com.phillippitts.tempokey.service.resolve.ResolutionPipeline;
import com.phillippitts.tempokey.service.resolve.ResultIngestor;
import com.phillippitts.tempokey.service.review.MismatchDetector;
import com.phillippitts.tempokey.util.CountryCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Bulk re-analysis of many tracks through the estimation service's batch interface.
 *
 * <p>Preparation resolves previews concurrently on the bulk executor (each track's provider chain
 * itself stays sequential), answers fresh tracks straight from the cache, and submits the rest
 * as one batch. A track listed twice is prepared once. Preparing a track shares the per-track
 * {@link InFlightCoordinator} with single-track resolution, so the two never run the preview chain
 * for one track at the same time. Results come back through {@link #openStream} or {@link #poll} and are merged
 * into the cache as they arrive.
 */
@Service
public class BulkAnalysisService {
    private static final Logger LOG = LogManager.getLogger(BulkAnalysisService.class);

    static final String PREPARE_PURPOSE = "bulk-prepare";

    private final CacheStore store;
    private final FreshnessPolicy freshness;
    private final CatalogClient catalog;
    private final IdentifierExtractor extractor;
    private final PreviewResolver previews;
    private final MismatchDetector mismatchDetector;
    private final DetectionAdapter detection;
    private final ResultIngestor ingestor;
    private final ResolutionAssembler assembler;
    private final BatchRegistry registry;
    private final TempoNormalizer normalizer;
    private final CacheProperties cacheProps;
    private final PreviewProperties previewProps;
    private final ApplicationEventPublisher publisher;
    private final Executor executor;
    private final InFlightCoordinator inFlight;

    public BulkAnalysisService(CacheStore store,
                               FreshnessPolicy freshness,
                               CatalogClient catalog,
                               IdentifierExtractor extractor,
                               PreviewResolver previews,
                               MismatchDetector mismatchDetector,
                               DetectionAdapter detection,
                               ResultIngestor ingestor,
                               ResolutionAssembler assembler,
                               BatchRegistry registry,
                               TempoNormalizer normalizer,
                               CacheProperties cacheProps,
                               PreviewProperties previewProps,
                               ApplicationEventPublisher publisher,
                               @Qualifier("bulkExecutor") Executor executor,
                               InFlightCoordinator inFlight) {
        this.store = Objects.requireNonNull(store);
        this.freshness = Objects.requireNonNull(freshness);
        this.catalog = Objects.requireNonNull(catalog);
        this.extractor = Objects.requireNonNull(extractor);
        this.previews = Objects.requireNonNull(previews);
        this.mismatchDetector = Objects.requireNonNull(mismatchDetector);
        this.detection = Objects.requireNonNull(detection);
        this.ingestor = Objects.requireNonNull(ingestor);
        this.assembler = Objects.requireNonNull(assembler);
        this.registry = Objects.requireNonNull(registry);
        this.normalizer = Objects.requireNonNull(normalizer);
        this.cacheProps = Objects.requireNonNull(cacheProps);
        this.previewProps = Objects.requireNonNull(previewProps);
        this.publisher = Objects.requireNonNull(publisher);
        this.executor = Objects.requireNonNull(executor);
        this.inFlight = Objects.requireNonNull(inFlight);
    }

    /**
     * Prepares and submits a batch. Tracks may be given in full or by ID (looked up in the catalog).
     *
     * @throws InvalidRequestException when no tracks are given or the batch limit is exceeded
     * @throws com.phillippitts.tempokey.exception.DetectionUnavailableException when submission fails
     */
    public BulkSubmission prepare(List<CatalogTrack> tracks, List<String> trackIds, String country) {
        List<CatalogTrack> given = tracks == null ? List.of() : tracks;
        List<String> ids = trackIds == null ? List.of() : trackIds;
        int total = given.size() + ids.size();
        if (total == 0) {
            throw new InvalidRequestException("tracks", "tracks or trackIds are required");
        }
        if (total > cacheProps.getBatchLimit()) {
            throw new InvalidRequestException("tracks", "at most " + cacheProps.getBatchLimit() + " tracks per batch");
        }
        String storefront = CountryCodes.normalize(country, previewProps.getDefaultCountry());

        Set<String> seen = new LinkedHashSet<>();
        List<CompletableFuture<Prepared>> futures = new ArrayList<>();
        for (CatalogTrack t : given) {
            TrackIdentifiers tid = identifiers(t);
            if (seen.add(tid.trackId())) {
                futures.add(CompletableFuture.supplyAsync(() -> prepareOne(tid, storefront), executor));
            }
        }
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                throw new InvalidRequestException("trackIds", "trackIds must not contain blanks");
            }
            String trimmed = id.trim();
            if (seen.add(trimmed)) {
                futures.add(CompletableFuture.supplyAsync(() -> prepareById(trimmed, storefront), executor));
            }
        }

        List<String> indexToTrackId = new ArrayList<>();
        List<String> urls = new ArrayList<>();
        Map<String, PreviewMeta> meta = new LinkedHashMap<>();
        Map<String, TempoResolution> immediate = new LinkedHashMap<>();
        for (CompletableFuture<Prepared> f : futures) {
            Prepared p = join(f);
            if (p.immediate() != null) {
                immediate.put(p.trackId(), p.immediate());
            } else {
                indexToTrackId.add(p.trackId());
                urls.add(p.queued().url());
                meta.put(p.trackId(), p.queued());
            }
        }

        String batchId = null;
        if (!urls.isEmpty()) {
            batchId = detection.submitBatch(urls);
            registry.register(batchId, indexToTrackId);
        }
        LOG.info("Bulk prepared: {} tracks ({} distinct), {} queued, {} immediate, batch={}", total, seen.size(),
                urls.size(), immediate.size(), batchId);
        return new BulkSubmission(batchId, indexToTrackId, meta, immediate);
    }

    /** Submits caller-supplied excerpt URLs; results are not written to the cache. */
    public String submitUrls(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new InvalidRequestException("urls", "at least one URL is required");
        }
        if (urls.size() > cacheProps.getBatchLimit()) {
            throw new InvalidRequestException("urls", "at most " + cacheProps.getBatchLimit() + " URLs per batch");
        }
        for (String u : urls) {
            if (u == null || !(u.startsWith("http://") || u.startsWith("https://"))) {
                throw new InvalidRequestException("urls", "every URL must be http(s)");
            }
        }
        return detection.submitBatch(urls);
    }

    /**
     * Opens the read-back of a batch. The upstream connection is established here, so failures
     * surface before any response bytes are written.
     *
     * @param skipFinalized indices the consumer already holds as final
     */
    public BulkStream openStream(String batchId, Set<Integer> skipFinalized) {
        requireBatchId(batchId);
        if (!registry.isRegistered(batchId)) {
            LOG.debug("Batch {} was not prepared here; streamed results will not be cached", batchId);
        }
        return new BulkStream(batchId, detection.openStream(batchId), skipFinalized, registry, ingestor, normalizer);
    }

    /** Polling fallback; final records of batches prepared here are merged into the cache. */
    public BatchProgress poll(String batchId) {
        requireBatchId(batchId);
        BatchPoll poll = detection.pollBatch(batchId);
        List<Map<String, Object>> results = new ArrayList<>();
        for (BatchRecord r : poll.results()) {
            Optional<String> trackId = registry.trackFor(batchId, r.index());
            if (r.finalRecord()) {
                trackId.ifPresent(id -> ingestor.ingestBatchRecord(id, r));
            }
            results.add(BatchRecordJson.toJson(r, trackId.orElse(null), normalizer).toMap());
        }
        return new BatchProgress(batchId, results, poll.done());
    }

    private Prepared prepareById(String trackId, String country) {
        Optional<CacheRecord> existing = store.get(trackId);
        if (existing.isPresent() && freshness.isFresh(existing.get())) {
            return Prepared.immediate(trackId, assembler.assemble(existing.get(), true));
        }
        Optional<CatalogTrack> track = catalog.findTrack(trackId);
        if (track.isEmpty()) {
            return Prepared.immediate(trackId, existing.map(r -> assembler.assemble(r, false))
                    .orElseGet(() -> TempoResolution.unknownTrack(trackId, "Track not found: " + trackId)));
        }
        return prepareOne(identifiers(track.get()), country);
    }

    private Prepared prepareOne(TrackIdentifiers ids, String country) {
        return inFlight.run(ids.trackId(), PREPARE_PURPOSE, () -> prepareNow(ids, country));
    }

    private Prepared prepareNow(TrackIdentifiers ids, String country) {
        Optional<CacheRecord> existing = store.get(ids.trackId());
        if (existing.isPresent() && freshness.isFresh(existing.get())) {
            return Prepared.immediate(ids.trackId(), assembler.assemble(existing.get(), true));
        }
        PreviewResolution preview = previews.resolve(new PreviewQuery(ids, country));
        if (!preview.found()) {
            CacheRecord failed = store.merge(ids.trackId(), CacheUpdate.builder()
                    .identifiers(ids)
                    .previewCandidates(preview.candidates())
                    .source(preview.source())
                    .autoMismatchFlag(false)
                    .error(ResolutionPipeline.NO_PREVIEW_ERROR)
                    .build());
            return Prepared.immediate(ids.trackId(), assembler.assemble(failed, false));
        }
        PreviewCandidate selected = preview.selected();
        boolean mismatch = mismatchDetector.isMismatch(ids, selected);
        if (mismatch) {
            publisher.publishEvent(new IdentityMismatchFlaggedEvent(ids.trackId(), selected.provider(),
                    ids.isrc(), selected.detectedIsrc(), Instant.now()));
        }
        store.merge(ids.trackId(), CacheUpdate.builder()
                .identifiers(ids)
                .previewCandidates(preview.candidates())
                .source(preview.source())
                .autoMismatchFlag(mismatch)
                .build());
        return Prepared.queued(new PreviewMeta(ids.trackId(), selected.url(), preview.source(), mismatch));
    }

    private TrackIdentifiers identifiers(CatalogTrack track) {
        if (track == null) {
            throw new InvalidRequestException("tracks", "tracks must not contain nulls");
        }
        try {
            return extractor.extract(track);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("tracks", e.getMessage());
        }
    }

    private static Prepared join(CompletableFuture<Prepared> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new TempoKeyException("Bulk preparation failed", e.getCause());
        }
    }

    private static void requireBatchId(String batchId) {
        if (batchId == null || batchId.isBlank()) {
            throw new InvalidRequestException("batchId", "batchId is required");
        }
    }

    private record Prepared(String trackId, TempoResolution immediate, PreviewMeta queued) {
        static Prepared immediate(String trackId, TempoResolution r) {
            return new Prepared(trackId, r, null);
        }

        static Prepared queued(PreviewMeta meta) {
            return new Prepared(meta.trackId(), null, meta);
        }
    }
}
