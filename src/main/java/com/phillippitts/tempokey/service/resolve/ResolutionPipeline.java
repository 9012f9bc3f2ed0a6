package com.phillippitts.tempokey.service.resolve;

import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.domain.TempoResolution;
import com.phillippitts.tempokey.domain.TrackIdentifiers;
import com.phillippitts.tempokey.exception.DetectionUnavailableException;
import com.phillippitts.tempokey.service.cache.CacheStore;
import com.phillippitts.tempokey.service.cache.FreshnessPolicy;
import com.phillippitts.tempokey.service.detection.DetectionAdapter;
import com.phillippitts.tempokey.service.detection.RawEstimate;
import com.phillippitts.tempokey.service.events.IdentityMismatchFlaggedEvent;
import com.phillippitts.tempokey.service.preview.PreviewQuery;
import com.phillippitts.tempokey.service.preview.PreviewResolution;
import com.phillippitts.tempokey.service.preview.PreviewResolver;
import com.phillippitts.tempokey.service.review.MismatchDetector;
import com.phillippitts.tempokey.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One full resolution: preview chain, identity check, detection, normalization, cache merge.
 *
 * <p>Callers run this inside the per-track in-flight region. Provider and detection failures are
 * turned into record state here and never escape:
 * <ul>
 *   <li>no preview anywhere: cached as a terminal failure (short TTL)</li>
 *   <li>estimation service unavailable: candidates are stored but no error, so the next read
 *       recomputes; the caller gets a retryable status</li>
 *   <li>estimation service rejecting the request for good (client error, not configured): cached
 *       as a terminal failure (short TTL)</li>
 * </ul>
 */
@Component
public class ResolutionPipeline {
    private static final Logger LOG = LogManager.getLogger(ResolutionPipeline.class);

    public static final String NO_PREVIEW_ERROR = "No preview audio available from any source";
    public static final String NO_ESTIMATE_ERROR = "Estimation service returned no tempo or key";

    private final CacheStore store;
    private final FreshnessPolicy freshness;
    private final PreviewResolver previews;
    private final MismatchDetector mismatchDetector;
    private final DetectionAdapter detection;
    private final ResultIngestor ingestor;
    private final ResolutionAssembler assembler;
    private final ApplicationEventPublisher publisher;

    public ResolutionPipeline(CacheStore store,
                              FreshnessPolicy freshness,
                              PreviewResolver previews,
                              MismatchDetector mismatchDetector,
                              DetectionAdapter detection,
                              ResultIngestor ingestor,
                              ResolutionAssembler assembler,
                              ApplicationEventPublisher publisher) {
        this.store = Objects.requireNonNull(store);
        this.freshness = Objects.requireNonNull(freshness);
        this.previews = Objects.requireNonNull(previews);
        this.mismatchDetector = Objects.requireNonNull(mismatchDetector);
        this.detection = Objects.requireNonNull(detection);
        this.ingestor = Objects.requireNonNull(ingestor);
        this.assembler = Objects.requireNonNull(assembler);
        this.publisher = Objects.requireNonNull(publisher);
    }

    public TempoResolution run(TrackIdentifiers ids, String country) {
        // Another caller may have finished this track while we waited for the in-flight slot.
        Optional<CacheRecord> current = store.get(ids.trackId());
        if (current.isPresent() && freshness.isFresh(current.get())) {
            return assembler.assemble(current.get(), true);
        }

        long start = System.nanoTime();
        PreviewResolution preview = previews.resolve(new PreviewQuery(ids, country));
        if (!preview.found()) {
            CacheRecord failed = store.merge(ids.trackId(), CacheUpdate.builder()
                    .identifiers(ids)
                    .previewCandidates(preview.candidates())
                    .source(preview.source())
                    .autoMismatchFlag(false)
                    .error(NO_PREVIEW_ERROR)
                    .build());
            return assembler.assemble(failed, false);
        }

        PreviewCandidate selected = preview.selected();
        boolean mismatch = mismatchDetector.isMismatch(ids, selected);
        if (mismatch) {
            publisher.publishEvent(new IdentityMismatchFlaggedEvent(ids.trackId(), selected.provider(),
                    ids.isrc(), selected.detectedIsrc(), Instant.now()));
        }

        List<RawEstimate> estimates;
        try {
            estimates = detection.analyze(selected.url());
        } catch (DetectionUnavailableException e) {
            CacheUpdate.Builder failed = CacheUpdate.builder()
                    .identifiers(ids)
                    .previewCandidates(preview.candidates())
                    .source(preview.source())
                    .autoMismatchFlag(mismatch);
            if (!e.isRetryable()) {
                CacheRecord record = store.merge(ids.trackId(), failed.error(e.getMessage()).build());
                LOG.warn("Estimation rejected track {} permanently (HTTP {}): {}", ids.trackId(), e.getStatusCode(),
                        e.getMessage());
                return assembler.assemble(record, false);
            }
            store.merge(ids.trackId(), failed.build());
            return TempoResolution.retryableFailure(ids, preview.source(), e.getMessage(), preview.candidates());
        }

        CacheUpdate.Builder update = CacheUpdate.builder()
                .identifiers(ids)
                .previewCandidates(preview.candidates())
                .source(preview.source())
                .autoMismatchFlag(mismatch);
        if (estimates.isEmpty()) {
            update.error(NO_ESTIMATE_ERROR);
        } else {
            update.clearError();
            ingestor.toResults(estimates).forEach(update::result);
        }
        CacheRecord record = store.merge(ids.trackId(), update.build());
        LOG.info("Resolved track {} via {} in {}ms (mismatch={}, algorithms={})", ids.trackId(), preview.source(),
                TimeUtils.elapsedMillis(start), record.mismatchState(), record.results().keySet());
        return assembler.assemble(record, false);
    }
}
