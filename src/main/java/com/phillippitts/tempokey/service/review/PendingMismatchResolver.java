package com.phillippitts.tempokey.service.review;

import com.phillippitts.tempokey.config.properties.PreviewProperties;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.domain.CatalogTrack;
import com.phillippitts.tempokey.domain.ReviewStatus;
import com.phillippitts.tempokey.domain.TrackIdentifiers;
import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.service.cache.CacheStore;
import com.phillippitts.tempokey.service.catalog.CatalogClient;
import com.phillippitts.tempokey.service.dedup.InFlightCoordinator;
import com.phillippitts.tempokey.service.detection.DetectionAdapter;
import com.phillippitts.tempokey.service.detection.RawEstimate;
import com.phillippitts.tempokey.service.identity.IdentifierExtractor;
import com.phillippitts.tempokey.service.preview.PreviewQuery;
import com.phillippitts.tempokey.service.preview.PreviewResolution;
import com.phillippitts.tempokey.service.preview.PreviewResolver;
import com.phillippitts.tempokey.service.resolve.ResolutionPipeline;
import com.phillippitts.tempokey.service.resolve.ResultIngestor;
import com.phillippitts.tempokey.service.review.PendingMismatchReport.Outcome;
import com.phillippitts.tempokey.service.security.CallerContext;
import com.phillippitts.tempokey.service.security.Role;
import com.phillippitts.tempokey.util.CountryCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Re-resolves auto-flagged tracks that nobody has confirmed as a match.
 *
 * <p>Each track is re-run against previews whose detected ISRC equals the track's own. When one is
 * found and the estimation service answers, the new results replace the old, the automatic flag is
 * lifted and the caller is recorded as having confirmed the match. Tracks without an ISRC or
 * without an exact preview are skipped; estimation failures are reported per track and never stop
 * the run.
 */
@Service
public class PendingMismatchResolver {
    private static final Logger LOG = LogManager.getLogger(PendingMismatchResolver.class);

    public static final int MAX_LIMIT = 1000;
    public static final String MISSING_ISRC = "missing_isrc";
    public static final String NO_PREVIEW = "no_preview";
    public static final String NOT_PENDING = "not_pending";

    static final String RESOLVE_PURPOSE = "mismatch-resolve";

    private final CacheStore store;
    private final CatalogClient catalog;
    private final IdentifierExtractor extractor;
    private final PreviewResolver previews;
    private final DetectionAdapter detection;
    private final ResultIngestor ingestor;
    private final InFlightCoordinator inFlight;
    private final PreviewProperties previewProps;
    private final Clock clock;

    public PendingMismatchResolver(CacheStore store,
                                   CatalogClient catalog,
                                   IdentifierExtractor extractor,
                                   PreviewResolver previews,
                                   DetectionAdapter detection,
                                   ResultIngestor ingestor,
                                   InFlightCoordinator inFlight,
                                   PreviewProperties previewProps,
                                   Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.catalog = Objects.requireNonNull(catalog);
        this.extractor = Objects.requireNonNull(extractor);
        this.previews = Objects.requireNonNull(previews);
        this.detection = Objects.requireNonNull(detection);
        this.ingestor = Objects.requireNonNull(ingestor);
        this.inFlight = Objects.requireNonNull(inFlight);
        this.previewProps = Objects.requireNonNull(previewProps);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Works through up to {@code limit} pending mismatches, most recently updated first.
     *
     * @param country storefront country, or null for the configured default
     * @throws InvalidRequestException when {@code limit} is outside 1..{@value #MAX_LIMIT}
     */
    public PendingMismatchReport resolveAll(CallerContext caller, int limit, String country) {
        caller.require(Role.ADMIN, "Resolving pending mismatches");
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidRequestException("limit", "limit must be between 1 and " + MAX_LIMIT);
        }
        String storefront = CountryCodes.normalize(country, previewProps.getDefaultCountry());
        List<Outcome> outcomes = new ArrayList<>();
        for (CacheRecord pending : store.findPendingMismatches(limit)) {
            outcomes.add(resolveOne(caller, pending, storefront));
        }
        PendingMismatchReport report = PendingMismatchReport.of(outcomes);
        LOG.info("Pending mismatches re-resolved by {}: {} processed, {} resolved, {} skipped, {} failed",
                caller.auditName(), report.processed(), report.resolved(), report.skipped(), report.failed());
        return report;
    }

    private Outcome resolveOne(CallerContext caller, CacheRecord pending, String country) {
        String trackId = pending.trackId();
        try {
            return inFlight.run(trackId, RESOLVE_PURPOSE, () -> resolveNow(caller, trackId, country));
        } catch (RuntimeException e) {
            LOG.warn("Re-resolving track {} failed: {}", trackId, e.getMessage());
            return Outcome.failed(trackId, e.getMessage(), pending.isrc());
        }
    }

    private Outcome resolveNow(CallerContext caller, String trackId, String country) {
        Optional<CacheRecord> current = store.get(trackId);
        if (current.isEmpty() || !isPending(current.get())) {
            return Outcome.skipped(trackId, NOT_PENDING, current.map(CacheRecord::isrc).orElse(null));
        }
        TrackIdentifiers ids = identifiers(current.get());
        if (!ids.hasIsrc()) {
            return Outcome.skipped(trackId, MISSING_ISRC, null);
        }
        String isrc = ids.isrc();
        PreviewResolution preview = previews.resolve(new PreviewQuery(ids, country),
                c -> isrc.equals(IdentifierExtractor.normalizeIsrc(c.detectedIsrc())));
        if (!preview.found()) {
            return Outcome.skipped(trackId, NO_PREVIEW, isrc);
        }
        String url = preview.selected().url();
        List<RawEstimate> estimates = detection.analyze(url);
        if (estimates.isEmpty()) {
            return Outcome.failed(trackId, ResolutionPipeline.NO_ESTIMATE_ERROR, isrc);
        }
        CacheUpdate.Builder update = CacheUpdate.builder()
                .identifiers(ids)
                .previewCandidates(preview.candidates())
                .source(preview.source())
                .autoMismatchFlag(false)
                .clearError()
                .review(ReviewStatus.MATCH, caller.auditName(), clock.instant());
        ingestor.toResults(estimates).forEach(update::result);
        store.merge(trackId, update.build());
        LOG.info("Track {} re-resolved via {} with exact ISRC {}", trackId, preview.source(), isrc);
        return Outcome.resolved(trackId, url, isrc);
    }

    private TrackIdentifiers identifiers(CacheRecord record) {
        TrackIdentifiers stored = TrackIdentifiers.fromRecord(record);
        if (stored.hasIsrc()) {
            return stored;
        }
        Optional<CatalogTrack> track = catalog.findTrack(record.trackId());
        return track.map(extractor::extract).orElse(stored);
    }

    private static boolean isPending(CacheRecord r) {
        return r.isAutoMismatchFlag() && r.reviewStatus() != ReviewStatus.MATCH;
    }
}
