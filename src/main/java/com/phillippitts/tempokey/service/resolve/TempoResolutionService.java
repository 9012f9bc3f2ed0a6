package com.phillippitts.tempokey.service.resolve;

import com.phillippitts.tempokey.config.properties.CacheProperties;
import com.phillippitts.tempokey.config.properties.PreviewProperties;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.domain.CatalogTrack;
import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.domain.TempoResolution;
import com.phillippitts.tempokey.domain.TrackIdentifiers;
import com.phillippitts.tempokey.domain.ValueSource;
import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.exception.TrackNotFoundException;
import com.phillippitts.tempokey.service.cache.CacheStore;
import com.phillippitts.tempokey.service.cache.FreshnessPolicy;
import com.phillippitts.tempokey.service.catalog.CatalogClient;
import com.phillippitts.tempokey.service.dedup.InFlightCoordinator;
import com.phillippitts.tempokey.service.identity.IdentifierExtractor;
import com.phillippitts.tempokey.service.metrics.ResolutionMetrics;
import com.phillippitts.tempokey.service.normalize.TempoNormalizer;
import com.phillippitts.tempokey.service.preview.PreviewQuery;
import com.phillippitts.tempokey.service.preview.PreviewResolution;
import com.phillippitts.tempokey.service.preview.PreviewResolver;
import com.phillippitts.tempokey.service.review.MismatchDetector;
import com.phillippitts.tempokey.service.security.CallerContext;
import com.phillippitts.tempokey.service.security.Role;
import com.phillippitts.tempokey.util.CountryCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for tempo/key reads and writes.
 *
 * <p>Reads serve fresh cache records directly. Everything else goes through the
 * {@link ResolutionPipeline} inside a per-track {@link InFlightCoordinator} region, so concurrent
 * callers for one track share a single provider fan-out.
 */
@Service
public class TempoResolutionService {
    private static final Logger LOG = LogManager.getLogger(TempoResolutionService.class);

    static final String RESOLVE_PURPOSE = "resolve";
    static final String REFRESH_PURPOSE = "refresh-preview";

    private final CacheStore store;
    private final FreshnessPolicy freshness;
    private final IdentifierExtractor extractor;
    private final ResolutionPipeline pipeline;
    private final ResolutionAssembler assembler;
    private final CatalogClient catalog;
    private final PreviewResolver previews;
    private final MismatchDetector mismatchDetector;
    private final CacheProperties cacheProps;
    private final PreviewProperties previewProps;
    private final ResultIngestor ingestor;
    private final ResolutionMetrics metrics;
    private final InFlightCoordinator inFlight;

    public TempoResolutionService(CacheStore store,
                                  FreshnessPolicy freshness,
                                  IdentifierExtractor extractor,
                                  ResolutionPipeline pipeline,
                                  ResolutionAssembler assembler,
                                  CatalogClient catalog,
                                  PreviewResolver previews,
                                  MismatchDetector mismatchDetector,
                                  CacheProperties cacheProps,
                                  PreviewProperties previewProps,
                                  ResultIngestor ingestor,
                                  ResolutionMetrics metrics,
                                  InFlightCoordinator inFlight) {
        this.store = Objects.requireNonNull(store);
        this.freshness = Objects.requireNonNull(freshness);
        this.extractor = Objects.requireNonNull(extractor);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.assembler = Objects.requireNonNull(assembler);
        this.catalog = Objects.requireNonNull(catalog);
        this.previews = Objects.requireNonNull(previews);
        this.mismatchDetector = Objects.requireNonNull(mismatchDetector);
        this.cacheProps = Objects.requireNonNull(cacheProps);
        this.previewProps = Objects.requireNonNull(previewProps);
        this.ingestor = Objects.requireNonNull(ingestor);
        this.metrics = Objects.requireNonNull(metrics);
        this.inFlight = Objects.requireNonNull(inFlight);
    }

    /**
     * Resolves a caller-supplied catalog track.
     *
     * @param country storefront country, or null for the configured default
     * @throws InvalidRequestException when the track has no ID
     */
    public TempoResolution resolve(CatalogTrack track, String country) {
        TrackIdentifiers ids = identifiers(track);
        Optional<CacheRecord> existing = store.get(ids.trackId());
        if (existing.isPresent() && freshness.isFresh(existing.get())) {
            metrics.incrementCacheOutcome("hit");
            return assembler.assemble(existing.get(), true);
        }
        if (existing.isEmpty() && ids.hasIsrc()) {
            Optional<CacheRecord> shared = store.findByIsrc(ids.isrc()).filter(freshness::isFresh);
            if (shared.isPresent()) {
                metrics.incrementCacheOutcome("isrc-hit");
                LOG.debug("Serving track {} from record {} via ISRC {}", ids.trackId(), shared.get().trackId(),
                        ids.isrc());
                return assembler.assemble(shared.get(), true, ids.trackId());
            }
        }
        metrics.incrementCacheOutcome(existing.isPresent() ? "stale" : "miss");
        String storefront = CountryCodes.normalize(country, previewProps.getDefaultCountry());
        return inFlight.run(ids.trackId(), RESOLVE_PURPOSE, () -> pipeline.run(ids, storefront));
    }

    /**
     * Resolves by catalog ID. A track the catalog does not know is still answered from any cached
     * record.
     *
     * @throws TrackNotFoundException when neither the cache nor the catalog knows the track
     */
    public TempoResolution resolveTrackId(String trackId, String country) {
        requireTrackId(trackId);
        String id = trackId.trim();
        Optional<CacheRecord> existing = store.get(id);
        if (existing.isPresent() && freshness.isFresh(existing.get())) {
            metrics.incrementCacheOutcome("hit");
            return assembler.assemble(existing.get(), true);
        }
        Optional<CatalogTrack> track = catalog.findTrack(id);
        if (track.isPresent()) {
            return resolve(track.get(), country);
        }
        if (existing.isPresent()) {
            metrics.incrementCacheOutcome("stale");
            return assembler.assemble(existing.get(), false);
        }
        throw new TrackNotFoundException(id);
    }

    /**
     * Batch read by ISRC in a single store round trip. Never computes anything; ISRCs without a
     * record map to a {@code cached:false} entry.
     */
    public Map<String, TempoResolution> batchByIsrc(List<String> isrcs) {
        if (isrcs == null || isrcs.isEmpty()) {
            throw new InvalidRequestException("isrcs", "at least one ISRC is required");
        }
        if (isrcs.size() > cacheProps.getBatchLimit()) {
            throw new InvalidRequestException("isrcs", "at most " + cacheProps.getBatchLimit() + " ISRCs per request");
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (String raw : isrcs) {
            String isrc = IdentifierExtractor.normalizeIsrc(raw);
            if (isrc != null) {
                wanted.add(isrc);
            }
        }
        Map<String, CacheRecord> found = store.getBatchByIsrc(wanted);
        Map<String, TempoResolution> out = new LinkedHashMap<>();
        for (String isrc : wanted) {
            CacheRecord r = found.get(isrc);
            out.put(isrc, r == null ? TempoResolution.notCached(isrc) : assembler.assemble(r, true));
        }
        return out;
    }

    /**
     * Stores an externally computed result through the merge contract.
     *
     * @throws InvalidRequestException when trackId, result or provenance source is missing
     */
    public TempoResolution ingest(IngestCommand cmd) {
        return assembler.assemble(ingestor.ingest(cmd), false);
    }

    /** Drops records so the next read recomputes. */
    public int invalidate(CallerContext caller, List<String> trackIds) {
        caller.require(Role.ADMIN, "Cache invalidation");
        if (trackIds == null || trackIds.isEmpty()) {
            throw new InvalidRequestException("trackIds", "at least one trackId is required");
        }
        int removed = 0;
        for (String id : trackIds) {
            if (id != null && !id.isBlank() && store.delete(id.trim())) {
                removed++;
            }
        }
        LOG.info("Invalidated {} of {} requested records (by {})", removed, trackIds.size(), caller.auditName());
        return removed;
    }

    /**
     * Changes which source is authoritative and/or the manual values.
     *
     * @throws InvalidRequestException for unknown sources, an empty change, or selecting manual
     *                                 without a manual value
     * @throws TrackNotFoundException  when the record does not exist
     */
    public TempoResolution updateSelection(CallerContext caller, SelectionCommand cmd) {
        caller.require(Role.ADMIN, "Selection update");
        if (cmd == null || cmd.isEmpty()) {
            throw new InvalidRequestException("at least one of tempoSelected, keySelected, manualTempo, "
                    + "manualKey, manualScale is required");
        }
        requireTrackId(cmd.trackId());
        String trackId = cmd.trackId().trim();
        ValueSource tempoSel = parseSource("tempoSelected", cmd.tempoSelected());
        ValueSource keySel = parseSource("keySelected", cmd.keySelected());
        if (cmd.manualTempo() != null && (cmd.manualTempo().isNaN() || cmd.manualTempo() <= 0)) {
            throw new InvalidRequestException("manualTempo", "manualTempo must be a positive number");
        }
        if ((cmd.manualKey() == null) != (cmd.manualScale() == null)) {
            throw new InvalidRequestException("manualKey", "manualKey and manualScale must be given together");
        }

        CacheRecord existing = store.get(trackId).orElseThrow(() -> new TrackNotFoundException(trackId));
        if (tempoSel == ValueSource.MANUAL && cmd.manualTempo() == null && existing.manualTempo() == null) {
            throw new InvalidRequestException("tempoSelected", "selecting manual tempo requires manualTempo");
        }
        if (keySel == ValueSource.MANUAL && cmd.manualKey() == null
                && (existing.manualKey() == null || existing.manualScale() == null)) {
            throw new InvalidRequestException("keySelected", "selecting manual key requires manualKey and manualScale");
        }

        CacheUpdate.Builder update = CacheUpdate.builder()
                .tempoSelected(tempoSel)
                .keySelected(keySel)
                .manualKey(cmd.manualKey() == null ? null : cmd.manualKey().trim())
                .manualScale(cmd.manualScale() == null ? null : cmd.manualScale().trim().toLowerCase(Locale.ROOT));
        if (cmd.manualTempo() != null) {
            update.manualTempo(TempoNormalizer.round1(cmd.manualTempo()));
        }
        CacheRecord r = store.mergeExisting(trackId, update.build())
                .orElseThrow(() -> new TrackNotFoundException(trackId));
        LOG.info("Selection updated on track {} by {}: tempo={}, key={}", trackId, caller.auditName(),
                r.tempoSelected(), r.keySelected());
        return assembler.assemble(r, false);
    }

    /**
     * Re-runs only the preview chain and replaces the record's candidates and source; algorithm and
     * manual fields stay as they are.
     */
    public TempoResolution refreshPreview(CallerContext caller, String trackId, String country) {
        caller.require(Role.ADMIN, "Preview refresh");
        requireTrackId(trackId);
        String id = trackId.trim();
        String storefront = CountryCodes.normalize(country, previewProps.getDefaultCountry());
        return inFlight.run(id, REFRESH_PURPOSE, () -> refreshPreviewNow(caller, id, storefront));
    }

    private TempoResolution refreshPreviewNow(CallerContext caller, String id, String storefront) {
        CacheRecord existing = store.get(id).orElseThrow(() -> new TrackNotFoundException(id));
        TrackIdentifiers ids = catalog.findTrack(id).map(this::identifiers)
                .orElseGet(() -> TrackIdentifiers.fromRecord(existing));
        PreviewResolution preview = previews.resolve(new PreviewQuery(ids, storefront));
        PreviewCandidate selected = preview.selected();
        CacheUpdate.Builder update = CacheUpdate.builder()
                .previewCandidates(preview.candidates())
                .source(preview.source())
                .autoMismatchFlag(mismatchDetector.isMismatch(ids, selected));
        if (preview.found() && ResolutionPipeline.NO_PREVIEW_ERROR.equals(existing.error())) {
            update.clearError();
        }
        CacheRecord r = store.mergeExisting(id, update.build()).orElseThrow(() -> new TrackNotFoundException(id));
        LOG.info("Preview refreshed on track {} by {}: source={}", id, caller.auditName(), r.source());
        return assembler.assemble(r, false);
    }

    private TrackIdentifiers identifiers(CatalogTrack track) {
        if (track == null) {
            throw new InvalidRequestException("track", "track is required");
        }
        try {
            return extractor.extract(track);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("trackId", e.getMessage());
        }
    }

    private static ValueSource parseSource(String field, String value) {
        if (value == null) {
            return null;
        }
        try {
            return ValueSource.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(field, field + " must be one of essentia, librosa, manual");
        }
    }

    private static void requireTrackId(String trackId) {
        if (trackId == null || trackId.isBlank()) {
            throw new InvalidRequestException("trackId", "trackId is required");
        }
    }
}
