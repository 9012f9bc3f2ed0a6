package com.phillippitts.tempokey.service.resolve;

import com.phillippitts.tempokey.domain.Algorithm;
import com.phillippitts.tempokey.domain.AlgorithmResult;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.service.cache.CacheStore;
import com.phillippitts.tempokey.service.detection.BatchRecord;
import com.phillippitts.tempokey.service.detection.RawEstimate;
import com.phillippitts.tempokey.service.identity.IdentifierExtractor;
import com.phillippitts.tempokey.service.normalize.TempoNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes detection output into the cache through the merge contract. Shared by the resolve
 * pipeline, the external ingest endpoint and batch stream ingestion, so all three normalize and
 * merge identically.
 */
@Component
public class ResultIngestor {
    private static final Logger LOG = LogManager.getLogger(ResultIngestor.class);

    private final CacheStore store;
    private final TempoNormalizer normalizer;

    public ResultIngestor(CacheStore store, TempoNormalizer normalizer) {
        this.store = Objects.requireNonNull(store);
        this.normalizer = Objects.requireNonNull(normalizer);
    }

    /** Normalizes raw estimates into per-algorithm results; the raw tempo is kept alongside. */
    public Map<Algorithm, AlgorithmResult> toResults(List<RawEstimate> estimates) {
        Map<Algorithm, AlgorithmResult> out = new EnumMap<>(Algorithm.class);
        for (RawEstimate e : estimates) {
            out.put(e.algorithm(), new AlgorithmResult(
                    normalizer.normalize(e.tempoRaw()),
                    e.tempoRaw(),
                    e.tempoConfidence(),
                    e.key(),
                    e.scale(),
                    e.keyConfidence()));
        }
        return out;
    }

    /**
     * Stores an externally computed result.
     *
     * @throws InvalidRequestException when trackId, source, algorithm or every result value is missing
     */
    public CacheRecord ingest(IngestCommand cmd) {
        if (cmd == null) {
            throw new InvalidRequestException("result", "request body is required");
        }
        if (isBlank(cmd.trackId())) {
            throw new InvalidRequestException("trackId", "trackId is required");
        }
        if (isBlank(cmd.source())) {
            throw new InvalidRequestException("source", "preview provenance source is required");
        }
        if (isBlank(cmd.algorithm())) {
            throw new InvalidRequestException("result", "result with an algorithm is required");
        }
        Algorithm algorithm;
        try {
            algorithm = Algorithm.fromWireName(cmd.algorithm());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("result.algorithm", e.getMessage());
        }
        Double raw = cmd.tempoRaw() != null ? cmd.tempoRaw() : cmd.tempo();
        RawEstimate estimate = new RawEstimate(algorithm, raw, cmd.confidence(),
                blankToNull(cmd.key()), blankToNull(cmd.scale()), cmd.keyConfidence());
        if (estimate.isEmpty()) {
            throw new InvalidRequestException("result", "result carries no tempo or key");
        }

        CacheUpdate.Builder update = CacheUpdate.builder()
                .isrc(IdentifierExtractor.normalizeIsrc(cmd.isrc()))
                .title(blankToNull(cmd.title()))
                .artist(blankToNull(cmd.artist()))
                .source(cmd.source().trim())
                .clearError();
        toResults(List.of(estimate)).forEach(update::result);
        if (!isBlank(cmd.previewUrl())) {
            update.previewCandidates(List.of(PreviewCandidate.succeeded(cmd.previewUrl().trim(), cmd.source().trim(),
                    null, null, null)));
        }
        CacheRecord r = store.merge(cmd.trackId().trim(), update.build());
        LOG.info("Ingested {} result for track {} (source={})", algorithm.wireName(), r.trackId(), r.source());
        return r;
    }

    /**
     * Merges one batch stream record into the owning track's record. Items the service reported
     * as failed are only recorded as an error when the record has no values yet.
     */
    public Optional<CacheRecord> ingestBatchRecord(String trackId, BatchRecord rec) {
        if (!rec.estimates().isEmpty()) {
            CacheUpdate.Builder update = CacheUpdate.builder().clearError();
            toResults(rec.estimates()).forEach(update::result);
            return Optional.of(store.merge(trackId, update.build()));
        }
        if (rec.hasError() && rec.finalRecord()) {
            Optional<CacheRecord> existing = store.get(trackId);
            boolean hasValues = existing.map(r -> !r.results().isEmpty()).orElse(false);
            if (!hasValues) {
                LOG.debug("Batch item for track {} failed: {}", trackId, rec.error());
                return Optional.of(store.merge(trackId, CacheUpdate.builder().error(rec.error()).build()));
            }
        }
        return Optional.empty();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
