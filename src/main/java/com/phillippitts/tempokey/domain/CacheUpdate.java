package com.phillippitts.tempokey.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Partial update of a {@link CacheRecord}. Only the fields that were set on the builder are
 * applied; everything else on the existing record is left as it is.
 *
 * <p>This is the one place the merge rules live, so every store applies them identically:
 * <ul>
 *   <li>Algorithm results overlay per algorithm (see {@link AlgorithmResult#overlay}); storing a
 *       result for one algorithm never touches another's.</li>
 *   <li>Identity fields keep their old value when the update carries null.</li>
 *   <li>The candidate list is replaced wholesale when present.</li>
 *   <li>Error and review fields can be explicitly cleared.</li>
 * </ul>
 */
public final class CacheUpdate {

    private final String isrc;
    private final String artist;
    private final String title;
    private final Map<Algorithm, AlgorithmResult> results;
    private final Double manualTempo;
    private final String manualKey;
    private final String manualScale;
    private final ValueSource tempoSelected;
    private final ValueSource keySelected;
    private final List<PreviewCandidate> previewCandidates;
    private final String source;
    private final boolean errorSet;
    private final String error;
    private final Boolean autoMismatchFlag;
    private final boolean reviewSet;
    private final ReviewStatus reviewStatus;
    private final String reviewedBy;
    private final Instant reviewedAt;
    private final boolean touch;

    private CacheUpdate(Builder b) {
        this.isrc = b.isrc;
        this.artist = b.artist;
        this.title = b.title;
        this.results = Collections.unmodifiableMap(new EnumMap<>(b.results));
        this.manualTempo = b.manualTempo;
        this.manualKey = b.manualKey;
        this.manualScale = b.manualScale;
        this.tempoSelected = b.tempoSelected;
        this.keySelected = b.keySelected;
        this.previewCandidates = b.previewCandidates == null ? null : List.copyOf(b.previewCandidates);
        this.source = b.source;
        this.errorSet = b.errorSet;
        this.error = b.error;
        this.autoMismatchFlag = b.autoMismatchFlag;
        this.reviewSet = b.reviewSet;
        this.reviewStatus = b.reviewStatus;
        this.reviewedBy = b.reviewedBy;
        this.reviewedAt = b.reviewedAt;
        this.touch = b.touch;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<Algorithm, AlgorithmResult> results() {
        return results;
    }

    public boolean touches() {
        return touch;
    }

    /**
     * Applies this update to {@code existing} (null when the record does not exist yet).
     *
     * @param trackId  primary key of the record
     * @param existing current record or null
     * @param now      timestamp written to {@code updatedAt} when this update touches the record
     * @return the merged record
     */
    public CacheRecord applyTo(String trackId, CacheRecord existing, Instant now) {
        CacheRecord.Builder b = existing == null ? CacheRecord.builder(trackId) : existing.toBuilder();
        CacheRecord base = existing == null ? CacheRecord.builder(trackId).build() : existing;

        if (isrc != null) {
            b.isrc(isrc);
        }
        if (artist != null) {
            b.artist(artist);
        }
        if (title != null) {
            b.title(title);
        }
        results.forEach((alg, r) -> b.result(alg, base.result(alg).overlay(r)));
        if (manualTempo != null) {
            b.manualTempo(manualTempo);
        }
        if (manualKey != null) {
            b.manualKey(manualKey);
        }
        if (manualScale != null) {
            b.manualScale(manualScale);
        }
        if (previewCandidates != null) {
            b.previewCandidates(previewCandidates);
        }
        if (source != null) {
            b.source(source);
        }
        if (errorSet) {
            b.error(error);
        }
        if (autoMismatchFlag != null) {
            b.autoMismatchFlag(autoMismatchFlag);
        }
        if (reviewSet) {
            b.reviewStatus(reviewStatus).reviewedBy(reviewedBy).reviewedAt(reviewedAt);
        }
        if (touch || existing == null) {
            b.updatedAt(now);
        }

        // Selections: explicit values win; a stale default is re-derived from what is now stored.
        CacheRecord merged = b.build();
        CacheRecord.Builder out = merged.toBuilder();
        out.tempoSelected(tempoSelected != null ? tempoSelected
                : (selectionHolds(merged.tempoSelected(), merged, true) ? merged.tempoSelected() : null));
        out.keySelected(keySelected != null ? keySelected
                : (selectionHolds(merged.keySelected(), merged, false) ? merged.keySelected() : null));
        return out.build();
    }

    private static boolean selectionHolds(ValueSource selected, CacheRecord record, boolean tempo) {
        if (selected == ValueSource.MANUAL) {
            return tempo ? record.manualTempo() != null : record.manualKey() != null;
        }
        AlgorithmResult r = record.result(selected.algorithm());
        if (tempo ? r.hasTempo() : r.hasKey()) {
            return true;
        }
        // Nothing stored anywhere: keep whatever is there rather than flip-flopping.
        return record.results().values().stream().noneMatch(x -> tempo ? x.hasTempo() : x.hasKey())
                && (tempo ? record.manualTempo() == null : record.manualKey() == null);
    }

    /** Builder; each setter marks its field as present in the update. */
    public static final class Builder {
        private String isrc;
        private String artist;
        private String title;
        private final Map<Algorithm, AlgorithmResult> results = new EnumMap<>(Algorithm.class);
        private Double manualTempo;
        private String manualKey;
        private String manualScale;
        private ValueSource tempoSelected;
        private ValueSource keySelected;
        private List<PreviewCandidate> previewCandidates;
        private String source;
        private boolean errorSet;
        private String error;
        private Boolean autoMismatchFlag;
        private boolean reviewSet;
        private ReviewStatus reviewStatus;
        private String reviewedBy;
        private Instant reviewedAt;
        private boolean touch = true;

        private Builder() {
        }

        public Builder identifiers(TrackIdentifiers ids) {
            this.isrc = ids.isrc();
            this.title = ids.title();
            this.artist = ids.artists().isEmpty() ? null : ids.artistLine();
            return this;
        }

        public Builder isrc(String isrc) {
            this.isrc = isrc;
            return this;
        }

        public Builder artist(String artist) {
            this.artist = artist;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder result(Algorithm algorithm, AlgorithmResult result) {
            if (result != null) {
                this.results.put(algorithm, result);
            }
            return this;
        }

        public Builder manualTempo(Double manualTempo) {
            this.manualTempo = manualTempo;
            return this;
        }

        public Builder manualKey(String manualKey) {
            this.manualKey = manualKey;
            return this;
        }

        public Builder manualScale(String manualScale) {
            this.manualScale = manualScale;
            return this;
        }

        public Builder tempoSelected(ValueSource tempoSelected) {
            this.tempoSelected = tempoSelected;
            return this;
        }

        public Builder keySelected(ValueSource keySelected) {
            this.keySelected = keySelected;
            return this;
        }

        public Builder previewCandidates(List<PreviewCandidate> previewCandidates) {
            this.previewCandidates = previewCandidates;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder error(String error) {
            this.errorSet = true;
            this.error = error;
            return this;
        }

        public Builder clearError() {
            return error(null);
        }

        public Builder autoMismatchFlag(boolean flagged) {
            this.autoMismatchFlag = flagged;
            return this;
        }

        public Builder review(ReviewStatus status, String reviewer, Instant at) {
            this.reviewSet = true;
            this.reviewStatus = status;
            this.reviewedBy = reviewer;
            this.reviewedAt = at;
            return this;
        }

        public Builder clearReview() {
            return review(null, null, null);
        }

        /** Leave {@code updatedAt} unchanged; used for review actions, which must not extend freshness. */
        public Builder withoutTouch() {
            this.touch = false;
            return this;
        }

        public CacheUpdate build() {
            return new CacheUpdate(this);
        }
    }
}
