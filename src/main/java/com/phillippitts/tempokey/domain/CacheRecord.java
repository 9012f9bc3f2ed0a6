package com.phillippitts.tempokey.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cached tempo/key state for one catalog track.
 *
 * <p>Instances are immutable; stores derive the next version through {@link CacheUpdate}.
 * The builder guarantees that {@link #tempoSelected()} and {@link #keySelected()} are never null.
 *
 * <p>{@link #isIsrcMismatch()} is the value every consumer should read: it already folds in the
 * human review decision. The raw automatic flag is kept separately for audit.
 */
public final class CacheRecord {

    private final String trackId;
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
    private final String error;
    private final boolean autoMismatchFlag;
    private final ReviewStatus reviewStatus;
    private final String reviewedBy;
    private final Instant reviewedAt;
    private final Instant updatedAt;

    private CacheRecord(Builder b) {
        this.trackId = Objects.requireNonNull(b.trackId, "trackId");
        this.isrc = b.isrc;
        this.artist = b.artist;
        this.title = b.title;
        EnumMap<Algorithm, AlgorithmResult> copy = new EnumMap<>(Algorithm.class);
        b.results.forEach((alg, r) -> {
            if (r != null && !r.equals(AlgorithmResult.EMPTY)) {
                copy.put(alg, r);
            }
        });
        this.results = Collections.unmodifiableMap(copy);
        this.manualTempo = b.manualTempo;
        this.manualKey = b.manualKey;
        this.manualScale = b.manualScale;
        this.tempoSelected = b.tempoSelected != null ? b.tempoSelected
                : defaultSelection(copy, manualTempo != null, true);
        this.keySelected = b.keySelected != null ? b.keySelected
                : defaultSelection(copy, manualKey != null, false);
        this.previewCandidates = b.previewCandidates == null ? List.of() : List.copyOf(b.previewCandidates);
        this.source = b.source;
        this.error = b.error;
        this.autoMismatchFlag = b.autoMismatchFlag;
        this.reviewStatus = b.reviewStatus;
        this.reviewedBy = b.reviewedBy;
        this.reviewedAt = b.reviewedAt;
        this.updatedAt = b.updatedAt == null ? Instant.now() : b.updatedAt;
    }

    // Primary if present, else secondary, else manual; primary when nothing is known yet.
    private static ValueSource defaultSelection(Map<Algorithm, AlgorithmResult> results,
                                                boolean manualPresent, boolean tempo) {
        for (Algorithm a : Algorithm.values()) {
            AlgorithmResult r = results.get(a);
            if (r != null && (tempo ? r.hasTempo() : r.hasKey())) {
                return ValueSource.of(a);
            }
        }
        return manualPresent ? ValueSource.MANUAL : ValueSource.of(Algorithm.primary());
    }

    public static Builder builder(String trackId) {
        return new Builder(trackId);
    }

    public Builder toBuilder() {
        Builder b = new Builder(trackId);
        b.isrc = isrc;
        b.artist = artist;
        b.title = title;
        b.results.putAll(results);
        b.manualTempo = manualTempo;
        b.manualKey = manualKey;
        b.manualScale = manualScale;
        b.tempoSelected = tempoSelected;
        b.keySelected = keySelected;
        b.previewCandidates = previewCandidates;
        b.source = source;
        b.error = error;
        b.autoMismatchFlag = autoMismatchFlag;
        b.reviewStatus = reviewStatus;
        b.reviewedBy = reviewedBy;
        b.reviewedAt = reviewedAt;
        b.updatedAt = updatedAt;
        return b;
    }

    public String trackId() {
        return trackId;
    }

    public String isrc() {
        return isrc;
    }

    public String artist() {
        return artist;
    }

    public String title() {
        return title;
    }

    public Map<Algorithm, AlgorithmResult> results() {
        return results;
    }

    /** @return the stored fields for {@code algorithm}, never null */
    public AlgorithmResult result(Algorithm algorithm) {
        return results.getOrDefault(algorithm, AlgorithmResult.EMPTY);
    }

    public Double manualTempo() {
        return manualTempo;
    }

    public String manualKey() {
        return manualKey;
    }

    public String manualScale() {
        return manualScale;
    }

    public ValueSource tempoSelected() {
        return tempoSelected;
    }

    public ValueSource keySelected() {
        return keySelected;
    }

    public List<PreviewCandidate> previewCandidates() {
        return previewCandidates;
    }

    public String source() {
        return source;
    }

    public String error() {
        return error;
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    /**
     * Identity mismatch as seen by consumers: false once a reviewer confirmed the match, true when
     * a reviewer confirmed the mismatch, else the automatic flag.
     */
    public boolean isIsrcMismatch() {
        return mismatchState().suppressesTempo();
    }

    /** Raw automatic detector output, regardless of review. */
    public boolean isAutoMismatchFlag() {
        return autoMismatchFlag;
    }

    public MismatchState mismatchState() {
        return MismatchState.of(autoMismatchFlag, reviewStatus);
    }

    public ReviewStatus reviewStatus() {
        return reviewStatus;
    }

    public String reviewedBy() {
        return reviewedBy;
    }

    public Instant reviewedAt() {
        return reviewedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** @return the successful candidate URL, else the first attempted URL, else null */
    public String previewUrl() {
        for (PreviewCandidate c : previewCandidates) {
            if (c.success() && c.url() != null) {
                return c.url();
            }
        }
        return previewCandidates.isEmpty() ? null : previewCandidates.get(0).url();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheRecord that)) {
            return false;
        }
        return autoMismatchFlag == that.autoMismatchFlag
                && trackId.equals(that.trackId)
                && Objects.equals(isrc, that.isrc)
                && Objects.equals(artist, that.artist)
                && Objects.equals(title, that.title)
                && results.equals(that.results)
                && Objects.equals(manualTempo, that.manualTempo)
                && Objects.equals(manualKey, that.manualKey)
                && Objects.equals(manualScale, that.manualScale)
                && tempoSelected == that.tempoSelected
                && keySelected == that.keySelected
                && previewCandidates.equals(that.previewCandidates)
                && Objects.equals(source, that.source)
                && Objects.equals(error, that.error)
                && reviewStatus == that.reviewStatus
                && Objects.equals(reviewedBy, that.reviewedBy)
                && Objects.equals(reviewedAt, that.reviewedAt)
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trackId, isrc, results, tempoSelected, keySelected, source, error, updatedAt);
    }

    @Override
    public String toString() {
        return "CacheRecord{trackId=" + trackId
                + ", isrc=" + isrc
                + ", results=" + results
                + ", tempoSelected=" + tempoSelected
                + ", keySelected=" + keySelected
                + ", source=" + source
                + ", error=" + error
                + ", mismatch=" + mismatchState()
                + ", updatedAt=" + updatedAt + '}';
    }

    /**
     * Mutable builder. Unset selections resolve to the default precedence on {@link #build()}.
     */
    public static final class Builder {
        private final String trackId;
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
        private String error;
        private boolean autoMismatchFlag;
        private ReviewStatus reviewStatus;
        private String reviewedBy;
        private Instant reviewedAt;
        private Instant updatedAt;

        private Builder(String trackId) {
            this.trackId = trackId;
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
            if (result == null) {
                this.results.remove(algorithm);
            } else {
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
            this.error = error;
            return this;
        }

        public Builder autoMismatchFlag(boolean autoMismatchFlag) {
            this.autoMismatchFlag = autoMismatchFlag;
            return this;
        }

        public Builder reviewStatus(ReviewStatus reviewStatus) {
            this.reviewStatus = reviewStatus;
            return this;
        }

        public Builder reviewedBy(String reviewedBy) {
            this.reviewedBy = reviewedBy;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CacheRecord build() {
            return new CacheRecord(this);
        }
    }
}
