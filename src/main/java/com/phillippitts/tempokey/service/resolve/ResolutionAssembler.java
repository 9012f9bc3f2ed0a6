package com.phillippitts.tempokey.service.resolve;

import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.ResolutionStatus;
import com.phillippitts.tempokey.domain.TempoResolution;
import com.phillippitts.tempokey.service.select.SelectedValues;
import com.phillippitts.tempokey.service.select.SelectionPolicy;
import org.springframework.stereotype.Component;

import java.util.Objects;

/** Turns a stored record into the response shape callers see. */
@Component
public class ResolutionAssembler {

    private final SelectionPolicy selection;

    public ResolutionAssembler(SelectionPolicy selection) {
        this.selection = Objects.requireNonNull(selection);
    }

    public TempoResolution assemble(CacheRecord record, boolean cached) {
        return assemble(record, cached, record.trackId());
    }

    /**
     * @param trackId track the caller asked for; differs from the record's own ID when a record
     *                was reused through a shared ISRC
     */
    public TempoResolution assemble(CacheRecord record, boolean cached, String trackId) {
        SelectedValues v = selection.select(record);
        return new TempoResolution(
                trackId,
                record.isrc(),
                v.tempo(),
                v.tempoRaw(),
                v.tempoConfidence(),
                v.key(),
                v.scale(),
                v.keyConfidence(),
                v.tempoSource(),
                v.keySource(),
                record.source(),
                cached,
                v.error(),
                status(record, v),
                record.previewCandidates());
    }

    static ResolutionStatus status(CacheRecord record, SelectedValues v) {
        if (v.tempoSuppressed()) {
            return ResolutionStatus.SUPPRESSED_PENDING_REVIEW;
        }
        if (record.hasError()) {
            return ResolutionStatus.FAILED;
        }
        return v.hasTempo() ? ResolutionStatus.RESOLVED : ResolutionStatus.NO_DATA;
    }
}
