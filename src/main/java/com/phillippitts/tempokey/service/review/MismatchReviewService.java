package com.phillippitts.tempokey.service.review;

import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.exception.TrackNotFoundException;
import com.phillippitts.tempokey.service.cache.CacheStore;
import com.phillippitts.tempokey.service.security.CallerContext;
import com.phillippitts.tempokey.service.security.Role;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Human review workflow for identity mismatches.
 *
 * <p>Review actions change only the review fields and leave {@code updatedAt} alone, so a review
 * neither extends nor shortens the record's freshness.
 */
@Service
public class MismatchReviewService {
    private static final Logger LOG = LogManager.getLogger(MismatchReviewService.class);

    public static final int MAX_LIST_LIMIT = 200;

    private final CacheStore store;
    private final Clock clock;

    public MismatchReviewService(CacheStore store, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.clock = Objects.requireNonNull(clock);
    }

    public CacheRecord review(CallerContext caller, String trackId, ReviewAction action) {
        caller.require(Role.ADMIN, "Mismatch review");
        requireTrackId(trackId);
        Objects.requireNonNull(action, "action");
        CacheUpdate update = CacheUpdate.builder()
                .review(action.status(), caller.auditName(), clock.instant())
                .withoutTouch()
                .build();
        CacheRecord r = store.mergeExisting(trackId, update).orElseThrow(() -> new TrackNotFoundException(trackId));
        LOG.info("Track {} reviewed as {} by {}", trackId, action.wireName(), caller.auditName());
        return r;
    }

    /** Re-exposes the automatic flag by removing the human decision. */
    public CacheRecord clearReview(CallerContext caller, String trackId) {
        caller.require(Role.SUPER_ADMIN, "Clearing a mismatch review");
        requireTrackId(trackId);
        CacheUpdate update = CacheUpdate.builder().clearReview().withoutTouch().build();
        CacheRecord r = store.mergeExisting(trackId, update).orElseThrow(() -> new TrackNotFoundException(trackId));
        LOG.info("Review cleared on track {} by {}", trackId, caller.auditName());
        return r;
    }

    public List<MismatchEntry> list(CallerContext caller, int limit) {
        caller.require(Role.ADMIN, "Mismatch listing");
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new InvalidRequestException("limit", "limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        return store.findMismatches(limit).stream().map(MismatchEntry::of).toList();
    }

    private static void requireTrackId(String trackId) {
        if (trackId == null || trackId.isBlank()) {
            throw new InvalidRequestException("trackId", "trackId is required");
        }
    }
}
