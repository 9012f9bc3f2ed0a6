package com.phillippitts.tempokey.service.events;

import com.phillippitts.tempokey.service.metrics.ResolutionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for resolution events. Feeds metrics on every event and logs throttled
 * per provider, so a storefront outage does not flood the log.
 */
@Component
class ResolutionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ResolutionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final ResolutionMetrics metrics;

    ResolutionEventsListener(ResolutionMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onPreviewAttemptFailed(PreviewAttemptFailedEvent e) {
        metrics.incrementProviderAttempt(e.provider(), "failure");
        if (shouldLog("provider-" + e.provider())) {
            LOG.warn("Preview provider {} failing: {} (further failures suppressed for {}s)",
                    e.provider(), e.reason(), THROTTLE.toSeconds());
        }
    }

    @EventListener
    void onNoPreviewFound(NoPreviewFoundEvent e) {
        metrics.incrementNoPreview();
        LOG.info("No preview available for track {} after {} attempts", e.trackId(), e.attempts());
    }

    @EventListener
    void onIdentityMismatch(IdentityMismatchFlaggedEvent e) {
        metrics.incrementMismatchFlagged(e.provider());
        LOG.info("Identity mismatch flagged: track={}, provider={}, requestedIsrc={}, detectedIsrc={}",
                e.trackId(), e.provider(), e.requestedIsrc(), e.detectedIsrc());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
