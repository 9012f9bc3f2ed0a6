package com.phillippitts.tempokey.service.preview;

import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.exception.ProviderUnavailableException;
import com.phillippitts.tempokey.service.events.NoPreviewFoundEvent;
import com.phillippitts.tempokey.service.events.PreviewAttemptFailedEvent;
import com.phillippitts.tempokey.service.metrics.ResolutionMetrics;
import com.phillippitts.tempokey.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Tries preview providers in priority order until one returns an excerpt.
 * Defaults: catalog URL -> storefront ISRC lookup -> storefront search -> second storefront.
 */
@Service
public class PreviewResolver {
    private static final Logger LOG = LogManager.getLogger(PreviewResolver.class);

    private final List<PreviewProvider> chain;
    private final ApplicationEventPublisher publisher;
    private final ResolutionMetrics metrics;

    public PreviewResolver(List<PreviewProvider> providers, ApplicationEventPublisher publisher,
                           ResolutionMetrics metrics) {
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        List<PreviewProvider> ordered = new ArrayList<>(providers);
        ordered.sort(Comparator.comparingInt(PreviewProvider::priority));
        this.chain = List.copyOf(ordered);
    }

    /** Provider names in the order they are tried. */
    public List<String> providerOrder() {
        return chain.stream().map(PreviewProvider::name).toList();
    }

    public PreviewResolution resolve(PreviewQuery query) {
        return resolve(query, c -> true);
    }

    /**
     * Like {@link #resolve(PreviewQuery)}, but a successful candidate only ends the chain when
     * {@code accept} agrees; a rejected one is kept in the attempt list as a failure.
     */
    public PreviewResolution resolve(PreviewQuery query, Predicate<PreviewCandidate> accept) {
        String trackId = query.ids().trackId();
        List<PreviewCandidate> attempts = new ArrayList<>();
        for (PreviewProvider p : chain) {
            if (!p.canResolve(query)) {
                LOG.debug("Skipping provider {} for track {}: missing identifiers", p.name(), trackId);
                continue;
            }
            try {
                PreviewCandidate c = p.resolve(query);
                if (c.success() && !accept.test(c)) {
                    attempts.add(PreviewCandidate.failed(p.name(), c.url()));
                    metrics.incrementProviderAttempt(p.name(), "rejected");
                    LOG.debug("Preview for track {} via {} rejected (detected ISRC {})", trackId, p.name(),
                            c.detectedIsrc());
                    publisher.publishEvent(new PreviewAttemptFailedEvent(trackId, p.name(), "preview rejected",
                            Instant.now()));
                    continue;
                }
                attempts.add(c);
                if (c.success()) {
                    metrics.incrementProviderAttempt(p.name(), "success");
                    LOG.info("Preview for track {} via {} ({})", trackId, p.name(), LogSanitizer.url(c.url()));
                    return new PreviewResolution(attempts, c);
                }
                publisher.publishEvent(new PreviewAttemptFailedEvent(trackId, p.name(), "no preview in result",
                        Instant.now()));
            } catch (ProviderUnavailableException e) {
                LOG.debug("Provider {} unavailable for track {}: {}", p.name(), trackId, e.getMessage());
                attempts.add(PreviewCandidate.failed(p.name(), null));
                publisher.publishEvent(new PreviewAttemptFailedEvent(trackId, p.name(), e.getMessage(), Instant.now()));
            } catch (RuntimeException e) {
                LOG.warn("Provider {} failed for track {}: {}", p.name(), trackId, e.toString());
                attempts.add(PreviewCandidate.failed(p.name(), null));
                publisher.publishEvent(new PreviewAttemptFailedEvent(trackId, p.name(),
                        e.getClass().getSimpleName(), Instant.now()));
            }
        }
        publisher.publishEvent(new NoPreviewFoundEvent(trackId, attempts.size(), Instant.now()));
        return new PreviewResolution(attempts, null);
    }
}
