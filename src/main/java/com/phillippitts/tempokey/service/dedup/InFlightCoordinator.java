package com.phillippitts.tempokey.service.dedup;

import com.phillippitts.tempokey.exception.TempoKeyException;
import com.phillippitts.tempokey.service.metrics.ResolutionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * At most one computation in flight per key, shared by every service that resolves tracks.
 *
 * <p>The first caller for a key runs the work on its own thread. Callers arriving while it runs
 * with the same purpose wait for and receive the same outcome, including the same exception.
 * Callers with a different purpose wait for the running work to finish and then start their own,
 * so their work sees whatever the first one wrote. Callers for other keys are never blocked. The
 * key is released once the work completes, so a later call starts fresh.
 */
@Component
public class InFlightCoordinator {
    private static final Logger LOG = LogManager.getLogger(InFlightCoordinator.class);

    public static final String DEFAULT_PURPOSE = "default";

    private final ConcurrentHashMap<String, Flight> inFlight = new ConcurrentHashMap<>();
    private final ResolutionMetrics metrics;

    public InFlightCoordinator(ResolutionMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics);
    }

    public <T> T run(String key, Supplier<T> work) {
        return run(key, DEFAULT_PURPOSE, work);
    }

    /**
     * Runs {@code work} unless another computation for {@code key} is in flight.
     *
     * @param purpose callers only share results with callers of the same purpose
     */
    @SuppressWarnings("unchecked")
    public <T> T run(String key, String purpose, Supplier<T> work) {
        Flight mine = new Flight(purpose, new CompletableFuture<>());
        Flight existing;
        while ((existing = inFlight.putIfAbsent(key, mine)) != null) {
            metrics.incrementDedupJoin();
            if (existing.purpose().equals(purpose)) {
                LOG.debug("Joining in-flight {} computation for {}", purpose, key);
                return (T) await(existing.future());
            }
            LOG.debug("Waiting for in-flight {} computation for {} before {}", existing.purpose(), key, purpose);
            // The outcome belongs to the other caller; only completion matters here.
            existing.future().handle((value, error) -> Boolean.TRUE).join();
        }
        try {
            T value = work.get();
            mine.future().complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.future().completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /** Number of keys currently being computed. */
    public int inFlightCount() {
        return inFlight.size();
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new TempoKeyException("In-flight computation failed", cause);
        }
    }

    private record Flight(String purpose, CompletableFuture<Object> future) {
    }
}
