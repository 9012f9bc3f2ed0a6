package com.phillippitts.tempokey.testutil;

import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.exception.ProviderUnavailableException;
import com.phillippitts.tempokey.service.preview.PreviewProvider;
import com.phillippitts.tempokey.service.preview.PreviewQuery;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable preview provider: answers with a fixed candidate, a miss, or an outage, and counts
 * its calls.
 */
public class FakePreviewProvider implements PreviewProvider {

    public enum Mode { HIT, MISS, DOWN }

    private final String name;
    private final int priority;
    private volatile Mode mode;
    private volatile String url;
    private volatile String detectedIsrc;
    private volatile CountDownLatch gate;
    private final AtomicInteger calls = new AtomicInteger();

    public FakePreviewProvider(String name, int priority, Mode mode) {
        this.name = name;
        this.priority = priority;
        this.mode = mode;
        this.url = "https://audio.example/" + name + ".m4a";
    }

    public FakePreviewProvider detectedIsrc(String isrc) {
        this.detectedIsrc = isrc;
        return this;
    }

    public FakePreviewProvider mode(Mode mode) {
        this.mode = mode;
        return this;
    }

    /** Blocks every resolve call until the latch opens. */
    public FakePreviewProvider gate(CountDownLatch gate) {
        this.gate = gate;
        return this;
    }

    public String url() {
        return url;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public boolean canResolve(PreviewQuery query) {
        return true;
    }

    @Override
    public PreviewCandidate resolve(PreviewQuery query) {
        calls.incrementAndGet();
        CountDownLatch g = gate;
        if (g != null) {
            try {
                g.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        return switch (mode) {
            case HIT -> PreviewCandidate.succeeded(url, name, detectedIsrc, null, null);
            case MISS -> PreviewCandidate.failed(name, null);
            case DOWN -> throw new ProviderUnavailableException(name, "HTTP 503");
        };
    }
}
