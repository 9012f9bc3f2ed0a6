package com.phillippitts.tempokey.testutil;

import com.phillippitts.tempokey.exception.DetectionUnavailableException;
import com.phillippitts.tempokey.service.detection.BatchPoll;
import com.phillippitts.tempokey.service.detection.BatchResultStream;
import com.phillippitts.tempokey.service.detection.DetectionAdapter;
import com.phillippitts.tempokey.service.detection.RawEstimate;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory estimation service. Analysis answers with configured estimates; streams replay a
 * canned NDJSON body.
 */
public class FakeDetectionAdapter implements DetectionAdapter {

    private volatile List<RawEstimate> estimates = List.of();
    private volatile boolean down;
    private volatile int rejectStatus;
    private volatile String ndjson = "";
    private volatile BatchPoll poll = new BatchPoll(List.of(), true);
    private final AtomicInteger analyzeCalls = new AtomicInteger();
    private final List<List<String>> submitted = new CopyOnWriteArrayList<>();

    public FakeDetectionAdapter estimates(RawEstimate... e) {
        this.estimates = List.of(e);
        return this;
    }

    public FakeDetectionAdapter down(boolean down) {
        this.down = down;
        return this;
    }

    /** Analysis answers with a non-retryable rejection carrying {@code status}; 0 turns it off. */
    public FakeDetectionAdapter reject(int status) {
        this.rejectStatus = status;
        return this;
    }

    public FakeDetectionAdapter streamBody(String ndjson) {
        this.ndjson = ndjson;
        return this;
    }

    public FakeDetectionAdapter poll(BatchPoll poll) {
        this.poll = poll;
        return this;
    }

    public int analyzeCalls() {
        return analyzeCalls.get();
    }

    public List<List<String>> submitted() {
        return submitted;
    }

    @Override
    public List<RawEstimate> analyze(String excerptUrl) {
        analyzeCalls.incrementAndGet();
        if (down) {
            throw new DetectionUnavailableException("Analysis rejected: HTTP 503", 503, true, null);
        }
        if (rejectStatus > 0) {
            throw new DetectionUnavailableException("Analysis rejected: HTTP " + rejectStatus, rejectStatus, false,
                    null);
        }
        return estimates;
    }

    @Override
    public String submitBatch(List<String> urls) {
        if (down) {
            throw new DetectionUnavailableException("Batch submission rejected: HTTP 503", 503, true, null);
        }
        submitted.add(new ArrayList<>(urls));
        return "batch-" + submitted.size();
    }

    @Override
    public BatchResultStream openStream(String batchId) {
        return new BatchResultStream(new ByteArrayInputStream(ndjson.getBytes(StandardCharsets.UTF_8)), null);
    }

    @Override
    public BatchPoll pollBatch(String batchId) {
        return poll;
    }

    @Override
    public void checkHealth() {
        if (down) {
            throw new DetectionUnavailableException("Health check rejected: HTTP 503", 503, true, null);
        }
    }
}
