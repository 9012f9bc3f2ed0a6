package com.phillippitts.tempokey.service.detection;

import java.util.List;

/**
 * The single place that knows how to reach the tempo/key estimation capability.
 *
 * <p>Every method fails with {@link com.phillippitts.tempokey.exception.DetectionUnavailableException}
 * on a non-2xx answer, malformed payload, timeout, or when the adapter is not configured. No
 * method ever fabricates a result.
 */
public interface DetectionAdapter {

    /**
     * Analyzes a single excerpt synchronously.
     *
     * @return one estimate per algorithm that reported; may be empty when nothing was detected
     */
    List<RawEstimate> analyze(String excerptUrl);

    /** Submits excerpt URLs for bulk analysis; index {@code i} of the stream refers to {@code urls.get(i)}. */
    String submitBatch(List<String> urls);

    /** Opens the newline-delimited read-back of a batch. The caller must close the stream. */
    BatchResultStream openStream(String batchId);

    /** Results produced so far, for consumers whose stream was interrupted. */
    BatchPoll pollBatch(String batchId);

    /** Returns normally when the service answered its health check. */
    void checkHealth();
}
