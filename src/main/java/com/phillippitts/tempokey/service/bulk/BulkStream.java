package com.phillippitts.tempokey.service.bulk;

import com.phillippitts.tempokey.service.detection.BatchRecord;
import com.phillippitts.tempokey.service.detection.BatchResultStream;
import com.phillippitts.tempokey.service.normalize.TempoNormalizer;
import com.phillippitts.tempokey.service.resolve.ResultIngestor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;

/**
 * An opened batch read-back. Each upstream record is ingested into the cache (when the batch was
 * prepared here) and forwarded to the consumer as one NDJSON line, flushed immediately. A consumer
 * that disconnects simply ends the copy; a restarted consumer passes the indices it already has
 * as final.
 */
public final class BulkStream implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(BulkStream.class);

    private final String batchId;
    private final BatchResultStream upstream;
    private final Set<Integer> skipFinalized;
    private final BatchRegistry registry;
    private final ResultIngestor ingestor;
    private final TempoNormalizer normalizer;

    BulkStream(String batchId, BatchResultStream upstream, Set<Integer> skipFinalized,
               BatchRegistry registry, ResultIngestor ingestor, TempoNormalizer normalizer) {
        this.batchId = batchId;
        this.upstream = upstream;
        this.skipFinalized = skipFinalized == null ? Set.of() : Set.copyOf(skipFinalized);
        this.registry = registry;
        this.ingestor = ingestor;
        this.normalizer = normalizer;
    }

    /**
     * Copies records until the upstream ends or the consumer goes away.
     *
     * @return number of lines written
     */
    public int writeTo(OutputStream out) {
        int written = 0;
        try {
            while (upstream.hasNext()) {
                BatchRecord rec = upstream.next();
                if (rec.finalRecord() && skipFinalized.contains(rec.index())) {
                    continue;
                }
                Optional<String> trackId = registry.trackFor(batchId, rec.index());
                trackId.ifPresent(id -> ingestor.ingestBatchRecord(id, rec));
                String line = BatchRecordJson.write(rec, trackId.orElse(null), normalizer) + "\n";
                try {
                    out.write(line.getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    LOG.info("Consumer of batch {} disconnected after {} records", batchId, written);
                    return written;
                }
                written++;
            }
            LOG.info("Batch {} stream finished ({} records)", batchId, written);
            return written;
        } finally {
            close();
        }
    }

    @Override
    public void close() {
        upstream.close();
    }
}
