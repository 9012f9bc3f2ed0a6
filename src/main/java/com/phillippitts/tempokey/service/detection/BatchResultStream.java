package com.phillippitts.tempokey.service.detection;

import com.phillippitts.tempokey.exception.DetectionUnavailableException;
import com.phillippitts.tempokey.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily reads a newline-delimited batch result stream, one {@link BatchRecord} per line.
 * Blank and unparseable lines are skipped. Nothing is buffered beyond the current line, so a
 * consumer may stop at any point and close the stream.
 */
public final class BatchResultStream implements Iterator<BatchRecord>, AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(BatchResultStream.class);

    private final BufferedReader reader;
    private final Closeable resource;
    private BatchRecord next;
    private boolean exhausted;

    public BatchResultStream(InputStream body, Closeable resource) {
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        this.resource = resource;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    next = DetectionJsonParser.parseRecord(line);
                    return true;
                } catch (DetectionUnavailableException e) {
                    LOG.warn("Skipping unreadable stream line ({}): {}", e.getMessage(),
                            LogSanitizer.truncate(line, 120));
                }
            }
        } catch (IOException e) {
            exhausted = true;
            throw new DetectionUnavailableException("Batch stream interrupted", e);
        }
        exhausted = true;
        return false;
    }

    @Override
    public BatchRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        BatchRecord r = next;
        next = null;
        return r;
    }

    @Override
    public void close() {
        exhausted = true;
        try {
            reader.close();
        } catch (IOException e) {
            LOG.debug("Error closing stream reader: {}", e.toString());
        }
        if (resource != null) {
            try {
                resource.close();
            } catch (IOException e) {
                LOG.debug("Error closing stream response: {}", e.toString());
            }
        }
    }
}
