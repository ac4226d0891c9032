package com.example.music2db;

import com.example.music2db.metadata.TrackRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class TrackBatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackBatcher.class);

    private final CatalogClient client;
    private final int batchSize;
    private final List<TrackRecord> buffer;
    private int deliveredBatches;
    private int failedBatches;
    private long deliveredTracks;
    private long failedTracks;

    public TrackBatcher(CatalogClient client, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.client = client;
        this.batchSize = batchSize;
        this.buffer = new ArrayList<>(batchSize);
    }

    /**
     * Appends a record, sending the batch as soon as it is full.
     */
    public synchronized void add(TrackRecord record) {
        buffer.add(record);
        if (buffer.size() >= batchSize) {
            flush();
        }
    }

    /**
     * Sends whatever is buffered. Does nothing when the buffer is empty.
     */
    public synchronized void flush() {
        if (buffer.isEmpty()) {
            return;
        }
        List<TrackRecord> batch = List.copyOf(buffer);
        buffer.clear();

        LOGGER.info("Sending batch of {} tracks to server", batch.size());
        Outcome<String> outcome = client.sendTracks(batch);
        if (outcome.isSuccess()) {
            deliveredBatches++;
            deliveredTracks += batch.size();
            LOGGER.info("{}", outcome.getValue());
        } else {
            failedBatches++;
            failedTracks += batch.size();
            LOGGER.error("Failed to send tracks batch of {} (first: {}): {}",
                    batch.size(), batch.get(0).filePath(), outcome.getFailure());
        }
    }

    public synchronized int pending() {
        return buffer.size();
    }

    public synchronized int deliveredBatches() {
        return deliveredBatches;
    }

    public synchronized int failedBatches() {
        return failedBatches;
    }

    public synchronized long deliveredTracks() {
        return deliveredTracks;
    }

    public synchronized long failedTracks() {
        return failedTracks;
    }
}
