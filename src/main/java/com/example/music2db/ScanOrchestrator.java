package com.example.music2db;

import com.example.music2db.metadata.MetadataExtractor;
import com.example.music2db.metadata.TrackMetadata;
import com.example.music2db.metadata.TrackRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

public final class ScanOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final ClientConfig config;
    private final ScanStateStore stateStore;
    private final ChangeDetector changeDetector;
    private final LibraryWalker walker;
    private final MetadataExtractor extractor;
    private final CatalogClient client;
    private final Clock clock;

    public ScanOrchestrator(ClientConfig config,
                            ScanStateStore stateStore,
                            MetadataExtractor extractor,
                            CatalogClient client) {
        this(config, stateStore, new ChangeDetector(), new LibraryWalker(config), extractor, client, Clock.systemUTC());
    }

    ScanOrchestrator(ClientConfig config,
                     ScanStateStore stateStore,
                     ChangeDetector changeDetector,
                     LibraryWalker walker,
                     MetadataExtractor extractor,
                     CatalogClient client,
                     Clock clock) {
        this.config = config;
        this.stateStore = stateStore;
        this.changeDetector = changeDetector;
        this.walker = walker;
        this.extractor = extractor;
        this.client = client;
        this.clock = clock;
    }

    /**
     * Runs one incremental scan. The checkpoint is only written after an
     * uninterrupted walk, and then only if the configured
     * {@link CheckpointPolicy} accepts the delivery results.
     */
    public ScanReport scan(CancellationToken token) {
        double startedAt = ChangeDetector.unixSeconds(clock.instant());

        Path root;
        try {
            root = config.musicPath().toRealPath();
        } catch (IOException ex) {
            LOGGER.error("Music directory does not exist: {}", config.musicPath());
            return ScanReport.skipped(ScanReport.Status.SKIPPED_MISSING_ROOT);
        }
        if (!Files.isDirectory(root)) {
            LOGGER.error("Music path is not a directory: {}", root);
            return ScanReport.skipped(ScanReport.Status.SKIPPED_MISSING_ROOT);
        }

        double lastScanTime = stateStore.getLastScanTime();
        double latestModification = changeDetector.latestModificationTime(root);
        if (latestModification <= lastScanTime) {
            LOGGER.info("No changes in music library since last scan, skipping");
            return ScanReport.skipped(ScanReport.Status.SKIPPED_NO_CHANGES);
        }

        Outcome<String> health = client.checkHealth();
        if (!health.isSuccess()) {
            LOGGER.error("Server is not healthy, skipping scan: {}", health.getFailure());
            return ScanReport.skipped(ScanReport.Status.SKIPPED_UNHEALTHY);
        }

        LOGGER.info("Changes detected, starting music directory scan: {}", root);
        TrackBatcher batcher = new TrackBatcher(client, config.batchSize());
        long candidates = 0;
        long queued = 0;
        for (Path file : walker.candidates(root)) {
            if (token.isCancellationRequested()) {
                return cancelled(candidates, queued, batcher);
            }
            candidates++;
            if (processFile(root, file, batcher)) {
                queued++;
            }
        }
        if (token.isCancellationRequested()) {
            return cancelled(candidates, queued, batcher);
        }
        batcher.flush();

        int failed = batcher.failedBatches();
        boolean commit = config.checkpointPolicy().allowsCommit(failed);
        if (commit) {
            // clock may have stepped back; the checkpoint never does
            stateStore.saveLastScanTime(Math.max(startedAt, lastScanTime));
        } else {
            LOGGER.warn("{} of {} batches were not delivered, keeping previous checkpoint so the next scan retries",
                    failed, failed + batcher.deliveredBatches());
        }
        ScanReport.Status status = failed == 0 ? ScanReport.Status.COMPLETED : ScanReport.Status.COMPLETED_WITH_FAILURES;
        LOGGER.info("Scan finished: {} candidate files, {} tracks queued, {} batches delivered, {} failed",
                candidates, queued, batcher.deliveredBatches(), failed);
        return new ScanReport(status, candidates, queued, batcher.deliveredBatches(), failed, commit);
    }

    /**
     * Extracts one file and queues it. Returns false when the file was skipped.
     */
    private boolean processFile(Path root, Path file, TrackBatcher batcher) {
        Outcome<TrackMetadata> extracted;
        try {
            extracted = extractor.extract(file);
        } catch (RuntimeException ex) {
            LOGGER.warn("Error processing {}", file, ex);
            return false;
        }
        if (!extracted.isSuccess()) {
            Outcome.Failure failure = extracted.getFailure();
            if (failure.kind() == FailureKind.UNSUPPORTED_FORMAT) {
                LOGGER.debug("No readable audio in {}: {}", file, failure.detail());
            } else {
                LOGGER.warn("Error processing {}: {}", file, failure);
            }
            return false;
        }
        TrackMetadata metadata = extracted.getValue();
        if (metadata == null || metadata.isEmpty()) {
            LOGGER.debug("No metadata in {}, skipping", file);
            return false;
        }
        batcher.add(new TrackRecord(relativePath(root, file), metadata));
        return true;
    }

    private ScanReport cancelled(long candidates, long queued, TrackBatcher batcher) {
        LOGGER.info("Termination requested, stopping scan after {} files; {} unsent tracks dropped, checkpoint unchanged",
                candidates, batcher.pending());
        return new ScanReport(ScanReport.Status.CANCELLED, candidates, queued,
                batcher.deliveredBatches(), batcher.failedBatches(), false);
    }

    static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
