package com.example.music2db;

import com.example.music2db.metadata.MetadataExtractor;
import com.example.music2db.metadata.TrackMetadata;
import com.example.music2db.metadata.TrackRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class TrackSubmitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackSubmitter.class);

    private final Path musicPath;
    private final MetadataExtractor extractor;
    private final CatalogClient client;

    public TrackSubmitter(Path musicPath, MetadataExtractor extractor, CatalogClient client) {
        this.musicPath = musicPath;
        this.extractor = extractor;
        this.client = client;
    }

    /**
     * Builds the record for a file. Files inside the library get their
     * library-relative path, anything else just its file name.
     */
    public Outcome<TrackRecord> describe(Path file) {
        if (!Files.isRegularFile(file)) {
            return Outcome.failure(FailureKind.UNREADABLE_FILE, "file does not exist: " + file);
        }
        Outcome<TrackMetadata> extracted = extractor.extract(file);
        if (!extracted.isSuccess()) {
            return extracted.map(metadata -> null);
        }
        return Outcome.success(new TrackRecord(recordPath(file), extracted.getValue()));
    }

    /**
     * Extracts and sends one file. Files without metadata are not sent.
     */
    public Outcome<TrackRecord> submit(Path file) {
        Outcome<TrackRecord> described = describe(file);
        if (!described.isSuccess()) {
            return described;
        }
        TrackRecord record = described.getValue();
        if (record.metadata().isEmpty()) {
            return Outcome.failure(FailureKind.UNSUPPORTED_FORMAT, "no metadata in " + file);
        }
        Outcome<Void> sent = client.sendTrack(record);
        if (!sent.isSuccess()) {
            LOGGER.error("Failed to send metadata for {}: {}", record.filePath(), sent.getFailure());
            return sent.map(ignored -> record);
        }
        LOGGER.debug("Successfully processed: {}", record.filePath());
        return Outcome.success(record);
    }

    private String recordPath(Path file) {
        try {
            Path root = musicPath.toRealPath();
            Path real = file.toRealPath();
            if (real.startsWith(root)) {
                return ScanOrchestrator.relativePath(root, real);
            }
        } catch (IOException ex) {
            LOGGER.debug("Music path {} not resolvable, using file name: {}", musicPath, ex.toString());
        }
        return file.getFileName().toString();
    }
}
