package com.example.music2db.metadata;

import com.example.music2db.Outcome;

import java.nio.file.Path;

/**
 * Reads descriptive metadata from one file. A successful outcome may still be
 * {@link TrackMetadata#isEmpty() empty}, in which case the file is not sent.
 */
@FunctionalInterface
public interface MetadataExtractor {
    Outcome<TrackMetadata> extract(Path file);
}
