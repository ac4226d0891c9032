package com.example.music2db;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class ScanStateStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanStateStore.class);

    private final ObjectMapper mapper;
    private final Path stateFile;

    public ScanStateStore(Path stateFile) {
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.stateFile = stateFile;
    }

    /**
     * Returns the last saved scan time in Unix seconds, or 0 when the state
     * file is missing or cannot be parsed.
     */
    public double getLastScanTime() {
        if (!Files.exists(stateFile)) {
            return 0;
        }
        try (Reader reader = Files.newBufferedReader(stateFile)) {
            ScanCheckpoint checkpoint = mapper.readValue(reader, ScanCheckpoint.class);
            if (checkpoint == null || !Double.isFinite(checkpoint.lastScanTime()) || checkpoint.lastScanTime() < 0) {
                LOGGER.error("State file {} holds no usable timestamp, treating as never scanned", stateFile);
                return 0;
            }
            return checkpoint.lastScanTime();
        } catch (IOException ex) {
            LOGGER.error("Error reading state file {}", stateFile, ex);
            return 0;
        }
    }

    /**
     * Writes the scan time, creating the parent directories if needed.
     */
    public void saveLastScanTime(double timestamp) {
        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), new ScanCheckpoint(timestamp));
            Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.debug("Saved last scan time {} to {}", timestamp, stateFile);
        } catch (IOException ex) {
            LOGGER.error("Error saving state file {}", stateFile, ex);
        }
    }

    public Path path() {
        return stateFile;
    }
}
