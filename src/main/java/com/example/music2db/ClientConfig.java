package com.example.music2db;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Optional;
import java.util.Set;

public record ClientConfig(
        Path musicPath,
        Set<String> extensions,
        String ignoreMarker,
        int batchSize,
        LocalTime scanTime,
        Optional<Duration> scanInterval,
        String catalogUrl,
        int catalogPort,
        String oneTrackEndpoint,
        String manyTracksEndpoint,
        Path stateFile,
        CheckpointPolicy checkpointPolicy,
        String logLevel
) {
    public ClientConfig {
        extensions = Set.copyOf(extensions);
    }

    /**
     * Base address of the catalog service, e.g. {@code http://localhost:5005}.
     */
    public URI catalogBase() {
        String base = catalogUrl.replaceAll("/+$", "");
        return URI.create(base + ":" + catalogPort);
    }
}
