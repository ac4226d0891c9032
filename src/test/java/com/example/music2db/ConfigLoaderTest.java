package com.example.music2db;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigLoaderTest {
    @Test
    void appliesDefaultsForOptionalSettings() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        Path file = write(dir, "{\"music\": {\"path\": \"/srv/music\"}, \"musicDb\": {\"url\": \"http://nas.lan\", \"port\": 5005}}");
        ConfigLoader loader = new ConfigLoader(Map.of("XDG_STATE_HOME", dir.resolve("state").toString()));

        ClientConfig config = loader.load(file);

        assertEquals(Path.of("/srv/music"), config.musicPath());
        assertEquals(Set.of(".mp3", ".flac", ".m4a", ".ogg"), config.extensions());
        assertEquals(".ignore", config.ignoreMarker());
        assertEquals(100, config.batchSize());
        assertEquals(LocalTime.of(3, 0), config.scanTime());
        assertEquals(Optional.empty(), config.scanInterval());
        assertEquals("/add_track/", config.oneTrackEndpoint());
        assertEquals("/add_tracks/", config.manyTracksEndpoint());
        assertEquals(dir.resolve("state/music2db/state.json"), config.stateFile());
        assertEquals(CheckpointPolicy.ALL_BATCHES_DELIVERED, config.checkpointPolicy());
        assertEquals("INFO", config.logLevel());
        assertEquals("http://nas.lan:5005", config.catalogBase().toString());
    }

    @Test
    void readsEverySection() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        Path file = write(dir, """
                {
                  "music": {
                    "path": "/music",
                    "extensions": ["MP3", ".Flac"],
                    "ignoreMarker": ".nomedia",
                    "batchSize": 25,
                    "scanTime": "04:30",
                    "scanIntervalMinutes": 90,
                    "unknownKey": true
                  },
                  "musicDb": {
                    "url": "http://localhost/",
                    "port": 8080,
                    "oneTrackEndpoint": "/track/",
                    "manyTracksEndpoint": "/tracks/"
                  },
                  "state": {"file": "/var/lib/music2db/state.json"},
                  "scan": {"checkpointPolicy": "always"},
                  "logging": {"level": "debug"}
                }
                """);

        ClientConfig config = new ConfigLoader(Map.of()).load(file);

        assertEquals(Set.of(".mp3", ".flac"), config.extensions());
        assertEquals(".nomedia", config.ignoreMarker());
        assertEquals(25, config.batchSize());
        assertEquals(LocalTime.of(4, 30), config.scanTime());
        assertEquals(Optional.of(Duration.ofMinutes(90)), config.scanInterval());
        assertEquals("http://localhost:8080", config.catalogBase().toString());
        assertEquals("/track/", config.oneTrackEndpoint());
        assertEquals(Path.of("/var/lib/music2db/state.json"), config.stateFile());
        assertEquals(CheckpointPolicy.ALWAYS, config.checkpointPolicy());
        assertEquals("DEBUG", config.logLevel());
    }

    @Test
    void commandLineOverridesWinOverFile() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        Path file = write(dir, "{\"music\": {\"path\": \"/music\", \"extensions\": [\".mp3\"]}, \"musicDb\": {\"url\": \"http://a\", \"port\": 1}}");

        ClientConfig config = new ConfigLoader(Map.of()).load(file, List.of(
                "--music.path=/other",
                "--music.extensions=.ogg,.opus",
                "--musicDb.port=5005",
                "--music.batchSize=7",
                "--scan.checkpointPolicy=always"));

        assertEquals(Path.of("/other"), config.musicPath());
        assertEquals(Set.of(".ogg", ".opus"), config.extensions());
        assertEquals(5005, config.catalogPort());
        assertEquals(7, config.batchSize());
        assertEquals(CheckpointPolicy.ALWAYS, config.checkpointPolicy());
    }

    @Test
    void extensionListOverrideSplitsWhenFileUsesDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        Path file = write(dir, "{\"music\": {\"path\": \"/music\"}, \"musicDb\": {\"url\": \"http://a\", \"port\": 1}}");

        ClientConfig config = new ConfigLoader(Map.of()).load(file, List.of("--music.extensions=.ogg, OPUS"));

        assertEquals(Set.of(".ogg", ".opus"), config.extensions());
    }

    @Test
    void rejectsMissingRequiredSettings() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        ConfigLoader loader = new ConfigLoader(Map.of());

        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write(dir, "{\"musicDb\": {\"url\": \"http://a\", \"port\": 1}}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write(dir, "{\"music\": {\"path\": \"/m\"}, \"musicDb\": {\"port\": 1}}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write(dir, "{\"music\": {\"path\": \"/m\"}, \"musicDb\": {\"url\": \"http://a\"}}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(dir.resolve("missing.json")));
    }

    @Test
    void rejectsInvalidValues() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        ConfigLoader loader = new ConfigLoader(Map.of());
        Path base = write(dir, "{\"music\": {\"path\": \"/m\"}, \"musicDb\": {\"url\": \"http://a\", \"port\": 1}}");

        assertThrows(IllegalArgumentException.class, () -> loader.load(base, List.of("--music.batchSize=0")));
        assertThrows(IllegalArgumentException.class, () -> loader.load(base, List.of("--scan.checkpointPolicy=sometimes")));
        assertThrows(IllegalArgumentException.class, () -> loader.load(base, List.of("--novalue")));
    }

    @Test
    void defaultConfigFileFollowsXdgConfigHome() {
        ConfigLoader loader = new ConfigLoader(Map.of("XDG_CONFIG_HOME", "/etc/xdg-test"));

        assertEquals(Path.of("/etc/xdg-test/music2db/config.json"), loader.defaultConfigFile());
    }

    private static Path write(Path dir, String json) throws Exception {
        Path file = Files.createTempFile(dir, "config", ".json");
        Files.writeString(file, json);
        return file;
    }
}
