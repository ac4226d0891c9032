package com.example.music2db;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class ConfigLoader {
    static final String APP_NAME = "music2db";

    private static final List<String> DEFAULT_EXTENSIONS = List.of(".mp3", ".flac", ".m4a", ".ogg");
    private static final String DEFAULT_IGNORE_MARKER = ".ignore";
    private static final int DEFAULT_BATCH_SIZE = 100;
    private static final LocalTime DEFAULT_SCAN_TIME = LocalTime.of(3, 0);
    private static final String DEFAULT_ONE_TRACK_ENDPOINT = "/add_track/";
    private static final String DEFAULT_MANY_TRACKS_ENDPOINT = "/add_tracks/";
    private static final String DEFAULT_LOG_LEVEL = "INFO";
    // overrides for these keys are comma separated lists
    private static final Set<String> LIST_KEYS = Set.of("music.extensions");

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    ConfigLoader(Map<String, String> environment) {
        this.environment = environment;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    /**
     * Default config location: {@code $XDG_CONFIG_HOME/music2db/config.json}.
     */
    public Path defaultConfigFile() {
        return xdgDirectory("XDG_CONFIG_HOME", ".config").resolve(APP_NAME).resolve("config.json");
    }

    public ClientConfig load(Path path) throws IOException {
        return load(path, List.of());
    }

    public ClientConfig load(Path path, List<String> overrides) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Config file not found: " + path);
        }
        JsonNode tree = mapper.readTree(path.toFile());
        ObjectNode root = tree instanceof ObjectNode ? (ObjectNode) tree : mapper.createObjectNode();
        for (String override : overrides) {
            applyOverride(root, override);
        }
        RawConfig raw = mapper.treeToValue(root, RawConfig.class);
        return validate(raw);
    }

    private ClientConfig validate(RawConfig raw) {
        RawMusic music = raw.music == null ? new RawMusic() : raw.music;
        RawMusicDb musicDb = raw.musicDb == null ? new RawMusicDb() : raw.musicDb;

        if (music.path == null || music.path.isBlank()) {
            throw new IllegalArgumentException("Config must include music.path.");
        }
        if (musicDb.url == null || musicDb.url.isBlank()) {
            throw new IllegalArgumentException("Config must include musicDb.url.");
        }
        if (musicDb.port == null || musicDb.port <= 0 || musicDb.port > 65535) {
            throw new IllegalArgumentException("Config must include a valid musicDb.port.");
        }
        int batchSize = music.batchSize == null ? DEFAULT_BATCH_SIZE : music.batchSize;
        if (batchSize <= 0) {
            throw new IllegalArgumentException("music.batchSize must be positive, got " + batchSize);
        }

        Optional<Duration> scanInterval = Optional.ofNullable(music.scanIntervalMinutes)
                .filter(minutes -> minutes > 0)
                .map(Duration::ofMinutes);
        Path stateFile = raw.state != null && raw.state.file != null && !raw.state.file.isBlank()
                ? Path.of(raw.state.file)
                : xdgDirectory("XDG_STATE_HOME", ".local/state").resolve(APP_NAME).resolve("state.json");
        CheckpointPolicy policy = raw.scan != null && raw.scan.checkpointPolicy != null
                ? CheckpointPolicy.fromConfig(raw.scan.checkpointPolicy)
                : CheckpointPolicy.ALL_BATCHES_DELIVERED;
        String logLevel = raw.logging != null && raw.logging.level != null && !raw.logging.level.isBlank()
                ? raw.logging.level.trim().toUpperCase(Locale.ROOT)
                : DEFAULT_LOG_LEVEL;

        return new ClientConfig(
                Path.of(music.path),
                normalizeExtensions(music.extensions),
                optionalString(music.ignoreMarker, DEFAULT_IGNORE_MARKER),
                batchSize,
                music.scanTime == null ? DEFAULT_SCAN_TIME : music.scanTime,
                scanInterval,
                musicDb.url.trim(),
                musicDb.port,
                optionalString(musicDb.oneTrackEndpoint, DEFAULT_ONE_TRACK_ENDPOINT),
                optionalString(musicDb.manyTracksEndpoint, DEFAULT_MANY_TRACKS_ENDPOINT),
                stateFile,
                policy,
                logLevel
        );
    }

    private void applyOverride(ObjectNode root, String override) {
        String trimmed = override.replaceFirst("^-+", "");
        int eq = trimmed.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("Override must look like --section.key=value: " + override);
        }
        String path = trimmed.substring(0, eq);
        String[] keys = path.split("\\.");
        String value = trimmed.substring(eq + 1);

        ObjectNode node = root;
        for (int i = 0; i < keys.length - 1; i++) {
            JsonNode child = node.get(keys[i]);
            if (!(child instanceof ObjectNode)) {
                child = node.putObject(keys[i]);
            }
            node = (ObjectNode) child;
        }
        String leaf = keys[keys.length - 1];
        if (LIST_KEYS.contains(path) || node.get(leaf) instanceof ArrayNode) {
            ArrayNode array = node.putArray(leaf);
            for (String item : value.split(",")) {
                if (!item.isBlank()) {
                    array.add(item.trim());
                }
            }
        } else {
            node.put(leaf, value);
        }
    }

    private Set<String> normalizeExtensions(List<String> configured) {
        List<String> source = configured == null || configured.isEmpty() ? DEFAULT_EXTENSIONS : configured;
        Set<String> normalized = new LinkedHashSet<>();
        for (String extension : source) {
            if (extension == null || extension.isBlank()) {
                continue;
            }
            String lower = extension.trim().toLowerCase(Locale.ROOT);
            normalized.add(lower.startsWith(".") ? lower : "." + lower);
        }
        return normalized;
    }

    private Path xdgDirectory(String variable, String fallbackUnderHome) {
        String configured = environment.get(variable);
        if (configured != null && !configured.isBlank()) {
            return Path.of(configured);
        }
        return Path.of(System.getProperty("user.home")).resolve(fallbackUnderHome);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public RawMusic music;
        public RawMusicDb musicDb;
        public RawState state;
        public RawScan scan;
        public RawLogging logging;
    }

    private static class RawMusic {
        public String path;
        public List<String> extensions;
        public String ignoreMarker;
        public Integer batchSize;
        public LocalTime scanTime;
        public Integer scanIntervalMinutes;
    }

    private static class RawMusicDb {
        public String url;
        public Integer port;
        public String oneTrackEndpoint;
        public String manyTracksEndpoint;
    }

    private static class RawState {
        public String file;
    }

    private static class RawScan {
        public String checkpointPolicy;
    }

    private static class RawLogging {
        public String level;
    }
}
