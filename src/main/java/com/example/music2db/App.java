package com.example.music2db;

import ch.qos.logback.classic.Level;
import com.example.music2db.metadata.AudioMetadataExtractor;
import com.example.music2db.metadata.TrackRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String FALLBACK_VERSION = "0.3.0";
    private static final String USAGE = "Usage: music2db [-c <config.json>] [--run-once] [--dont-scan-now] "
            + "[-V|--version] [--section.key=value ...] [show <file> | submit <file>]";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException ex) {
            LOGGER.error("{}\n{}", ex.getMessage(), USAGE);
            System.exit(2);
            return;
        }
        if (arguments.version()) {
            System.out.println(ConfigLoader.APP_NAME + " " + version());
            return;
        }

        ConfigLoader loader = new ConfigLoader();
        Path configPath = arguments.configFile().orElse(loader.defaultConfigFile());
        ClientConfig config = loader.load(configPath, arguments.overrides());
        applyLogLevel(config.logLevel());
        LOGGER.debug("Loaded configuration from {}: {}", configPath, config);

        AudioMetadataExtractor extractor = new AudioMetadataExtractor(new Tika());
        try (HttpCatalogClient client = new HttpCatalogClient(config)) {
            if (arguments.command() != null) {
                int status = runCommand(arguments, config, extractor, client);
                if (status != 0) {
                    System.exit(status);
                }
                return;
            }
            runService(arguments, config, extractor, client);
        }
    }

    private static int runCommand(Arguments arguments,
                                  ClientConfig config,
                                  AudioMetadataExtractor extractor,
                                  CatalogClient client) throws Exception {
        TrackSubmitter submitter = new TrackSubmitter(config.musicPath(), extractor, client);
        Path file = Path.of(arguments.commandArgument());
        if ("show".equals(arguments.command())) {
            Outcome<TrackRecord> record = submitter.describe(file);
            if (!record.isSuccess()) {
                LOGGER.error("Cannot read {}: {}", file, record.getFailure());
                return 1;
            }
            System.out.println("Request that would be sent to server:");
            System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(record.getValue()));
            return 0;
        }
        Outcome<TrackRecord> sent = submitter.submit(file);
        if (!sent.isSuccess()) {
            LOGGER.error("Track {} was not submitted: {}", file, sent.getFailure());
            return 1;
        }
        LOGGER.info("Submitted {}", sent.getValue().filePath());
        return 0;
    }

    private static void runService(Arguments arguments,
                                   ClientConfig config,
                                   AudioMetadataExtractor extractor,
                                   CatalogClient client) throws InterruptedException {
        LOGGER.info("Starting {} {}", ConfigLoader.APP_NAME, version());
        ScanStateStore stateStore = new ScanStateStore(config.stateFile());
        ScanOrchestrator orchestrator = new ScanOrchestrator(config, stateStore, extractor, client);
        CancellationToken token = new CancellationToken();
        ScanScheduler scheduler = new ScanScheduler(orchestrator::scan, token);

        Thread mainThread = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down {}", ConfigLoader.APP_NAME);
            token.cancel();
            scheduler.close();
            try {
                mainThread.join(30_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown"));

        if (!arguments.dontScanNow()) {
            scheduler.runNow();
        }
        if (arguments.runOnce()) {
            LOGGER.info("Run once flag set, exiting");
            scheduler.close();
            return;
        }
        if (token.isCancellationRequested()) {
            return;
        }
        config.scanInterval().ifPresentOrElse(
                scheduler::scheduleEvery,
                () -> scheduler.scheduleDaily(config.scanTime())
        );
        scheduler.awaitShutdown();
    }

    private static void applyLogLevel(String level) {
        Logger appLogger = LoggerFactory.getLogger("com.example.music2db");
        if (appLogger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) appLogger).setLevel(Level.toLevel(level, Level.INFO));
        }
    }

    private static String version() {
        String version = App.class.getPackage().getImplementationVersion();
        return version == null ? FALLBACK_VERSION : version;
    }

    /**
     * Parsed command line. Options not recognized here are passed to
     * {@link ConfigLoader} as {@code --section.key=value} overrides.
     */
    record Arguments(
            Optional<Path> configFile,
            boolean runOnce,
            boolean dontScanNow,
            boolean version,
            List<String> overrides,
            String command,
            String commandArgument
    ) {
        static Arguments parse(String[] args) {
            Optional<Path> configFile = Optional.empty();
            boolean runOnce = false;
            boolean dontScanNow = false;
            boolean version = false;
            List<String> overrides = new ArrayList<>();
            String command = null;
            String commandArgument = null;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.equals("-c") || arg.equals("--config")) {
                    configFile = Optional.of(Path.of(requireValue(args, i, arg)));
                    i++;
                } else if (arg.equals("--run-once")) {
                    runOnce = true;
                } else if (arg.equals("--dont-scan-now")) {
                    dontScanNow = true;
                } else if (arg.equals("-V") || arg.equals("--version")) {
                    version = true;
                } else if (arg.equals("show") || arg.equals("submit")) {
                    command = arg;
                    commandArgument = requireValue(args, i, arg);
                    i++;
                } else if (arg.startsWith("--") && arg.contains("=")) {
                    overrides.add(arg);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }
            return new Arguments(configFile, runOnce, dontScanNow, version, List.copyOf(overrides), command, commandArgument);
        }

        private static String requireValue(String[] args, int index, String option) {
            if (index + 1 >= args.length) {
                throw new IllegalArgumentException(option + " needs a file argument");
            }
            return args[index + 1];
        }
    }
}
