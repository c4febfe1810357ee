package cz.vut.fit.iocradar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import cz.vut.fit.iocradar.aggregation.AggregationEngine;
import cz.vut.fit.iocradar.models.IndicatorKind;
import cz.vut.fit.iocradar.monitor.FeedMonitor;
import cz.vut.fit.iocradar.monitor.StatsCache;
import cz.vut.fit.iocradar.monitor.SyntheticObservationFeed;
import cz.vut.fit.iocradar.notifications.KafkaNotificationSink;
import cz.vut.fit.iocradar.notifications.LoggingNotificationSink;
import cz.vut.fit.iocradar.notifications.NotificationSink;
import cz.vut.fit.iocradar.sources.SourceLookup;
import cz.vut.fit.iocradar.sources.repsystems.AbuseIpDbSourceLookup;
import cz.vut.fit.iocradar.sources.repsystems.VirusTotalSourceLookup;
import cz.vut.fit.iocradar.store.InMemoryIndicatorBackend;
import cz.vut.fit.iocradar.store.IndicatorBackend;
import cz.vut.fit.iocradar.store.IndicatorStore;
import cz.vut.fit.iocradar.store.PostgresIndicatorBackend;
import org.apache.commons.cli.*;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * The main class of the IOC aggregation engine.
 * <p>
 * Without the lookup option, the runner starts the feed monitor and runs until the process is terminated.
 * With it, the runner performs one lookup, prints the resulting record and exits.
 */
public class IocRadarRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(IocRadarRunner.class);

    public static void main(String[] args) {
        final var options = makeOptions();
        final var cmd = parseCommandLine(args, options);
        if (cmd == null) return;

        final ObjectMapper jsonMapper = Common.makeMapper().build();
        final Properties properties = initProperties(cmd);

        final IndicatorBackend backend = initBackend(properties);
        final var store = new IndicatorStore(backend, Clock.systemUTC());
        final var engine = new AggregationEngine(store, initSources(properties), properties);

        if (cmd.hasOption("lookup")) {
            System.exit(runLookup(cmd, engine, jsonMapper));
            return;
        }

        final var sinks = initSinks(properties, jsonMapper);
        final var cadence = Common.secondsProperty(properties, AggregatorConfig.MONITOR_INTERVAL_SEC_CONFIG,
                AggregatorConfig.MONITOR_INTERVAL_SEC_DEFAULT);
        final var monitor = new FeedMonitor(engine, SyntheticObservationFeed.fromProperties(properties),
                new StatsCache(cadence, store.getClock()), sinks, properties);

        // A latch used to wait for the shutdown signal
        final CountDownLatch latch = new CountDownLatch(1);
        // Register a shutdown hook to release the latch
        Runtime.getRuntime().addShutdownHook(new Thread(latch::countDown, "system-shutdown-hook"));

        monitor.start();

        try {
            // Wait for the shutdown signal
            latch.await();
            Logger.info("Exiting");
            monitor.close();
            for (var sink : sinks) {
                try {
                    sink.close();
                } catch (Exception e) {
                    Logger.warn("Failed to close sink {}", sink.getClass().getSimpleName(), e);
                }
            }
            engine.close();
            backend.close();
            System.exit(0);
        } catch (InterruptedException e) {
            Logger.error("Unhandled exception", e);
            System.exit(1);
        }
    }

    private static int runLookup(CommandLine cmd, AggregationEngine engine, ObjectMapper mapper) {
        final var value = cmd.getOptionValue("lookup").trim();
        IndicatorKind kind;
        try {
            kind = cmd.hasOption("kind") ? IndicatorKind.fromId(cmd.getOptionValue("kind"))
                    : IndicatorKind.detect(value);
        } catch (IllegalArgumentException e) {
            Logger.error(e.getMessage());
            return 1;
        }

        if (kind == null) {
            Logger.error("Cannot detect the kind of '{}', use the --kind option", value);
            return 1;
        }

        try (engine) {
            var result = engine.lookupOrFetch(value, kind);
            if (result.isEmpty()) {
                Logger.info("No source has data about {} ({})", value, kind);
                return 5;
            }
            System.out.println(mapper.copy().enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(result.get()));
            return 0;
        } catch (StorageUnavailableException e) {
            Logger.error("The store is not available", e);
            return 6;
        } catch (JsonProcessingException e) {
            Logger.error("Cannot print the result", e);
            return 1;
        }
    }

    @NotNull
    private static IndicatorBackend initBackend(Properties properties) {
        var backendName = properties.getProperty(AggregatorConfig.STORE_BACKEND_CONFIG,
                AggregatorConfig.STORE_BACKEND_DEFAULT).trim();
        try {
            switch (backendName) {
                case "memory":
                    return new InMemoryIndicatorBackend();
                case "postgres":
                    var backend = PostgresIndicatorBackend.fromProperties(properties);
                    backend.ensureSchema();
                    return backend;
                default:
                    Logger.error("Unknown store backend: {}", backendName);
                    System.exit(4);
                    return null;
            }
        } catch (StorageUnavailableException | IllegalArgumentException e) {
            Logger.error("Failed to initialize the store backend", e);
            System.exit(4);
            return null;
        }
    }

    @NotNull
    private static List<SourceLookup> initSources(Properties properties) {
        var sources = new ArrayList<SourceLookup>();
        sources.add(new VirusTotalSourceLookup(properties));
        sources.add(new AbuseIpDbSourceLookup(properties));

        for (var source : sources) {
            Logger.info("Source {}: {}", source.getName(),
                    Arrays.stream(IndicatorKind.values()).anyMatch(source::supports) ? "enabled" : "disabled");
        }
        return sources;
    }

    @NotNull
    private static List<NotificationSink> initSinks(Properties properties, ObjectMapper mapper) {
        var sinks = new ArrayList<NotificationSink>();
        sinks.add(new LoggingNotificationSink());

        if (Boolean.parseBoolean(properties.getProperty(AggregatorConfig.KAFKA_NOTIFICATIONS_ENABLED_CONFIG,
                AggregatorConfig.KAFKA_NOTIFICATIONS_ENABLED_DEFAULT))) {
            if (!properties.containsKey(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG)) {
                Logger.error("Bootstrap servers not set. Use the {} property key or the -s option.",
                        ProducerConfig.BOOTSTRAP_SERVERS_CONFIG);
                System.exit(3);
            }
            sinks.add(KafkaNotificationSink.create(properties, mapper));
        }
        return sinks;
    }

    /**
     * Parses the command line arguments.
     *
     * @param args    The command line arguments to parse.
     * @param options The Options instance containing the command line options.
     * @return The parsed CommandLine instance, or null if parsing fails or help is requested.
     */
    @Nullable
    private static CommandLine parseCommandLine(String[] args, Options options) {
        final var parser = new DefaultParser();

        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            if (Arrays.stream(args).anyMatch(arg -> arg.equals("-h") || arg.equals("--help"))) {
                printHelpAndExit(options, 0);
                return null;
            }

            System.err.println(e.getMessage());
            printHelpAndExit(options, 1);
            return null;
        }

        if (cmd.hasOption("h")) {
            printHelpAndExit(options, 0);
            return null;
        }
        return cmd;
    }

    @NotNull
    private static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");

        options.addOption(Option.builder("l")
                .longOpt("lookup")
                .desc("Look up one indicator, print the record and exit")
                .argName("value")
                .hasArg()
                .build());
        options.addOption(Option.builder("k")
                .longOpt("kind")
                .desc("The kind of the looked up indicator (ip, domain, hash, url); detected if omitted")
                .argName("kind")
                .hasArg()
                .build());
        options.addOption(Option.builder("s")
                .longOpt("bootstrap-server")
                .desc("Kafka bootstrap server(s) IP:port, separated by commas; enables Kafka notifications")
                .argName("ip:port")
                .hasArg()
                .build());
        options.addOption(Option.builder("p")
                .longOpt("properties")
                .desc("Path to a configuration file")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("o")
                .longOpt("option")
                .desc("A properties key/value to add to the configuration")
                .argName("key=value")
                .hasArg()
                .build());

        return options;
    }

    /**
     * Initializes the properties from the file and the --option passed in the command line.
     *
     * @param cmd The parsed command line arguments.
     * @return The initialized Properties instance.
     */
    private static Properties initProperties(CommandLine cmd) {
        final Properties props = new Properties();

        if (cmd.hasOption("properties")) {
            var path = cmd.getOptionValue("properties");
            try (var inStream = new FileInputStream(path)) {
                props.load(inStream);
            } catch (IOException e) {
                Logger.error("Failed to load properties: {}", e.getMessage());
                System.exit(2);
                return null;
            }
        }

        final var cmdLineBootstrapServers = cmd.getOptionValue("bootstrap-server");
        if (cmdLineBootstrapServers != null) {
            props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, cmdLineBootstrapServers);
            props.put(AggregatorConfig.KAFKA_NOTIFICATIONS_ENABLED_CONFIG, "true");
        }

        var cmdLineProperties = cmd.getOptionValues("option");
        if (cmdLineProperties != null) {
            for (var option : cmdLineProperties) {
                if (option.contains("=")) {
                    var parts = option.split("=", 2);
                    props.put(parts[0], parts[1]);
                } else {
                    Logger.warn("Ignoring invalid command-line option: {}", option);
                }
            }
        }
        return props;
    }

    private static void printHelpAndExit(Options options, int exitCode) {
        final var formatter = new HelpFormatter();
        formatter.printHelp(119, "iocradar [options]", "", options, "");
        System.exit(exitCode);
    }
}
