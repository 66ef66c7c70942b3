package cz.vut.fit.coloprobe;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.coloprobe.dns.InternalDNSResolver;
import cz.vut.fit.coloprobe.endpoints.EndpointFileParser;
import cz.vut.fit.coloprobe.geo.CachingGeoLocator;
import cz.vut.fit.coloprobe.geo.GeoLocator;
import cz.vut.fit.coloprobe.geo.HttpGeoLocator;
import cz.vut.fit.coloprobe.logging.LogFileConfigurator;
import cz.vut.fit.coloprobe.models.EndpointRecord;
import cz.vut.fit.coloprobe.orchestration.ProbeOrchestrator;
import cz.vut.fit.coloprobe.orchestration.ProbeReport;
import cz.vut.fit.coloprobe.orchestration.ProgressListener;
import cz.vut.fit.coloprobe.region.RegionClassifier;
import cz.vut.fit.coloprobe.report.HtmlReportWriter;
import cz.vut.fit.coloprobe.report.JsonReportWriter;
import cz.vut.fit.coloprobe.tls.TLSHandshakeProber;
import org.apache.commons.cli.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * The main class of the prober.
 * <p>
 * Loads the endpoint file, measures the TLS handshake latency to every address of every endpoint
 * and writes the JSON and HTML reports.
 */
public class ProbeRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(ProbeRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_INPUT = 1;
    public static final int EXIT_INVALID_PROPERTIES = 2;
    public static final int EXIT_REPORT_FAILED = 3;
    public static final int EXIT_INTERRUPTED = 4;

    public static final String DEFAULT_URL_FILE = "data/endpoints.txt";
    public static final String DEFAULT_OUTPUT_JSON = "results/latency_results.json";
    public static final String DEFAULT_OUTPUT_HTML = "results/latency_results.html";
    public static final String DEFAULT_LOG_FILE = "results/latency.log";

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs the prober with the given command line.
     *
     * @param args The command line arguments.
     * @param out  The stream for the progress and the final summary.
     * @return The process exit code.
     */
    public static int run(String[] args, PrintStream out) {
        final var options = makeOptions();

        final CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp(options);
            return EXIT_INVALID_INPUT;
        }

        if (cmd.hasOption("h")) {
            printHelp(options);
            return EXIT_OK;
        }

        final Properties properties = initProperties(cmd);
        if (properties == null)
            return EXIT_INVALID_PROPERTIES;

        // The command-line flags take precedence over the properties
        if (cmd.hasOption("workers"))
            properties.setProperty(ProbeConfig.WORKERS_CONFIG, cmd.getOptionValue("workers"));
        if (cmd.hasOption("threshold"))
            properties.setProperty(ProbeConfig.THRESHOLD_MS_CONFIG, cmd.getOptionValue("threshold"));

        final int workers;
        final double threshold;
        try {
            workers = Common.getInt(properties, ProbeConfig.WORKERS_CONFIG, ProbeConfig.WORKERS_DEFAULT);
            threshold = Common.getDouble(properties, ProbeConfig.THRESHOLD_MS_CONFIG,
                    ProbeConfig.THRESHOLD_MS_DEFAULT);
        } catch (NumberFormatException e) {
            Logger.error("Invalid number: {}", e.getMessage());
            System.err.println("Error: invalid number: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        if (workers < 1) {
            System.err.println("Error: the number of workers must be positive");
            return EXIT_INVALID_INPUT;
        }

        final var logFile = Path.of(cmd.getOptionValue("log-file", DEFAULT_LOG_FILE));
        try {
            LogFileConfigurator.attachFileAppender(logFile);
        } catch (IOException | RuntimeException e) {
            Logger.warn("Cannot log to the file {}: {}", logFile, e.getMessage());
        }

        try {
            return probe(cmd, properties, workers, threshold, out);
        } finally {
            LogFileConfigurator.detachFileAppender();
        }
    }

    private static int probe(CommandLine cmd, Properties properties, int workers, double threshold,
                             PrintStream out) {
        final var urlFile = Path.of(cmd.getOptionValue("url-file", DEFAULT_URL_FILE));
        final var jsonFile = Path.of(cmd.getOptionValue("output-json", DEFAULT_OUTPUT_JSON));
        final var htmlFile = Path.of(cmd.getOptionValue("output-html", DEFAULT_OUTPUT_HTML));

        if (!Files.isRegularFile(urlFile)) {
            Logger.error("URL file not found: {}", urlFile);
            System.err.println("Error: URL file not found: " + urlFile);
            return EXIT_INVALID_INPUT;
        }

        out.println("Loading endpoints...");
        final List<EndpointRecord> endpoints;
        try {
            endpoints = EndpointFileParser.parse(urlFile);
        } catch (IOException e) {
            Logger.error("Cannot read the URL file {}", urlFile, e);
            System.err.println("Error: cannot read the URL file: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }
        out.printf("Found %d endpoints%n", endpoints.size());

        final ObjectMapper jsonMapper = Common.makeMapper().build();
        final InternalDNSResolver resolver;
        final RegionClassifier regionClassifier;
        final TLSHandshakeProber prober;
        final GeoLocator geoLocator;
        try {
            resolver = new InternalDNSResolver(properties);
            regionClassifier = new RegionClassifier(resolver, properties);
            prober = new TLSHandshakeProber(properties);
            geoLocator = makeGeoLocator(properties, jsonMapper);
        } catch (UnknownHostException | IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            Logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println("Error: invalid configuration: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        final ProbeReport report;
        try (var orchestrator = new ProbeOrchestrator(resolver, prober, regionClassifier, geoLocator,
                workers, threshold)) {
            out.println("Testing TLS handshake + geo + AWS region...");
            report = orchestrator.run(endpoints, progressPrinter(out));
        } catch (InterruptedException e) {
            Logger.error("Interrupted while waiting for the results");
            Thread.currentThread().interrupt();
            return EXIT_INTERRUPTED;
        } finally {
            prober.close();
            if (geoLocator instanceof CachingGeoLocator cachingGeoLocator) {
                cachingGeoLocator.close();
            }
        }

        out.println();
        out.println("Saving results...");
        try {
            new JsonReportWriter(jsonMapper).write(report, jsonFile);
            new HtmlReportWriter().write(report, htmlFile);
        } catch (IOException e) {
            Logger.error("Failed to write the reports", e);
            System.err.println("Error: failed to write the reports: " + e.getMessage());
            return EXIT_REPORT_FAILED;
        }

        final var summary = report.summary();
        out.printf(Locale.ROOT, "DONE! %d/%d IPs are COLO (%.1f%%)%n", summary.coloCount(), summary.totalCount(),
                summary.coloPercentage());
        out.println("JSON: " + jsonFile);
        out.println("HTML: " + htmlFile);
        Logger.info("Reports written to {} and {}", jsonFile, htmlFile);
        return EXIT_OK;
    }

    private static GeoLocator makeGeoLocator(Properties properties, ObjectMapper mapper) {
        final var httpGeoLocator = new HttpGeoLocator(properties, mapper);
        if (!Common.getBoolean(properties, ProbeConfig.GEO_CACHE_ENABLED_CONFIG,
                ProbeConfig.GEO_CACHE_ENABLED_DEFAULT)) {
            return httpGeoLocator;
        }

        final var lifetime = Duration.ofSeconds(Common.getInt(properties, ProbeConfig.GEO_CACHE_LIFETIME_S_CONFIG,
                ProbeConfig.GEO_CACHE_LIFETIME_S_DEFAULT));
        Logger.info("Geolocation results are cached for {} s", lifetime.toSeconds());
        return new CachingGeoLocator(httpGeoLocator, lifetime);
    }

    private static ProgressListener progressPrinter(PrintStream out) {
        return (result, completed, total) -> {
            out.printf("\rTLS + Geo: %d/%d", completed, total);
            out.flush();
        };
    }

    /**
     * Creates the command line options.
     */
    @NotNull
    static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");

        options.addOption(Option.builder("u")
                .longOpt("url-file")
                .desc("Path to the endpoint definition file (default: " + DEFAULT_URL_FILE + ")")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder()
                .longOpt("output-json")
                .desc("JSON report path (default: " + DEFAULT_OUTPUT_JSON + ")")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder()
                .longOpt("output-html")
                .desc("HTML report path (default: " + DEFAULT_OUTPUT_HTML + ")")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("w")
                .longOpt("workers")
                .desc("Number of targets probed in parallel (default: " + ProbeConfig.WORKERS_DEFAULT + ")")
                .argName("n")
                .hasArg()
                .build());
        options.addOption(Option.builder("t")
                .longOpt("threshold")
                .desc("Co-location latency threshold in ms (default: " + ProbeConfig.THRESHOLD_MS_DEFAULT + ")")
                .argName("ms")
                .hasArg()
                .build());
        options.addOption(Option.builder()
                .longOpt("log-file")
                .desc("Log file path (default: " + DEFAULT_LOG_FILE + ")")
                .argName("path")
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
     * @return The initialized Properties instance, or null if the properties file cannot be read.
     */
    @Nullable
    static Properties initProperties(CommandLine cmd) {
        final Properties props = new Properties();

        if (cmd.hasOption("properties")) {
            // Open the file and load the properties
            var path = cmd.getOptionValue("properties");
            try (var inStream = new FileInputStream(path)) {
                props.load(inStream);
            } catch (IOException e) {
                Logger.error("Failed to load properties: {}", e.getMessage());
                System.err.println("Error: failed to load properties: " + e.getMessage());
                return null;
            }
        }

        // Add the --option properties
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

    private static void printHelp(Options options) {
        final var formatter = new HelpFormatter();
        formatter.printHelp(119, "coloprobe [options]", "", options, "");
    }
}
