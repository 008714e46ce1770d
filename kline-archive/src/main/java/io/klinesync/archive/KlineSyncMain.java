package io.klinesync.archive;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * CLI to mirror Binance public kline archives into a local directory.
 */
@CommandLine.Command(name = "klinesync", mixinStandardHelpOptions = true,
        description = "Download Binance spot kline archives (daily or monthly) into a local directory")
public final class KlineSyncMain implements Callable<Integer> {
    /** System property read by log4j2.xml for the per-run log file. */
    public static final String LOG_FILE_PROPERTY = "klinesync.logFile";
    static final int EXIT_INVALID_CONFIGURATION = 2;

    @CommandLine.Option(names = "--type", required = true, description = "Archive granularity: daily or monthly")
    String type;

    @CommandLine.Option(names = "--symbol", description = "Ticker symbol", defaultValue = SyncConfig.DEFAULT_SYMBOL)
    String symbol;

    @CommandLine.Option(names = "--incr", description = "Skip files already present in the output directory")
    boolean incremental;

    @CommandLine.Option(names = {"-i", "--intervals"}, split = ",", description = "Intervals (comma-separated); default all for the type")
    List<String> intervals = new ArrayList<>();

    @CommandLine.Option(names = "--start", description = "Start date (yyyy-MM-dd)", defaultValue = "2017-01-01")
    LocalDate startDate;

    @CommandLine.Option(names = "--end", description = "End date (yyyy-MM-dd); default today (UTC)")
    LocalDate endDate;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output directory", defaultValue = "${env:KLINESYNC_OUT:-binance_data}")
    Path outDir;

    @CommandLine.Option(names = "--base-url", description = "Archive host", defaultValue = "${env:KLINESYNC_BASE_URL:-" + ArchiveLayout.DEFAULT_BASE_URL + "}")
    String baseUrl;

    @CommandLine.Option(names = {"-c", "--concurrency"}, description = "Simultaneous transfers", defaultValue = "5")
    int concurrency;

    @CommandLine.Option(names = "--max-attempts", description = "Attempts per file", defaultValue = "3")
    int maxAttempts;

    @CommandLine.Option(names = "--backoff-ms", description = "Delay before the first retry; doubles per retry", defaultValue = "1000")
    long backoffMillis;

    @CommandLine.Option(names = "--timeout-sec", description = "Per-request timeout", defaultValue = "60")
    long timeoutSeconds;

    @CommandLine.Option(names = "--extract", negatable = true, defaultValue = "true",
            description = "Keep the extracted CSV (default) or, with --no-extract, the raw zip")
    boolean extract;

    @CommandLine.Option(names = "--max-qps", description = "Requests per second, 0 for no limit", defaultValue = "0")
    long maxQps;

    @CommandLine.Option(names = "--max-bytes-per-sec", description = "Download throughput, 0 for no limit", defaultValue = "0")
    long maxBytesPerSec;

    @CommandLine.Option(names = "--max-local-io-failures", description = "Stop after this many local storage failures", defaultValue = "10")
    int maxLocalIoFailures;

    @CommandLine.Option(names = "--log-dir", description = "Run log and failure ledger directory", defaultValue = "${env:KLINESYNC_LOG_DIR:-logs}")
    Path logDir;

    public static void main(String[] args) {
        int code = new CommandLine(new KlineSyncMain()).execute(args);
        System.exit(code);
    }

    SyncConfig toConfig() {
        List<KlineInterval> parsed = new ArrayList<>();
        for (String label : intervals) {
            if (!label.isBlank()) parsed.add(KlineInterval.fromLabel(label));
        }
        URI base;
        try {
            base = URI.create(baseUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Invalid base URL '" + baseUrl + "': " + e.getMessage());
        }
        return SyncConfig.builder(Granularity.fromName(type))
                .symbol(symbol)
                .incremental(incremental)
                .intervals(parsed)
                .startDate(startDate)
                .endDate(endDate)
                .storageRoot(outDir)
                .baseUri(base)
                .concurrency(concurrency)
                .maxAttempts(maxAttempts)
                .backoffMillis(backoffMillis)
                .maxBackoffMillis(Math.max(backoffMillis, backoffMillis * 8))
                .requestTimeout(Duration.ofSeconds(timeoutSeconds))
                .extract(extract)
                .maxRequestsPerSecond(maxQps)
                .maxBytesPerSecond(maxBytesPerSec)
                .maxLocalIoFailures(maxLocalIoFailures)
                .logDir(logDir)
                .build();
    }

    @Override
    public Integer call() throws Exception {
        SyncConfig config;
        try {
            config = toConfig();
        } catch (InvalidConfigurationException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_INVALID_CONFIGURATION;
        }

        String stamp = SyncModule.runStamp(Clock.systemUTC());
        System.setProperty(LOG_FILE_PROPERTY, SyncModule.logFile(config, stamp).toString());
        Logger log = LoggerFactory.getLogger(KlineSyncMain.class);
        log.info("Starting {} {} sync of {} into {} (base {})", config.granularity(), config.modeLabel(),
                config.symbol(), config.storageRoot().toAbsolutePath(), config.baseUri());

        Injector injector = Guice.createInjector(new SyncModule(config, stamp));
        RunCoordinator coordinator;
        try {
            coordinator = injector.getInstance(RunCoordinator.class);
        } catch (ProvisionException e) {
            log.error("Cannot prepare run: {}", e.getMessage(), e);
            return EXIT_INVALID_CONFIGURATION;
        }
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        Slf4jReporter metricsReporter = Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("klinesync.metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();
        metricsReporter.start(15, TimeUnit.SECONDS);

        Thread hook = new Thread(() -> {
            coordinator.cancel();
            try {
                coordinator.awaitFinished(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "klinesync-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            RunSummary summary = coordinator.run(config);
            return summary.exitCode();
        } catch (InvalidConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_INVALID_CONFIGURATION;
        } finally {
            metricsReporter.report();
            metricsReporter.stop();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, keeping shutdown hook");
            }
        }
    }
}
