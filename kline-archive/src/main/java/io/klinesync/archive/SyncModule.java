package io.klinesync.archive;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.klinesync.budget.Budget;
import io.klinesync.budget.SimpleBudgetManager;
import io.klinesync.error.DeadLetterSink;
import io.klinesync.error.FileDeadLetterSink;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public class SyncModule extends AbstractModule {
    static final DateTimeFormatter RUN_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final SyncConfig config;
    private final String runStamp;

    public SyncModule(SyncConfig config, String runStamp) {
        this.config = config;
        this.runStamp = runStamp;
    }

    public static String runStamp(Clock clock) {
        return ZonedDateTime.now(clock).format(RUN_STAMP);
    }

    /** {@code <logDir>/binance_<type>_<full|incr>_<stamp>.log} */
    public static Path logFile(SyncConfig config, String runStamp) {
        return config.logDir().resolve("binance_" + config.granularity().pathSegment() + "_" + config.modeLabel() + "_" + runStamp + ".log");
    }

    /** {@code <logDir>/failed_<type>_<full|incr>_<stamp>.jsonl} */
    public static Path ledgerFile(SyncConfig config, String runStamp) {
        return config.logDir().resolve("failed_" + config.granularity().pathSegment() + "_" + config.modeLabel() + "_" + runStamp + ".jsonl");
    }

    @Override
    protected void configure() {
        bind(SyncConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.system(ZoneOffset.UTC));
        bind(RunReporter.class).to(LoggingRunReporter.class);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Budget budget() { return new SimpleBudgetManager(config.maxBytesPerSecond(), config.maxRequestsPerSecond()); }

    @Provides @Singleton ArchiveLayout layout() { return config.layout(); }

    @Provides @Singleton ArchiveClient archiveClient(Budget budget) { return new HttpArchiveClient(config.requestTimeout(), budget); }

    @Provides @Singleton ArchiveFetcher fetcher(ArchiveClient client, ArchiveLayout layout, MetricRegistry registry) {
        return new ArchiveFetcher(client, layout, registry);
    }

    @Provides @Singleton TargetEnumerator enumerator(Clock clock) { return new TargetEnumerator(clock); }

    @Provides @Singleton LocalStoreInspector inspector(ArchiveLayout layout) { return new LocalStoreInspector(layout); }

    @Provides @Singleton DeadLetterSink<ResourceIdentifier> ledger() throws IOException {
        return new FileDeadLetterSink<>(ledgerFile(config, runStamp));
    }

    @Provides @Singleton RunCoordinator coordinator(TargetEnumerator enumerator, LocalStoreInspector inspector, ArchiveFetcher fetcher,
                                                    RunReporter reporter, DeadLetterSink<ResourceIdentifier> ledger,
                                                    MetricRegistry registry, Clock clock) {
        return new RunCoordinator(enumerator, inspector, fetcher, reporter, ledger, registry, clock);
    }
}
