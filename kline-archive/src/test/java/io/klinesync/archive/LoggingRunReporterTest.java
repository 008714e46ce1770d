package io.klinesync.archive;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingRunReporterTest {
    private final SyncConfig config = SyncConfig.builder(Granularity.DAILY).build();

    @Test
    void progress_line_counts_each_status() {
        RunSummary summary = new RunSummary(config, 3, Instant.now());
        ResourceIdentifier a = ResourceIdentifier.daily("BTCUSDT", KlineInterval.H1, LocalDate.of(2024, 1, 1));
        summary.candidate();
        summary.record(FetchOutcome.skipped(a));

        assertEquals("Progress: 33.33% (1/3) [Skipped: 1, Downloaded: 0, Failed: 0]", LoggingRunReporter.progressLine(summary));

        summary.candidate();
        summary.record(FetchOutcome.succeeded(a, 10, 1));
        summary.candidate();
        summary.record(FetchOutcome.failed(a, ErrorKind.NOT_FOUND, 1, "HTTP 404"));
        assertEquals("Progress: 100.00% (3/3) [Skipped: 1, Downloaded: 1, Failed: 1]", LoggingRunReporter.progressLine(summary));
    }

    @Test
    void empty_plan_reports_complete() {
        RunSummary summary = new RunSummary(config, 0, Instant.now());
        assertEquals("Progress: 100.00% (0/0) [Skipped: 0, Downloaded: 0, Failed: 0]", LoggingRunReporter.progressLine(summary));
    }

    @Test
    void failure_line_names_interval_and_file() {
        ResourceIdentifier id = ResourceIdentifier.daily("BTCUSDT", KlineInterval.H1, LocalDate.of(2024, 1, 2));
        FetchOutcome f = FetchOutcome.failed(id, ErrorKind.NOT_FOUND, 1, "HTTP 404");
        assertEquals("- 1h/BTCUSDT-1h-2024-01-02 kind=NOT_FOUND attempts=1", LoggingRunReporter.failureLine(f));
    }

    @Test
    void summary_exit_codes() {
        ResourceIdentifier id = ResourceIdentifier.daily("BTCUSDT", KlineInterval.H1, LocalDate.of(2024, 1, 2));
        RunSummary clean = new RunSummary(config, 1, Instant.now());
        clean.record(FetchOutcome.succeeded(id, 1, 1));
        assertEquals(0, clean.exitCode());

        RunSummary failed = new RunSummary(config, 1, Instant.now());
        failed.record(FetchOutcome.failed(id, ErrorKind.LOCAL_IO, 1, "disk"));
        assertEquals(1, failed.exitCode());
        assertEquals(1, failed.localIoFailures());

        failed.markCancelled();
        assertEquals(3, failed.exitCode());
    }

    @Test
    void reporter_logs_without_failing() {
        LoggingRunReporter reporter = new LoggingRunReporter();
        RunSummary summary = new RunSummary(config, 12, Instant.now());
        for (int i = 0; i < 12; i++) {
            ResourceIdentifier id = ResourceIdentifier.daily("BTCUSDT", KlineInterval.H1, LocalDate.of(2024, 1, 1).plusDays(i));
            FetchOutcome o = i % 4 == 0 ? FetchOutcome.failed(id, ErrorKind.TRANSIENT, 3, "HTTP 503") : FetchOutcome.succeeded(id, 5, 1);
            summary.candidate();
            summary.record(o);
            reporter.onOutcome(o, summary);
        }
        summary.finish(Instant.now());
        reporter.onSummary(summary);
        assertEquals(3, summary.failures().size());
        assertEquals(45, summary.bytesWritten());
    }

    @Test
    void start_and_outcome_of_each_file_are_logged_at_info() {
        String loggerName = LoggingRunReporter.class.getName();
        CapturingAppender appender = new CapturingAppender();
        appender.start();
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        LoggerConfig loggerConfig = ctx.getConfiguration().getLoggerConfig(loggerName);
        loggerConfig.addAppender(appender, Level.INFO, null);
        ctx.updateLoggers();
        try {
            LoggingRunReporter reporter = new LoggingRunReporter();
            RunSummary summary = new RunSummary(config, 2, Instant.now());
            ResourceIdentifier fetched = ResourceIdentifier.daily("BTCUSDT", KlineInterval.H1, LocalDate.of(2024, 1, 1));
            ResourceIdentifier present = ResourceIdentifier.daily("BTCUSDT", KlineInterval.H1, LocalDate.of(2024, 1, 2));

            reporter.onDispatch(fetched);
            summary.candidate();
            summary.record(FetchOutcome.succeeded(fetched, 5, 1));
            reporter.onOutcome(FetchOutcome.succeeded(fetched, 5, 1), summary);
            summary.candidate();
            summary.record(FetchOutcome.skipped(present));
            reporter.onOutcome(FetchOutcome.skipped(present), summary);

            List<String> lines = appender.messagesFrom(loggerName);
            assertTrue(lines.contains("Dispatching " + fetched), lines.toString());
            assertTrue(lines.contains("Downloaded " + fetched + " (5 bytes, 1 attempt(s))"), lines.toString());
            assertTrue(lines.contains("Skipped " + present + ": " + FetchOutcome.ALREADY_PRESENT), lines.toString());
        } finally {
            loggerConfig.removeAppender(appender.getName());
            ctx.updateLoggers();
            appender.stop();
        }
    }

    @Test
    void run_log_config_keeps_info_from_the_reporter() throws Exception {
        LoggerContext ctx = new LoggerContext("run-log-config", null, getClass().getResource("/log4j2.xml").toURI());
        ctx.start();
        try {
            LoggerConfig reporterConfig = ctx.getConfiguration().getLoggerConfig(LoggingRunReporter.class.getName());
            assertTrue(Level.INFO.isMoreSpecificThan(reporterConfig.getLevel()), "level " + reporterConfig.getLevel());
            assertTrue(reporterConfig.getAppenders().containsKey("RunLog"), reporterConfig.getAppenders().toString());
        } finally {
            ctx.stop();
        }
    }

    static final class CapturingAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        CapturingAppender() {
            super("capture-" + System.nanoTime(), null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<String> messagesFrom(String loggerName) {
            return events.stream()
                    .filter(e -> loggerName.equals(e.getLoggerName()))
                    .map(e -> e.getMessage().getFormattedMessage())
                    .toList();
        }
    }
}
