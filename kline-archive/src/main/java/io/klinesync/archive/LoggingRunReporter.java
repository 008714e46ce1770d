package io.klinesync.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Writes run progress and the final summary to the log. Each dispatch and each outcome is logged at
 * INFO, so the run log records when every file started and how it ended.
 */
public class LoggingRunReporter implements RunReporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingRunReporter.class);
    static final int PROGRESS_EVERY = 10;

    @Override
    public void onStateChange(RunState state) {
        log.debug("Run state -> {}", state);
    }

    @Override
    public void onDispatch(ResourceIdentifier id) {
        log.info("Dispatching {}", id);
    }

    @Override
    public void onOutcome(FetchOutcome outcome, RunSummary summary) {
        switch (outcome.status()) {
            case SUCCEEDED -> log.info("Downloaded {} ({} bytes, {} attempt(s))", outcome.id(), outcome.bytesWritten(), outcome.attempts());
            case SKIPPED -> log.info("Skipped {}: {}", outcome.id(), outcome.detail());
            case FAILED -> log.warn("Failed {} kind={} attempts={}: {}", outcome.id(), outcome.errorKind(), outcome.attempts(), outcome.detail());
        }
        if (summary.processed() % PROGRESS_EVERY == 0) {
            log.info(progressLine(summary));
        }
    }

    @Override
    public void onSummary(RunSummary summary) {
        SyncConfig config = summary.config();
        if (summary.processed() == 0 || summary.processed() % PROGRESS_EVERY != 0) {
            log.info(progressLine(summary));
        }
        Duration duration = summary.duration();
        double seconds = Math.max(duration.toMillis(), 1) / 1000.0;
        StringBuilder sb = new StringBuilder();
        sb.append("Run finished").append(summary.isCancelled() ? " (cancelled)" : "").append(summary.isAborted() ? " (aborted)" : "")
                .append(System.lineSeparator())
                .append("  Type: ").append(config.granularity()).append(", mode: ").append(config.modeLabel())
                .append(", symbol: ").append(config.symbol())
                .append(", range: ").append(config.startDate()).append(" .. ").append(config.endDate())
                .append(System.lineSeparator())
                .append("  Planned: ").append(summary.planned()).append(", considered: ").append(summary.total())
                .append(System.lineSeparator())
                .append("  Downloaded: ").append(summary.succeeded())
                .append(", Skipped: ").append(summary.skipped())
                .append(", Failed: ").append(summary.failed())
                .append(System.lineSeparator())
                .append("  Bytes written: ").append(summary.bytesWritten())
                .append(System.lineSeparator())
                .append(String.format(Locale.ROOT, "  Duration: %.3f s (%.2f files/s)", seconds, summary.processed() / seconds));
        log.info(sb.toString());
        if (summary.hasFailures()) {
            log.info("Failed files:");
            for (FetchOutcome f : summary.failures()) {
                log.info(failureLine(f));
            }
        }
    }

    static String progressLine(RunSummary summary) {
        long planned = summary.planned();
        long processed = summary.processed();
        double pct = planned == 0 ? 100.0 : processed * 100.0 / planned;
        return String.format(Locale.ROOT, "Progress: %.2f%% (%d/%d) [Skipped: %d, Downloaded: %d, Failed: %d]",
                pct, processed, planned, summary.skipped(), summary.succeeded(), summary.failed());
    }

    static String failureLine(FetchOutcome f) {
        return "- " + f.id().interval() + "/" + f.id().fileStem() + " kind=" + f.errorKind() + " attempts=" + f.attempts();
    }
}
