package io.klinesync.archive;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate result of a run. Mutated only by the coordinator's thread while the run is in progress; read
 * freely once {@link #isFinished()}.
 */
public final class RunSummary {
    private final SyncConfig config;
    private final long planned;
    private final Instant startedAt;
    private Instant finishedAt;

    private long total;
    private long succeeded;
    private long skipped;
    private long failed;
    private long localIoFailures;
    private long bytesWritten;
    private final List<FetchOutcome> failures = new ArrayList<>();
    private boolean cancelled;
    private boolean aborted;

    RunSummary(SyncConfig config, long planned, Instant startedAt) {
        this.config = config;
        this.planned = planned;
        this.startedAt = startedAt;
    }

    /** Counts an identifier the coordinator took from the enumeration. */
    void candidate() {
        total++;
    }

    /** Reverts {@link #candidate()} for an identifier the workers refused. */
    void uncount() {
        total--;
    }

    void record(FetchOutcome outcome) {
        switch (outcome.status()) {
            case SUCCEEDED -> {
                succeeded++;
                bytesWritten += outcome.bytesWritten();
            }
            case SKIPPED -> skipped++;
            case FAILED -> {
                failed++;
                if (outcome.errorKind() == ErrorKind.LOCAL_IO) localIoFailures++;
                failures.add(outcome);
            }
        }
    }

    void markCancelled() { cancelled = true; }
    void markAborted() { aborted = true; }

    void finish(Instant at) {
        this.finishedAt = at;
    }

    public SyncConfig config() { return config; }
    /** Identifiers the enumeration holds for this configuration. */
    public long planned() { return planned; }
    /** Identifiers actually taken from the enumeration; below {@link #planned()} only when cancelled or aborted. */
    public long total() { return total; }
    public long succeeded() { return succeeded; }
    public long skipped() { return skipped; }
    public long failed() { return failed; }
    public long localIoFailures() { return localIoFailures; }
    public long bytesWritten() { return bytesWritten; }
    public long processed() { return succeeded + skipped + failed; }
    /** Failed outcomes in the order they were collected. */
    public List<FetchOutcome> failures() { return Collections.unmodifiableList(failures); }
    public boolean isCancelled() { return cancelled; }
    public boolean isAborted() { return aborted; }
    public boolean isFinished() { return finishedAt != null; }
    public boolean hasFailures() { return failed > 0; }
    public Instant startedAt() { return startedAt; }
    public Instant finishedAt() { return finishedAt; }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt == null ? Instant.now() : finishedAt);
    }

    /**
     * Process exit status: 0 clean, 1 some identifiers failed, 3 cancelled or aborted.
     */
    public int exitCode() {
        if (cancelled || aborted) return 3;
        return failed > 0 ? 1 : 0;
    }

    @Override
    public String toString() {
        return "RunSummary{total=" + total + ", succeeded=" + succeeded + ", skipped=" + skipped + ", failed=" + failed
                + (cancelled ? ", cancelled" : "") + (aborted ? ", aborted" : "") + '}';
    }
}
