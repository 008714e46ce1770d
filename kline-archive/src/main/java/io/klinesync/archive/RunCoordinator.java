package io.klinesync.archive;

import com.codahale.metrics.MetricRegistry;
import io.klinesync.error.DeadLetterSink;
import io.klinesync.runtime.WorkerPool;
import io.klinesync.runtime.WorkerPoolBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Drives one run: enumerate candidates, drop those already stored (incremental runs), stream the rest to
 * the fetch workers, and fold every outcome into a {@link RunSummary}.
 *
 * <p>Candidates are dispatched while the enumeration is still being walked, so a run never materializes
 * its whole target list. Outcomes come back from the workers over the pool's completion queue and are
 * counted here, on the calling thread, which is the only writer of the summary.
 *
 * <p>An instance runs once. {@link #cancel()} may be called from any thread.
 */
public class RunCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);
    static final String LEDGER_STAGE = "fetch";

    private final TargetEnumerator enumerator;
    private final LocalStoreInspector inspector;
    private final ArchiveFetcher fetcher;
    private final RunReporter reporter;
    private final DeadLetterSink<ResourceIdentifier> ledger;
    private final MetricRegistry registry;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean cancelRequested = false;
    private volatile RunState state = RunState.IDLE;
    private volatile WorkerPool<ResourceIdentifier, FetchOutcome> pool;

    private SyncConfig config;
    private RunSummary summary;

    public RunCoordinator(TargetEnumerator enumerator,
                          LocalStoreInspector inspector,
                          ArchiveFetcher fetcher,
                          RunReporter reporter,
                          DeadLetterSink<ResourceIdentifier> ledger,
                          MetricRegistry registry,
                          Clock clock) {
        this.enumerator = enumerator;
        this.inspector = inspector;
        this.fetcher = fetcher;
        this.reporter = reporter;
        this.ledger = ledger;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Runs to completion, cancellation or abort.
     *
     * @throws InvalidConfigurationException before anything is fetched when the configuration cannot
     *                                       produce a target list
     * @throws IllegalStateException         when this coordinator has already run
     */
    public RunSummary run(SyncConfig config) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("RunCoordinator instances run once");
        }
        try {
            this.config = config;
            transition(RunState.ENUMERATING);
            Iterable<ResourceIdentifier> candidates = enumerator.enumerate(config);
            long planned = enumerator.count(config);
            summary = new RunSummary(config, planned, clock.instant());
            log.info("Planned {} {} files for {} ({} intervals, {} .. {}), mode={}, concurrency={}",
                    planned, config.granularity(), config.symbol(), config.intervals().size(),
                    config.startDate(), config.endDate(), config.modeLabel(), config.concurrency());

            Predicate<ResourceIdentifier> needsFetch = id -> true;
            if (config.incremental()) {
                transition(RunState.FILTERING);
                needsFetch = id -> !inspector.exists(id);
            }

            pool = new WorkerPoolBuilder<ResourceIdentifier, FetchOutcome>()
                    .task(fetcher)
                    .fallback(fetcher)
                    .retry(config.retryPolicy())
                    .workers(config.concurrency())
                    .maxPending(config.concurrency() * 2)
                    .metrics(registry)
                    .threadPrefix("fetch")
                    .build();
            if (cancelRequested) pool.stopAccepting();
            try {
                dispatchAndCollect(candidates, needsFetch);
            } finally {
                pool.close();
            }

            summary.finish(clock.instant());
            transition(RunState.FINALIZED);
            reporter.onSummary(summary);
            return summary;
        } finally {
            finished.countDown();
        }
    }

    private void dispatchAndCollect(Iterable<ResourceIdentifier> candidates, Predicate<ResourceIdentifier> needsFetch) {
        long dispatched = 0;
        long received = 0;
        List<FetchOutcome> ready = new ArrayList<>();
        try {
            transition(RunState.DISPATCHING);
            for (ResourceIdentifier id : candidates) {
                if (stopping()) break;
                summary.candidate();
                if (!needsFetch.test(id)) {
                    fold(FetchOutcome.skipped(id));
                    continue;
                }
                reporter.onDispatch(id);
                boolean accepted;
                try {
                    accepted = pool.submit(id);
                } catch (InterruptedException e) {
                    summary.uncount();
                    throw e;
                }
                if (!accepted) {
                    summary.uncount();
                    break;
                }
                dispatched++;
                received += drain(ready);
            }
            pool.stopAccepting();

            transition(RunState.COLLECTING);
            while (received < dispatched) {
                if (Thread.interrupted()) throw new InterruptedException();
                fold(pool.take());
                received++;
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted with {} transfer(s) outstanding; abandoning them", dispatched - received);
            cancelRequested = true;
            summary.markCancelled();
            pool.cancelInflight();
            if (state != RunState.COLLECTING) transition(RunState.COLLECTING);
            collectAfterInterrupt(dispatched - received);
            Thread.currentThread().interrupt();
        }
        if (cancelRequested && !summary.isCancelled()) summary.markCancelled();
    }

    /**
     * Folds the results of transfers abandoned by an interrupt. The workers publish one result for each,
     * so this waits for all of them. A further interrupt only repeats the cancellation.
     */
    private void collectAfterInterrupt(long outstanding) {
        while (outstanding > 0) {
            try {
                fold(pool.take());
                outstanding--;
            } catch (InterruptedException again) {
                pool.cancelInflight();
            }
        }
    }

    private int drain(List<FetchOutcome> buffer) {
        buffer.clear();
        int n = pool.drainTo(buffer);
        for (FetchOutcome outcome : buffer) fold(outcome);
        return n;
    }

    private void fold(FetchOutcome outcome) {
        summary.record(outcome);
        registry.meter("run.outcome." + outcome.status().name().toLowerCase(Locale.ROOT)).mark();
        if (outcome.isFailed()) {
            try {
                ledger.acceptFailure(LEDGER_STAGE, outcome.id(), outcome.errorKind().name(), outcome.attempts(), outcome.detail());
            } catch (RuntimeException e) {
                log.error("Could not record failure of {} in the failure ledger", outcome.id(), e);
            }
            if (outcome.errorKind() == ErrorKind.LOCAL_IO
                    && summary.localIoFailures() >= config.maxLocalIoFailures()
                    && !summary.isAborted()) {
                log.error("{} local storage failures, stopping dispatch; last: {}", summary.localIoFailures(), outcome.detail());
                summary.markAborted();
                pool.stopAccepting();
            }
        }
        reporter.onOutcome(outcome, summary);
    }

    private boolean stopping() {
        if (Thread.currentThread().isInterrupted()) cancelRequested = true;
        return cancelRequested || summary.isAborted();
    }

    private void transition(RunState next) {
        state = next;
        reporter.onStateChange(next);
    }

    /**
     * Stops dispatching new identifiers. Transfers already handed to workers finish and are counted.
     */
    public void cancel() {
        if (cancelRequested) return;
        cancelRequested = true;
        log.warn("Cancellation requested");
        WorkerPool<ResourceIdentifier, FetchOutcome> p = pool;
        if (p != null) p.stopAccepting();
    }

    /** @return true when the run finished within the timeout, or was never started */
    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        if (!started.get()) return true;
        return finished.await(timeout, unit);
    }

    public RunState state() {
        return state;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }
}
