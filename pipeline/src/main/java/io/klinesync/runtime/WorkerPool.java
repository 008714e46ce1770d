package io.klinesync.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.klinesync.core.Fallback;
import io.klinesync.core.Task;
import io.klinesync.metrics.Metrics;
import io.klinesync.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool that runs a {@link Task} per submitted input with retries, and publishes exactly one
 * result per accepted input on a completion queue.
 *
 * <p>At most {@code workers} tasks run at once. Accepted inputs that have not finished (running or
 * waiting for a worker) are capped at {@code maxPending}; {@link #submit} blocks beyond that until a
 * result is published. Results arrive in completion order, not submission order.
 */
public class WorkerPool<I, R> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final Task<I, R> task;
    private final Fallback<I, R> fallback;
    private final RetryPolicy retryPolicy;
    private final int workers;
    private final int maxPending;

    private final ExecutorService workerPool;
    private final LinkedBlockingQueue<R> completions = new LinkedBlockingQueue<>();
    private final Semaphore pendingSlots;
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicInteger inflight = new AtomicInteger(0);
    private final AtomicInteger active = new AtomicInteger(0);
    private final AtomicInteger peakActive = new AtomicInteger(0);
    private final Set<Thread> running = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled = false;

    private final Timer taskTimer;
    private final Meter submittedMeter;
    private final Meter completedMeter;
    private final Meter errorMeter;
    private final Counter retryCounter;

    public WorkerPool(Task<I, R> task,
                      Fallback<I, R> fallback,
                      RetryPolicy retryPolicy,
                      int workers,
                      int maxPending,
                      Metrics metrics,
                      String threadPrefix) {
        this.task = Objects.requireNonNull(task);
        this.fallback = Objects.requireNonNull(fallback);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        Objects.requireNonNull(metrics);
        this.workers = Math.max(1, workers);
        this.maxPending = Math.max(this.workers, maxPending);
        this.pendingSlots = new Semaphore(this.maxPending);
        this.workerPool = Executors.newFixedThreadPool(this.workers, namedThreads(threadPrefix == null ? "worker" : threadPrefix));
        this.taskTimer = metrics.timer("pool.task.time");
        this.submittedMeter = metrics.meter("pool.submitted");
        this.completedMeter = metrics.meter("pool.completed");
        this.errorMeter = metrics.meter("pool.errors");
        this.retryCounter = metrics.counter("pool.retries");
    }

    /**
     * Hands one input to the pool, blocking while {@code maxPending} inputs are unfinished.
     *
     * @return false when the pool no longer accepts work; the input then produces no result
     */
    public boolean submit(I input) throws InterruptedException {
        Objects.requireNonNull(input, "input");
        if (!accepting.get()) return false;
        pendingSlots.acquire();
        if (!accepting.get()) {
            pendingSlots.release();
            return false;
        }
        inflight.incrementAndGet();
        try {
            workerPool.execute(() -> process(input));
        } catch (RejectedExecutionException e) {
            inflight.decrementAndGet();
            pendingSlots.release();
            return false;
        }
        submittedMeter.mark();
        return true;
    }

    /** Waits for the next result. */
    public R take() throws InterruptedException {
        return completions.take();
    }

    /** Waits up to the timeout for the next result; null when none arrived. */
    public R poll(long timeout, TimeUnit unit) throws InterruptedException {
        return completions.poll(timeout, unit);
    }

    /** Moves every result published so far into the collection, without waiting. */
    public int drainTo(Collection<? super R> target) {
        return completions.drainTo(target);
    }

    /** Stops accepting submissions. Accepted inputs still run to completion. */
    public void stopAccepting() {
        accepting.set(false);
    }

    public boolean isAccepting() { return accepting.get(); }
    public int getInflight() { return inflight.get(); }
    public int getActive() { return active.get(); }
    public int getPeakActive() { return peakActive.get(); }
    public int getWorkers() { return workers; }
    public int getMaxPending() { return maxPending; }

    /**
     * Stops accepting submissions and abandons accepted work: running tasks are interrupted, and inputs
     * still waiting for a worker go straight to the fallback. Every accepted input still publishes one
     * result.
     */
    public void cancelInflight() {
        stopAccepting();
        cancelled = true;
        for (Thread t : running) t.interrupt();
    }

    private void process(I in) {
        Thread self = Thread.currentThread();
        running.add(self);
        int nowActive = active.incrementAndGet();
        peakActive.accumulateAndGet(nowActive, Math::max);
        R result = null;
        try {
            int attempt = 0;
            if (cancelled) {
                result = fallback.onExhausted(in, new InterruptedException("cancelled before start"), 0);
            }
            while (result == null) {
                if (cancelled && attempt > 0) {
                    result = fallback.onExhausted(in, new InterruptedException("cancelled"), attempt);
                    break;
                }
                attempt++;
                try (Timer.Context ignored = taskTimer.time()) {
                    result = Objects.requireNonNull(task.run(in, attempt), "task returned null");
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    errorMeter.mark();
                    result = fallback.onExhausted(in, ie, attempt);
                } catch (Exception e) {
                    errorMeter.mark();
                    if (retryPolicy.shouldRetry(attempt, e) && !Thread.currentThread().isInterrupted()) {
                        long backoff = retryPolicy.backoffMillis(attempt);
                        log.debug("Attempt {}/{} failed for {}, retrying in {} ms: {}",
                                attempt, retryPolicy.maxAttempts(), in, backoff, e.getMessage());
                        retryCounter.inc();
                        if (!sleepQuiet(backoff)) {
                            result = fallback.onExhausted(in, e, attempt);
                        }
                    } else {
                        result = fallback.onExhausted(in, e, attempt);
                    }
                }
            }
        } finally {
            running.remove(self);
            active.decrementAndGet();
            if (result != null) {
                completions.add(result);
                completedMeter.mark();
            } else {
                log.error("No result produced for {}", in);
            }
            inflight.decrementAndGet();
            pendingSlots.release();
        }
    }

    /** @return false when interrupted */
    private static boolean sleepQuiet(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Stops accepting work and waits for accepted inputs to finish.
     *
     * @return true when every accepted input finished within the timeout
     */
    public boolean shutdown(long timeout, TimeUnit unit) throws InterruptedException {
        stopAccepting();
        workerPool.shutdown();
        return workerPool.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        stopAccepting();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(60, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
