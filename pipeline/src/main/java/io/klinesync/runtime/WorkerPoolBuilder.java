package io.klinesync.runtime;

import com.codahale.metrics.MetricRegistry;
import io.klinesync.core.Fallback;
import io.klinesync.core.Task;
import io.klinesync.metrics.Metrics;
import io.klinesync.retry.RetryPolicy;

import java.util.Objects;

public class WorkerPoolBuilder<I, R> {
    private Task<I, R> task;
    private Fallback<I, R> fallback;
    private RetryPolicy retryPolicy;
    private int workers = 4;
    private int maxPending = -1;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private String metricPrefix = "";
    private String threadPrefix = "worker";

    public WorkerPoolBuilder<I, R> task(Task<I, R> t) { this.task = t; return this; }
    public WorkerPoolBuilder<I, R> fallback(Fallback<I, R> f) { this.fallback = f; return this; }
    public WorkerPoolBuilder<I, R> retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public WorkerPoolBuilder<I, R> workers(int w) { this.workers = Math.max(1, w); return this; }
    public WorkerPoolBuilder<I, R> maxPending(int n) { this.maxPending = n; return this; }
    public WorkerPoolBuilder<I, R> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public WorkerPoolBuilder<I, R> metricPrefix(String p) { this.metricPrefix = p; return this; }
    public WorkerPoolBuilder<I, R> threadPrefix(String p) { this.threadPrefix = p; return this; }

    public WorkerPool<I, R> build() {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(fallback, "fallback");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        int pending = maxPending > 0 ? maxPending : workers * 2;
        return new WorkerPool<>(task, fallback, retryPolicy, workers, pending,
                new Metrics(metricRegistry, metricPrefix), threadPrefix);
    }
}
