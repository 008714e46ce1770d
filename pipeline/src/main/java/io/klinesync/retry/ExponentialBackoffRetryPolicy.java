package io.klinesync.retry;

import java.util.function.Predicate;

public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final Predicate<Exception> retryable;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, e -> true);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, Predicate<Exception> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.retryable = retryable == null ? e -> true : retryable;
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        if (attempt >= maxAttempts) return false;
        return e == null || retryable.test(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return Math.min(delay, maxMillis);
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryPolicy{maxAttempts=" + maxAttempts + ", baseMillis=" + baseMillis + ", maxMillis=" + maxMillis + '}';
    }
}
