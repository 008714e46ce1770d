package io.klinesync.core;

/**
 * Converts a failure that will not be retried into a result value, so every submitted input still
 * produces exactly one result. Must not throw.
 */
@FunctionalInterface
public interface Fallback<I, R> {
    R onExhausted(I input, Exception error, int attempts);
}
