package io.klinesync.core;

/**
 * One unit of work executed by a worker pool. Implementations may be invoked several times for the
 * same input when a retry policy allows it; attempt starts at 1.
 */
@FunctionalInterface
public interface Task<I, R> {
    R run(I input, int attempt) throws Exception;
}
