package io.klinesync.error;

/**
 * Receives items whose processing failed for good, with enough context to replay them by hand.
 */
public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, T item, String errorKind, int attempts, String detail);

    /** Sink that drops everything; for callers that keep no ledger. */
    static <T> DeadLetterSink<T> discarding() {
        return (stage, item, errorKind, attempts, detail) -> {};
    }

    @Override default void close() {}
}
