package io.klinesync.budget;

/**
 * Budget governs how hard a run may lean on the remote host and the local disk.
 */
public interface Budget extends AutoCloseable {
    /** Block as needed to respect IO throughput budget for this many bytes. */
    void consumeIoBytes(long bytes) throws InterruptedException;

    /** Block as needed to respect external QPS budget (one op). */
    void acquireExternalOp() throws InterruptedException;

    /** A budget that never blocks. */
    static Budget unlimited() {
        return new SimpleBudgetManager(0, 0);
    }

    @Override
    default void close() {}
}
