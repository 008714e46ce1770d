package io.klinesync.archive;

/**
 * Receives run events from the coordinator. All callbacks arrive on the coordinator's thread, in order.
 */
public interface RunReporter {
    default void onStateChange(RunState state) {}

    /** Called just before an identifier is handed to the fetch workers. */
    default void onDispatch(ResourceIdentifier id) {}

    /** Called once per outcome, after {@code summary} has counted it. */
    default void onOutcome(FetchOutcome outcome, RunSummary summary) {}

    default void onSummary(RunSummary summary) {}

    static RunReporter silent() {
        return new RunReporter() {};
    }
}
