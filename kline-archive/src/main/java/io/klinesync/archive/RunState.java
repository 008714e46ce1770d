package io.klinesync.archive;

/**
 * Phases of one coordinator run, entered in declaration order. FILTERING is entered only for incremental
 * runs.
 */
public enum RunState {
    IDLE,
    ENUMERATING,
    FILTERING,
    DISPATCHING,
    COLLECTING,
    FINALIZED
}
