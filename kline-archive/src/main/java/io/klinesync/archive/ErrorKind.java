package io.klinesync.archive;

public enum ErrorKind {
    /** Bad symbol, type, interval or date range. Fatal to the run, raised before any transfer. */
    INVALID_CONFIGURATION,
    /** Network error, timeout, server busy or an unclassified status. Retried. */
    TRANSIENT,
    /** The archive definitively has no such file. Not retried. */
    NOT_FOUND,
    /** Local disk failure for one file. Not retried. */
    LOCAL_IO
}
