package io.klinesync.archive;

import java.util.Objects;

/**
 * Failure to fetch one archive file, classified so the retry policy and the run summary can tell
 * transient trouble from a missing file or a local disk problem.
 */
public class ArchiveFetchException extends Exception {
    private final ErrorKind kind;

    public ArchiveFetchException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ArchiveFetchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind);
    }

    public static ArchiveFetchException transientFailure(String message, Throwable cause) {
        return new ArchiveFetchException(ErrorKind.TRANSIENT, message, cause);
    }

    public static ArchiveFetchException notFound(String message) {
        return new ArchiveFetchException(ErrorKind.NOT_FOUND, message);
    }

    public static ArchiveFetchException localIo(String message, Throwable cause) {
        return new ArchiveFetchException(ErrorKind.LOCAL_IO, message, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == ErrorKind.TRANSIENT;
    }

    /** Retry predicate for {@link io.klinesync.retry.RetryPolicy}: only transient archive failures. */
    public static boolean retryable(Exception e) {
        return e instanceof ArchiveFetchException afe && afe.isRetryable();
    }
}
