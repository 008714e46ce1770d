package io.klinesync.archive;

import java.util.Objects;

/**
 * Result of handling one identifier in one run.
 */
public record FetchOutcome(ResourceIdentifier id, Status status, long bytesWritten, ErrorKind errorKind,
                           int attempts, String detail) {

    public enum Status { SUCCEEDED, SKIPPED, FAILED }

    public static final String ALREADY_PRESENT = "already-present";

    public FetchOutcome {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
    }

    public static FetchOutcome succeeded(ResourceIdentifier id, long bytesWritten, int attempts) {
        return new FetchOutcome(id, Status.SUCCEEDED, bytesWritten, null, attempts, null);
    }

    public static FetchOutcome skipped(ResourceIdentifier id) {
        return new FetchOutcome(id, Status.SKIPPED, 0, null, 0, ALREADY_PRESENT);
    }

    public static FetchOutcome failed(ResourceIdentifier id, ErrorKind kind, int attempts, String detail) {
        return new FetchOutcome(id, Status.FAILED, 0, Objects.requireNonNull(kind, "kind"), attempts, detail);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    @Override
    public String toString() {
        return switch (status) {
            case SUCCEEDED -> id + " succeeded bytes=" + bytesWritten + " attempts=" + attempts;
            case SKIPPED -> id + " skipped (" + detail + ")";
            case FAILED -> id + " failed kind=" + errorKind + " attempts=" + attempts
                    + (detail == null ? "" : " detail=" + detail);
        };
    }
}
