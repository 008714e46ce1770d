package io.klinesync.archive;

import java.net.URI;
import java.nio.file.Path;

/**
 * Transfers one remote archive file to a local path.
 */
public interface ArchiveClient {
    /**
     * Streams {@code source} into {@code target}, replacing whatever is there.
     *
     * @return bytes written
     * @throws ArchiveFetchException classified as {@link ErrorKind#NOT_FOUND}, {@link ErrorKind#TRANSIENT}
     *                               or {@link ErrorKind#LOCAL_IO}
     */
    long download(URI source, Path target) throws ArchiveFetchException, InterruptedException;
}
