package io.klinesync.archive;

import com.codahale.metrics.MetricRegistry;
import io.klinesync.core.Fallback;
import io.klinesync.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Fetches one archive file into the local store.
 *
 * <p>The body is streamed into a part file next to the destination, optionally unpacked into a second
 * part file, and moved onto the destination in a single rename. Part files are removed whatever happens,
 * so the destination either holds a complete artifact or is left as it was.
 */
public class ArchiveFetcher implements Task<ResourceIdentifier, FetchOutcome>, Fallback<ResourceIdentifier, FetchOutcome> {
    private static final Logger log = LoggerFactory.getLogger(ArchiveFetcher.class);

    private final ArchiveClient client;
    private final ArchiveLayout layout;
    private final ArchiveExtractor extractor;
    private final MetricRegistry registry; // optional

    public ArchiveFetcher(ArchiveClient client, ArchiveLayout layout) {
        this(client, layout, null);
    }

    public ArchiveFetcher(ArchiveClient client, ArchiveLayout layout, MetricRegistry registry) {
        this.client = client;
        this.layout = layout;
        this.extractor = new ArchiveExtractor();
        this.registry = registry;
    }

    @Override
    public FetchOutcome run(ResourceIdentifier id, int attempt) throws ArchiveFetchException, InterruptedException {
        Path destination = layout.localPath(id);
        Path downloadPart = layout.downloadPartPath(id);
        Path extractPart = layout.extractPartPath(id);
        try {
            Files.createDirectories(destination.getParent());
        } catch (IOException e) {
            throw ArchiveFetchException.localIo("cannot create " + destination.getParent() + ": " + e, e);
        }

        try {
            long bytes = client.download(layout.remoteUri(id), downloadPart);
            if (registry != null) registry.meter("archive.download.bytes").mark(bytes);
            Path ready = downloadPart;
            if (layout.extract()) {
                bytes = extractor.extractCsv(downloadPart, extractPart);
                ready = extractPart;
            }
            moveIntoPlace(ready, destination);
            if (registry != null) registry.counter("archive.files.stored").inc();
            log.debug("Stored {} ({} bytes, attempt {})", destination, bytes, attempt);
            return FetchOutcome.succeeded(id, bytes, attempt);
        } finally {
            deletePart(downloadPart);
            deletePart(extractPart);
        }
    }

    @Override
    public FetchOutcome onExhausted(ResourceIdentifier id, Exception error, int attempts) {
        // an interrupted write surfaces as a local I/O error; it is still a cancellation
        if (error instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
            return FetchOutcome.failed(id, ErrorKind.TRANSIENT, attempts, attempts == 0 ? "cancelled before start" : "interrupted");
        }
        if (error instanceof ArchiveFetchException afe) {
            return FetchOutcome.failed(id, afe.kind(), attempts, afe.getMessage());
        }
        log.warn("Unexpected failure fetching {}", id, error);
        return FetchOutcome.failed(id, ErrorKind.TRANSIENT, attempts, error.toString());
    }

    private static void moveIntoPlace(Path ready, Path destination) throws ArchiveFetchException {
        try {
            Files.move(ready, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            throw ArchiveFetchException.localIo("filesystem cannot rename atomically into " + destination, e);
        } catch (IOException e) {
            throw ArchiveFetchException.localIo("cannot move " + ready + " to " + destination + ": " + e, e);
        }
    }

    private static void deletePart(Path part) {
        try {
            Files.deleteIfExists(part);
        } catch (IOException e) {
            log.warn("Could not remove part file {}: {}", part, e.toString());
        }
    }
}
