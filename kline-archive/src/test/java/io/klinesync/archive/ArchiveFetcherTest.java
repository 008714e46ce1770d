package io.klinesync.archive;

import com.codahale.metrics.MetricRegistry;
import io.klinesync.budget.Budget;
import io.klinesync.retry.ExponentialBackoffRetryPolicy;
import io.klinesync.runtime.WorkerPool;
import io.klinesync.runtime.WorkerPoolBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ArchiveFetcherTest {
    private Path tmp;
    private FakeArchiveHost host;
    private ArchiveLayout layout;
    private MetricRegistry registry;
    private ArchiveFetcher fetcher;
    private WorkerPool<ResourceIdentifier, FetchOutcome> pool;
    private final ResourceIdentifier id = ResourceIdentifier.daily("BTCUSDT", KlineInterval.H1, LocalDate.of(2024, 1, 1));

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("klinesync-fetch");
        host = new FakeArchiveHost();
        layout = new ArchiveLayout(host.baseUri(), tmp, true);
        registry = new MetricRegistry();
        fetcher = new ArchiveFetcher(new HttpArchiveClient(Duration.ofSeconds(5), Budget.unlimited()), layout, registry);
    }

    @AfterEach
    void cleanup() throws IOException {
        if (pool != null) pool.close();
        host.close();
        TestDirs.deleteRecursively(tmp);
    }

    private WorkerPool<ResourceIdentifier, FetchOutcome> pool() {
        pool = new WorkerPoolBuilder<ResourceIdentifier, FetchOutcome>()
                .task(fetcher)
                .fallback(fetcher)
                .retry(new ExponentialBackoffRetryPolicy(3, 1, 10, ArchiveFetchException::retryable))
                .workers(2)
                .metrics(registry)
                .build();
        return pool;
    }

    private FetchOutcome fetchWithRetries() throws InterruptedException {
        assertTrue(pool().submit(id));
        FetchOutcome outcome = pool.poll(10, TimeUnit.SECONDS);
        assertNotNull(outcome, "no outcome published");
        return outcome;
    }

    @Test
    void extracts_csv_into_place() throws Exception {
        String csv = FakeArchiveHost.csvFor(id);
        host.serve(layout, id, csv);

        FetchOutcome outcome = fetcher.run(id, 1);

        assertEquals(FetchOutcome.Status.SUCCEEDED, outcome.status());
        assertEquals(1, outcome.attempts());
        assertEquals(csv.getBytes(StandardCharsets.UTF_8).length, outcome.bytesWritten());
        assertEquals(csv, Files.readString(layout.localPath(id)));
        assertEquals(0, TestDirs.partFiles(tmp));
        assertEquals(1, registry.counter("archive.files.stored").getCount());
    }

    @Test
    void keeps_raw_zip_when_extraction_is_off() throws Exception {
        ArchiveLayout raw = new ArchiveLayout(host.baseUri(), tmp, false);
        ArchiveFetcher zipFetcher = new ArchiveFetcher(new HttpArchiveClient(Duration.ofSeconds(5), Budget.unlimited()), raw);
        byte[] zip = FakeArchiveHost.zipWithCsv(id.fileStem() + ".csv", "x,y\n");
        host.serveRaw(raw, id, zip);

        FetchOutcome outcome = zipFetcher.run(id, 1);

        assertEquals(FetchOutcome.Status.SUCCEEDED, outcome.status());
        assertTrue(raw.localPath(id).toString().endsWith(".zip"));
        assertArrayEquals(zip, Files.readAllBytes(raw.localPath(id)));
        assertEquals(0, TestDirs.partFiles(tmp));
    }

    @Test
    void succeeds_on_third_attempt_after_two_transient_failures() throws Exception {
        host.serve(layout, id, FakeArchiveHost.csvFor(id)).failNext(layout, id, 503, 2);

        FetchOutcome outcome = fetchWithRetries();

        assertEquals(FetchOutcome.Status.SUCCEEDED, outcome.status());
        assertEquals(3, outcome.attempts());
        assertEquals(3, host.hits(layout, id));
        assertTrue(Files.size(layout.localPath(id)) > 0);
    }

    @Test
    void exhausted_retries_leave_no_file_behind() throws Exception {
        host.serve(layout, id, FakeArchiveHost.csvFor(id)).failNext(layout, id, 500, 3);

        FetchOutcome outcome = fetchWithRetries();

        assertEquals(FetchOutcome.Status.FAILED, outcome.status());
        assertEquals(ErrorKind.TRANSIENT, outcome.errorKind());
        assertEquals(3, outcome.attempts());
        assertFalse(Files.exists(layout.localPath(id)));
        assertEquals(0, TestDirs.partFiles(tmp));
    }

    @Test
    void stalled_transfer_fails_transient_and_leaves_no_part_file() throws Exception {
        host.stallAfterTenBytes(layout, id, 1000);
        fetcher = new ArchiveFetcher(new HttpArchiveClient(Duration.ofSeconds(1), Budget.unlimited()), layout, registry);

        FetchOutcome outcome = fetchWithRetries();

        assertEquals(FetchOutcome.Status.FAILED, outcome.status());
        assertEquals(ErrorKind.TRANSIENT, outcome.errorKind());
        assertEquals(3, outcome.attempts());
        assertEquals(3, host.hits(layout, id));
        assertFalse(Files.exists(layout.localPath(id)));
        assertEquals(0, TestDirs.partFiles(tmp));
    }

    @Test
    void not_found_is_attempted_once() throws Exception {
        FetchOutcome outcome = fetchWithRetries();

        assertEquals(FetchOutcome.Status.FAILED, outcome.status());
        assertEquals(ErrorKind.NOT_FOUND, outcome.errorKind());
        assertEquals(1, outcome.attempts());
        assertEquals(1, host.hits(layout, id));
    }

    @Test
    void corrupt_archive_is_transient_and_cleaned_up() throws IOException {
        host.serveRaw(layout, id, "definitely not a zip".getBytes(StandardCharsets.UTF_8));

        ArchiveFetchException e = assertThrows(ArchiveFetchException.class, () -> fetcher.run(id, 1));

        assertEquals(ErrorKind.TRANSIENT, e.kind());
        assertFalse(Files.exists(layout.localPath(id)));
        assertEquals(0, TestDirs.partFiles(tmp));
    }

    @Test
    void failed_refetch_keeps_previous_artifact() throws Exception {
        Files.createDirectories(layout.localPath(id).getParent());
        Files.writeString(layout.localPath(id), "old contents\n");
        host.failNext(layout, id, 502, 1);

        assertThrows(ArchiveFetchException.class, () -> fetcher.run(id, 1));

        assertEquals("old contents\n", Files.readString(layout.localPath(id)));
        assertEquals(0, TestDirs.partFiles(tmp));
    }

    @Test
    void fallback_maps_errors_to_kinds() {
        FetchOutcome interrupted = fetcher.onExhausted(id, new InterruptedException(), 2);
        assertEquals(ErrorKind.TRANSIENT, interrupted.errorKind());
        assertEquals("interrupted", interrupted.detail());
        assertEquals(2, interrupted.attempts());

        FetchOutcome local = fetcher.onExhausted(id, ArchiveFetchException.localIo("disk full", null), 1);
        assertEquals(ErrorKind.LOCAL_IO, local.errorKind());
        assertEquals("disk full", local.detail());

        assertEquals("cancelled before start", fetcher.onExhausted(id, new InterruptedException(), 0).detail());
    }

    @Test
    void write_failure_on_an_interrupted_worker_counts_as_cancellation() {
        Thread.currentThread().interrupt();
        try {
            FetchOutcome outcome = fetcher.onExhausted(id, ArchiveFetchException.localIo("closed by interrupt", null), 1);
            assertEquals(ErrorKind.TRANSIENT, outcome.errorKind());
            assertEquals("interrupted", outcome.detail());
        } finally {
            Thread.interrupted();
        }
    }
}
