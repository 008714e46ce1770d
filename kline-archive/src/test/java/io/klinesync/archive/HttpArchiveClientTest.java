package io.klinesync.archive;

import io.klinesync.budget.Budget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

public class HttpArchiveClientTest {
    private Path tmp;
    private FakeArchiveHost host;
    private ArchiveLayout layout;
    private HttpArchiveClient client;
    private final ResourceIdentifier id = ResourceIdentifier.daily("BTCUSDT", KlineInterval.H1, LocalDate.of(2024, 1, 1));

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("klinesync-http");
        host = new FakeArchiveHost();
        layout = new ArchiveLayout(host.baseUri(), tmp, true);
        client = new HttpArchiveClient(Duration.ofSeconds(5), Budget.unlimited());
    }

    @AfterEach
    void cleanup() throws IOException {
        host.close();
        TestDirs.deleteRecursively(tmp);
    }

    @Test
    void classifies_statuses() {
        assertNull(HttpArchiveClient.classify(200));
        assertNull(HttpArchiveClient.classify(206));
        assertEquals(ErrorKind.NOT_FOUND, HttpArchiveClient.classify(404));
        assertEquals(ErrorKind.NOT_FOUND, HttpArchiveClient.classify(410));
        assertEquals(ErrorKind.TRANSIENT, HttpArchiveClient.classify(403));
        assertEquals(ErrorKind.TRANSIENT, HttpArchiveClient.classify(429));
        assertEquals(ErrorKind.TRANSIENT, HttpArchiveClient.classify(500));
        assertEquals(ErrorKind.TRANSIENT, HttpArchiveClient.classify(503));
    }

    @Test
    void streams_body_to_target() throws Exception {
        byte[] zip = FakeArchiveHost.zipWithCsv(id.fileStem() + ".csv", FakeArchiveHost.csvFor(id));
        host.serveRaw(layout, id, zip);
        Path target = tmp.resolve("out.zip.part");
        long n = client.download(layout.remoteUri(id), target);
        assertEquals(zip.length, n);
        assertArrayEquals(zip, Files.readAllBytes(target));
    }

    @Test
    void missing_file_is_not_found() {
        ArchiveFetchException e = assertThrows(ArchiveFetchException.class,
                () -> client.download(layout.remoteUri(id), tmp.resolve("x.part")));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        assertFalse(e.isRetryable());
    }

    @Test
    void server_error_is_transient() {
        host.serve(layout, id, "a,b\n").failNext(layout, id, 503, 1);
        ArchiveFetchException e = assertThrows(ArchiveFetchException.class,
                () -> client.download(layout.remoteUri(id), tmp.resolve("x.part")));
        assertEquals(ErrorKind.TRANSIENT, e.kind());
        assertTrue(e.isRetryable());
    }

    @Test
    void unwritable_target_is_local_io() throws IOException {
        host.serve(layout, id, "a,b\n");
        Path blocker = tmp.resolve("dir-not-file");
        Files.createDirectories(blocker);
        ArchiveFetchException e = assertThrows(ArchiveFetchException.class,
                () -> client.download(layout.remoteUri(id), blocker));
        assertEquals(ErrorKind.LOCAL_IO, e.kind());
    }

    @Test
    void stalled_body_times_out_as_transient() {
        host.stallAfterTenBytes(layout, id, 1000);
        HttpArchiveClient impatient = new HttpArchiveClient(Duration.ofSeconds(1), Budget.unlimited());
        long t0 = System.nanoTime();

        ArchiveFetchException e = assertThrows(ArchiveFetchException.class,
                () -> impatient.download(layout.remoteUri(id), tmp.resolve("stalled.part")));

        long elapsedMillis = Duration.ofNanos(System.nanoTime() - t0).toMillis();
        assertEquals(ErrorKind.TRANSIENT, e.kind());
        assertTrue(e.getMessage().contains("after 10 bytes"), e.getMessage());
        assertTrue(elapsedMillis < 10_000, "gave up after " + elapsedMillis + " ms");
    }
}
