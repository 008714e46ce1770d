package io.klinesync.archive;

import io.klinesync.budget.Budget;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Archive client over the JDK HTTP client.
 *
 * <p>Status mapping: 2xx is success; 404 and 410 mean the file does not exist; every other status,
 * including 403, 408, 429 and 5xx, is treated as transient.
 *
 * <p>The request timeout bounds the wait for response headers and, separately, every wait for the next
 * piece of the body. A body that stops arriving for that long fails the transfer as transient.
 */
final class HttpArchiveClient implements ArchiveClient {
    private static final String USER_AGENT = "klinesync/0.1";

    private final HttpClient http;
    private final Duration timeout;
    private final Budget budget;

    HttpArchiveClient(Duration timeout, Budget budget) {
        this.timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
        this.budget = budget == null ? Budget.unlimited() : budget;
        this.http = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /** Returns the error kind for a status, or null for success. */
    static ErrorKind classify(int status) {
        if (status >= 200 && status < 300) return null;
        if (status == 404 || status == 410) return ErrorKind.NOT_FOUND;
        return ErrorKind.TRANSIENT;
    }

    @Override
    public long download(URI source, Path target) throws ArchiveFetchException, InterruptedException {
        budget.acquireExternalOp();
        HttpRequest req = HttpRequest.newBuilder(source)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        HttpResponse<Flow.Publisher<List<ByteBuffer>>> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofPublisher());
        } catch (HttpTimeoutException e) {
            throw ArchiveFetchException.transientFailure("timed out after " + timeout.toSeconds() + "s: " + source, e);
        } catch (IOException e) {
            throw ArchiveFetchException.transientFailure("request failed: " + source + ": " + e, e);
        }

        int status = resp.statusCode();
        BodyChunks body = new BodyChunks();
        resp.body().subscribe(body);
        try {
            ErrorKind kind = classify(status);
            if (kind == ErrorKind.NOT_FOUND) {
                throw ArchiveFetchException.notFound("HTTP " + status + " " + source);
            }
            if (kind != null) {
                throw ArchiveFetchException.transientFailure("HTTP " + status + " " + source, null);
            }
            long written = copy(body, target, source);
            OptionalLong expected = resp.headers().firstValueAsLong("Content-Length");
            if (expected.isPresent() && expected.getAsLong() != written) {
                throw ArchiveFetchException.transientFailure("truncated body for " + source + ": got " + written
                        + " of " + expected.getAsLong() + " bytes", null);
            }
            if (written == 0) {
                throw ArchiveFetchException.transientFailure("empty body for " + source, null);
            }
            return written;
        } finally {
            body.cancel();
        }
    }

    private long copy(BodyChunks body, Path target, URI source) throws ArchiveFetchException, InterruptedException {
        OutputStream out;
        try {
            out = Files.newOutputStream(target, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw ArchiveFetchException.localIo("cannot open " + target + ": " + e, e);
        }
        long written = 0;
        try (out) {
            while (true) {
                List<ByteBuffer> chunk;
                try {
                    chunk = body.next(timeout);
                } catch (HttpTimeoutException e) {
                    throw ArchiveFetchException.transientFailure("no data for " + timeout.toSeconds() + "s from "
                            + source + " after " + written + " bytes", e);
                } catch (IOException e) {
                    throw ArchiveFetchException.transientFailure("read failed for " + source + " after " + written
                            + " bytes: " + e, e);
                }
                if (chunk == null) break;
                for (ByteBuffer buf : chunk) {
                    int n = buf.remaining();
                    if (n == 0) continue;
                    budget.consumeIoBytes(n);
                    byte[] bytes = new byte[n];
                    buf.get(bytes);
                    out.write(bytes);
                    written += n;
                }
            }
        } catch (IOException e) {
            throw ArchiveFetchException.localIo("cannot write " + target + ": " + e, e);
        }
        return written;
    }

    /**
     * Pulls the response body one chunk at a time, so the reader can give up on a body that stalls.
     */
    static final class BodyChunks implements Flow.Subscriber<List<ByteBuffer>> {
        private static final Object END = new Object();

        private final BlockingQueue<Object> signals = new LinkedBlockingQueue<>();
        private volatile Flow.Subscription subscription;
        private volatile boolean cancelled;

        @Override
        public void onSubscribe(Flow.Subscription s) {
            subscription = s;
            if (cancelled) {
                s.cancel();
            } else {
                s.request(1);
            }
        }

        @Override
        public void onNext(List<ByteBuffer> item) {
            signals.add(item);
        }

        @Override
        public void onError(Throwable error) {
            signals.add(error);
        }

        @Override
        public void onComplete() {
            signals.add(END);
        }

        /**
         * Waits up to {@code idle} for the next chunk.
         *
         * @return the chunk, or null once the body is complete
         * @throws HttpTimeoutException when nothing arrived in time
         */
        @SuppressWarnings("unchecked")
        List<ByteBuffer> next(Duration idle) throws IOException, InterruptedException {
            Object signal = signals.poll(idle.toMillis(), TimeUnit.MILLISECONDS);
            if (signal == null) {
                cancel();
                throw new HttpTimeoutException("body idle for " + idle.toMillis() + " ms");
            }
            if (signal == END) return null;
            if (signal instanceof Throwable t) {
                throw t instanceof IOException io ? io : new IOException(t);
            }
            Flow.Subscription s = subscription;
            if (s != null) s.request(1);
            return (List<ByteBuffer>) signal;
        }

        void cancel() {
            cancelled = true;
            Flow.Subscription s = subscription;
            if (s != null) s.cancel();
        }
    }
}
