package io.klinesync.budget;

import java.util.concurrent.TimeUnit;

/**
 * Naive token buckets for request rate and byte throughput. A limit of zero disables that bucket.
 */
public class SimpleBudgetManager implements Budget {
    private final long ioBytesPerSec;
    private final long externalQps;

    private long ioTokens;
    private long lastIoRefillNanos;
    private long qpsTokens;
    private long lastQpsRefillNanos;

    public SimpleBudgetManager(long ioBytesPerSec, long externalQps) {
        this.ioBytesPerSec = Math.max(0, ioBytesPerSec);
        this.externalQps = Math.max(0, externalQps);
        long now = System.nanoTime();
        this.lastIoRefillNanos = now;
        this.lastQpsRefillNanos = now;
        this.ioTokens = this.ioBytesPerSec; // initial burst of 1s
        this.qpsTokens = this.externalQps; // initial burst of 1s
    }

    @Override
    public synchronized void consumeIoBytes(long bytes) throws InterruptedException {
        if (ioBytesPerSec <= 0) return; // no limit
        long need = bytes;
        while (need > 0) {
            refillIo();
            if (ioTokens <= 0) {
                Thread.sleep(1);
                continue;
            }
            long take = Math.min(ioTokens, need);
            ioTokens -= take;
            need -= take;
        }
    }

    @Override
    public synchronized void acquireExternalOp() throws InterruptedException {
        if (externalQps <= 0) return; // no limit
        while (true) {
            refillQps();
            if (qpsTokens > 0) {
                qpsTokens--;
                return;
            }
            Thread.sleep(1);
        }
    }

    private void refillIo() {
        long now = System.nanoTime();
        long elapsed = now - lastIoRefillNanos;
        if (elapsed <= 0) return;
        long add = (ioBytesPerSec * elapsed) / TimeUnit.SECONDS.toNanos(1);
        if (add > 0) {
            ioTokens = Math.min(ioBytesPerSec, ioTokens + add);
            lastIoRefillNanos = now;
        }
    }

    private void refillQps() {
        long now = System.nanoTime();
        long elapsed = now - lastQpsRefillNanos;
        if (elapsed <= 0) return;
        long add = (externalQps * elapsed) / TimeUnit.SECONDS.toNanos(1);
        if (add > 0) {
            qpsTokens = Math.min(externalQps, qpsTokens + add);
            lastQpsRefillNanos = now;
        }
    }
}
