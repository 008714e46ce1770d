package io.klinesync.archive;

import io.klinesync.retry.ExponentialBackoffRetryPolicy;
import io.klinesync.retry.RetryPolicy;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Everything one run needs: what to fetch, where to put it and how hard to try.
 */
public record SyncConfig(
        Granularity granularity,
        String symbol,
        boolean incremental,
        List<KlineInterval> intervals,
        LocalDate startDate,
        LocalDate endDate,
        Path storageRoot,
        URI baseUri,
        int concurrency,
        int maxAttempts,
        long backoffMillis,
        long maxBackoffMillis,
        Duration requestTimeout,
        boolean extract,
        long maxRequestsPerSecond,
        long maxBytesPerSecond,
        int maxLocalIoFailures,
        Path logDir
) {
    public static final String DEFAULT_SYMBOL = "BTCUSDT";
    public static final int DEFAULT_CONCURRENCY = 5;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public SyncConfig {
        intervals = List.copyOf(intervals);
    }

    /** Retries transient failures only, with exponential backoff. */
    public RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(maxAttempts, backoffMillis, maxBackoffMillis, ArchiveFetchException::retryable);
    }

    public ArchiveLayout layout() {
        return new ArchiveLayout(baseUri, storageRoot, extract);
    }

    /** {@code incr} or {@code full}, as used in log file names. */
    public String modeLabel() {
        return incremental ? "incr" : "full";
    }

    public static Builder builder(Granularity granularity) {
        return new Builder(granularity);
    }

    public static final class Builder {
        private final Granularity granularity;
        private String symbol = DEFAULT_SYMBOL;
        private boolean incremental = false;
        private List<KlineInterval> intervals;
        private LocalDate startDate = TargetEnumerator.DEFAULT_START;
        private LocalDate endDate;
        private Path storageRoot = Path.of("binance_data");
        private URI baseUri = URI.create(ArchiveLayout.DEFAULT_BASE_URL);
        private int concurrency = DEFAULT_CONCURRENCY;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long backoffMillis = 1_000;
        private long maxBackoffMillis = 10_000;
        private Duration requestTimeout = Duration.ofSeconds(60);
        private boolean extract = true;
        private long maxRequestsPerSecond = 0;
        private long maxBytesPerSecond = 0;
        private int maxLocalIoFailures = 10;
        private Path logDir = Path.of("logs");

        private Builder(Granularity granularity) {
            this.granularity = granularity;
        }

        public Builder symbol(String s) { this.symbol = s; return this; }
        public Builder incremental(boolean b) { this.incremental = b; return this; }
        public Builder intervals(List<KlineInterval> list) { this.intervals = list; return this; }
        public Builder startDate(LocalDate d) { this.startDate = d; return this; }
        public Builder endDate(LocalDate d) { this.endDate = d; return this; }
        public Builder storageRoot(Path p) { this.storageRoot = p; return this; }
        public Builder baseUri(URI u) { this.baseUri = u; return this; }
        public Builder concurrency(int n) { this.concurrency = n; return this; }
        public Builder maxAttempts(int n) { this.maxAttempts = n; return this; }
        public Builder backoffMillis(long ms) { this.backoffMillis = ms; return this; }
        public Builder maxBackoffMillis(long ms) { this.maxBackoffMillis = ms; return this; }
        public Builder requestTimeout(Duration d) { this.requestTimeout = d; return this; }
        public Builder extract(boolean b) { this.extract = b; return this; }
        public Builder maxRequestsPerSecond(long n) { this.maxRequestsPerSecond = n; return this; }
        public Builder maxBytesPerSecond(long n) { this.maxBytesPerSecond = n; return this; }
        public Builder maxLocalIoFailures(int n) { this.maxLocalIoFailures = n; return this; }
        public Builder logDir(Path p) { this.logDir = p; return this; }

        /**
         * @throws InvalidConfigurationException when a setting cannot work
         */
        public SyncConfig build() {
            if (granularity == null) throw new InvalidConfigurationException("Type is required (daily or monthly)");
            String sym = TargetEnumerator.normalizeSymbol(symbol);
            List<KlineInterval> ivs = intervals == null || intervals.isEmpty() ? granularity.catalog() : List.copyOf(intervals);
            for (KlineInterval interval : ivs) {
                if (!granularity.supports(interval)) {
                    throw new InvalidConfigurationException("Interval " + interval + " is not published for " + granularity
                            + " archives; supported: " + granularity.catalog());
                }
            }
            LocalDate end = endDate != null ? endDate : LocalDate.now(ZoneOffset.UTC);
            if (startDate == null) throw new InvalidConfigurationException("Start date is required");
            if (startDate.isAfter(end)) {
                throw new InvalidConfigurationException("Start date " + startDate + " is after end date " + end);
            }
            if (concurrency < 1) throw new InvalidConfigurationException("Concurrency must be at least 1, got " + concurrency);
            if (maxAttempts < 1) throw new InvalidConfigurationException("Max attempts must be at least 1, got " + maxAttempts);
            if (backoffMillis < 0 || maxBackoffMillis < 0) throw new InvalidConfigurationException("Backoff must not be negative");
            if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new InvalidConfigurationException("Request timeout must be positive");
            }
            if (maxLocalIoFailures < 1) {
                throw new InvalidConfigurationException("Max local IO failures must be at least 1, got " + maxLocalIoFailures);
            }
            if (storageRoot == null || baseUri == null || logDir == null) {
                throw new InvalidConfigurationException("Storage root, base URL and log directory are required");
            }
            String scheme = baseUri.getScheme();
            if (scheme == null || !(scheme.equals("http") || scheme.equals("https"))) {
                throw new InvalidConfigurationException("Base URL must be http or https: " + baseUri);
            }
            return new SyncConfig(granularity, sym, incremental, ivs, startDate, end, storageRoot, baseUri,
                    concurrency, maxAttempts, backoffMillis, maxBackoffMillis, requestTimeout, extract,
                    Math.max(0, maxRequestsPerSecond), Math.max(0, maxBytesPerSecond), maxLocalIoFailures, logDir);
        }
    }
}
