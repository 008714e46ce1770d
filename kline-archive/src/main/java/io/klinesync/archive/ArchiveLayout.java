package io.klinesync.archive;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Maps an identifier to its remote archive location and its local file. Both mappings depend on nothing
 * but the identifier and this layout's fixed settings, so a file downloaded by one run is found again by
 * the next.
 *
 * <p>Remote: {@code {base}/data/spot/{granularity}/klines/{SYMBOL}/{interval}/{stem}.zip}<br>
 * Local: {@code {root}/{granularity}/{interval}/{stem}.csv} ({@code .zip} when not extracting)
 */
public final class ArchiveLayout {
    public static final String DEFAULT_BASE_URL = "https://data.binance.vision";
    static final String PART_SUFFIX = ".part";

    private final String baseUrl;
    private final Path storageRoot;
    private final boolean extract;

    public ArchiveLayout(URI baseUri, Path storageRoot, boolean extract) {
        String base = Objects.requireNonNull(baseUri, "baseUri").toString();
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.storageRoot = Objects.requireNonNull(storageRoot, "storageRoot");
        this.extract = extract;
    }

    public Path storageRoot() { return storageRoot; }
    public boolean extract() { return extract; }

    public URI remoteUri(ResourceIdentifier id) {
        return URI.create(String.format("%s/data/spot/%s/klines/%s/%s/%s.zip",
                baseUrl, id.granularity().pathSegment(), id.symbol(), id.interval().label(), id.fileStem()));
    }

    /** Directory holding every file of one granularity and interval. */
    public Path intervalDirectory(Granularity granularity, KlineInterval interval) {
        return storageRoot.resolve(granularity.pathSegment()).resolve(interval.label());
    }

    /** Final location of the downloaded artifact. */
    public Path localPath(ResourceIdentifier id) {
        return intervalDirectory(id.granularity(), id.interval()).resolve(id.fileStem() + (extract ? ".csv" : ".zip"));
    }

    /** Where the transfer lands before it is complete. Never matches {@link #localPath}. */
    public Path downloadPartPath(ResourceIdentifier id) {
        return intervalDirectory(id.granularity(), id.interval()).resolve(id.fileStem() + ".zip" + PART_SUFFIX);
    }

    /** Where the extracted CSV is written before the atomic move. */
    public Path extractPartPath(ResourceIdentifier id) {
        return intervalDirectory(id.granularity(), id.interval()).resolve(id.fileStem() + ".csv" + PART_SUFFIX);
    }

    @Override
    public String toString() {
        return "ArchiveLayout{base=" + baseUrl + ", root=" + storageRoot + ", extract=" + extract + '}';
    }
}
