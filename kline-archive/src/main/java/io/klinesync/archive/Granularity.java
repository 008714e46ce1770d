package io.klinesync.archive;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static io.klinesync.archive.KlineInterval.*;

/**
 * Archive granularity. Each daily file covers one calendar day; each monthly file covers one completed
 * calendar month. The interval catalog is what the archive publishes for that granularity.
 */
public enum Granularity {

    DAILY("daily", EnumSet.of(S1, M1, M3, M5, M15, M30, H1, H2, H4, H6, H8, H12),
            DateTimeFormatter.ofPattern("yyyy-MM-dd")),
    MONTHLY("monthly", EnumSet.of(M1, M3, M5, M15, M30, H1, H2, H4, H6, H8, H12, D1, D3, W1, MO1),
            DateTimeFormatter.ofPattern("yyyy-MM"));

    private final String pathSegment;
    private final Set<KlineInterval> catalog;
    private final DateTimeFormatter keyFormat;

    Granularity(String pathSegment, Set<KlineInterval> catalog, DateTimeFormatter keyFormat) {
        this.pathSegment = pathSegment;
        this.catalog = Collections.unmodifiableSet(catalog);
        this.keyFormat = keyFormat;
    }

    public String pathSegment() {
        return pathSegment;
    }

    /** Supported intervals in declaration order. */
    public List<KlineInterval> catalog() {
        return List.copyOf(catalog);
    }

    public boolean supports(KlineInterval interval) {
        return catalog.contains(interval);
    }

    /** First day of the period containing {@code date}. */
    public LocalDate periodStart(LocalDate date) {
        return this == MONTHLY ? date.withDayOfMonth(1) : date;
    }

    /** Start of the period after the one starting at {@code periodStart}. */
    public LocalDate nextPeriod(LocalDate periodStart) {
        return this == MONTHLY ? periodStart.plusMonths(1) : periodStart.plusDays(1);
    }

    /** Calendar key of the period starting at {@code periodStart}: {@code 2024-01-31} or {@code 2024-01}. */
    public String calendarKey(LocalDate periodStart) {
        return keyFormat.format(periodStart);
    }

    public static Granularity fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (Granularity g : values()) {
                if (g.pathSegment.equals(key)) {
                    return g;
                }
            }
        }
        throw new InvalidConfigurationException("Unknown type '" + name + "', expected daily or monthly");
    }

    @Override
    public String toString() {
        return pathSegment;
    }
}
