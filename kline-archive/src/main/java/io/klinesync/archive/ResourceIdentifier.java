package io.klinesync.archive;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;

/**
 * One fetchable archive file: symbol, granularity, interval and the period it covers. Monthly periods are
 * normalised to the first day of the month, so two identifiers for the same month are equal.
 */
public record ResourceIdentifier(String symbol, Granularity granularity, KlineInterval interval, LocalDate period) {

    public ResourceIdentifier {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(granularity, "granularity");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(period, "period");
        period = granularity.periodStart(period);
    }

    public static ResourceIdentifier daily(String symbol, KlineInterval interval, LocalDate day) {
        return new ResourceIdentifier(symbol, Granularity.DAILY, interval, day);
    }

    public static ResourceIdentifier monthly(String symbol, KlineInterval interval, YearMonth month) {
        return new ResourceIdentifier(symbol, Granularity.MONTHLY, interval, month.atDay(1));
    }

    /** {@code 2024-01-31} for daily files, {@code 2024-01} for monthly files. */
    public String calendarKey() {
        return granularity.calendarKey(period);
    }

    /** Archive file name without extension, e.g. {@code BTCUSDT-1h-2024-01-31}. */
    public String fileStem() {
        return symbol + "-" + interval.label() + "-" + calendarKey();
    }

    @Override
    public String toString() {
        return granularity.pathSegment() + "/" + interval.label() + "/" + fileStem();
    }
}
