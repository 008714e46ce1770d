package io.klinesync.archive;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Produces the archive files a run should consider, interval by interval, oldest period first.
 *
 * <p>The returned sequence is lazy and can be iterated any number of times with identical results.
 * Monthly sequences stop before the current month, which the archive only publishes once complete.
 */
public class TargetEnumerator {
    public static final LocalDate DEFAULT_START = LocalDate.of(2017, 1, 1);
    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9]+");

    private final Clock clock;

    public TargetEnumerator(Clock clock) {
        this.clock = clock;
    }

    public Iterable<ResourceIdentifier> enumerate(SyncConfig config) {
        return enumerate(config.symbol(), config.granularity(), config.intervals(), config.startDate(), config.endDate());
    }

    /**
     * @throws InvalidConfigurationException for a malformed symbol, an interval outside the granularity's
     *                                       catalog, no intervals, or a start after the end
     */
    public Iterable<ResourceIdentifier> enumerate(String symbol, Granularity granularity, List<KlineInterval> intervals,
                                                  LocalDate startDate, LocalDate endDate) {
        Plan plan = plan(symbol, granularity, intervals, startDate, endDate);
        return () -> new PlanIterator(plan);
    }

    /** Length of the sequence {@link #enumerate} returns for the same arguments. */
    public long count(String symbol, Granularity granularity, List<KlineInterval> intervals,
                      LocalDate startDate, LocalDate endDate) {
        Plan plan = plan(symbol, granularity, intervals, startDate, endDate);
        if (plan.first.isAfter(plan.last)) return 0;
        ChronoUnit unit = granularity == Granularity.MONTHLY ? ChronoUnit.MONTHS : ChronoUnit.DAYS;
        return (unit.between(plan.first, plan.last) + 1) * plan.intervals.size();
    }

    public long count(SyncConfig config) {
        return count(config.symbol(), config.granularity(), config.intervals(), config.startDate(), config.endDate());
    }

    /** Upper-cases and checks a ticker symbol. */
    public static String normalizeSymbol(String symbol) {
        String s = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL.matcher(s).matches()) {
            throw new InvalidConfigurationException("Invalid symbol '" + symbol + "': expected letters and digits, e.g. BTCUSDT");
        }
        return s;
    }

    private Plan plan(String symbol, Granularity granularity, List<KlineInterval> intervals,
                      LocalDate startDate, LocalDate endDate) {
        String sym = normalizeSymbol(symbol);
        if (granularity == null) throw new InvalidConfigurationException("Type is required (daily or monthly)");
        if (intervals == null || intervals.isEmpty()) throw new InvalidConfigurationException("At least one interval is required");
        for (KlineInterval interval : intervals) {
            if (!granularity.supports(interval)) {
                throw new InvalidConfigurationException("Interval " + interval + " is not published for " + granularity
                        + " archives; supported: " + granularity.catalog());
            }
        }
        if (startDate == null || endDate == null) throw new InvalidConfigurationException("Start and end dates are required");
        if (startDate.isAfter(endDate)) {
            throw new InvalidConfigurationException("Start date " + startDate + " is after end date " + endDate);
        }

        LocalDate first = granularity.periodStart(startDate);
        LocalDate last = granularity.periodStart(endDate);
        if (granularity == Granularity.MONTHLY) {
            LocalDate lastComplete = LocalDate.now(clock).withDayOfMonth(1).minusMonths(1);
            if (last.isAfter(lastComplete)) last = lastComplete;
        }
        return new Plan(sym, granularity, List.copyOf(intervals), first, last);
    }

    private record Plan(String symbol, Granularity granularity, List<KlineInterval> intervals,
                        LocalDate first, LocalDate last) {}

    private static final class PlanIterator implements Iterator<ResourceIdentifier> {
        private final Plan plan;
        private int intervalIdx = 0;
        private LocalDate next;

        PlanIterator(Plan plan) {
            this.plan = plan;
            this.next = plan.first.isAfter(plan.last) ? null : plan.first;
        }

        @Override
        public boolean hasNext() {
            return next != null && intervalIdx < plan.intervals.size();
        }

        @Override
        public ResourceIdentifier next() {
            if (!hasNext()) throw new NoSuchElementException();
            ResourceIdentifier id = new ResourceIdentifier(plan.symbol, plan.granularity, plan.intervals.get(intervalIdx), next);
            LocalDate following = plan.granularity.nextPeriod(next);
            if (following.isAfter(plan.last)) {
                intervalIdx++;
                next = plan.first;
            } else {
                next = following;
            }
            return id;
        }
    }
}
