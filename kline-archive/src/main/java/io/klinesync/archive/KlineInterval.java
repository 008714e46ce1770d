package io.klinesync.archive;

import java.util.Arrays;

/**
 * Kline intervals published by the archive, identified by the label used in archive paths.
 */
public enum KlineInterval {

    S1("1s"),
    M1("1m"),
    M3("3m"),
    M5("5m"),
    M15("15m"),
    M30("30m"),
    H1("1h"),
    H2("2h"),
    H4("4h"),
    H6("6h"),
    H8("8h"),
    H12("12h"),
    D1("1d"),
    D3("3d"),
    W1("1w"),
    MO1("1mo");

    private final String label;

    KlineInterval(String label) {
        this.label = label;
    }

    /** Returns the path label, e.g. {@code 1h}. */
    public String label() {
        return label;
    }

    /**
     * Resolves a label such as {@code 15m} or {@code 1mo}.
     *
     * @throws InvalidConfigurationException for unknown labels
     */
    public static KlineInterval fromLabel(String label) {
        if (label != null) {
            String trimmed = label.trim();
            for (KlineInterval interval : values()) {
                if (interval.label.equals(trimmed)) {
                    return interval;
                }
            }
        }
        throw new InvalidConfigurationException("Unknown interval '" + label + "', expected one of "
                + Arrays.stream(values()).map(KlineInterval::label).toList());
    }

    @Override
    public String toString() {
        return label;
    }
}
