package de.bsommerfeld.mindshare.core.domain;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable set of engagement counters, one non-negative value per
 * {@link EngagementWindow}. Backed by a plain array indexed by ordinal.
 */
public final class EngagementCounters {

    private static final EngagementWindow[] WINDOWS = EngagementWindow.values();
    private static final EngagementCounters ZERO = new EngagementCounters(new double[WINDOWS.length]);

    private final double[] values;

    private EngagementCounters(double[] values) {
        this.values = values;
    }

    public static EngagementCounters zero() {
        return ZERO;
    }

    /**
     * Builds counters from a per-window map. Windows absent from the map are
     * zero.
     *
     * @throws IllegalArgumentException if any value is negative, NaN or infinite
     */
    public static EngagementCounters of(Map<EngagementWindow, Double> byWindow) {
        double[] values = new double[WINDOWS.length];
        byWindow.forEach((window, value) -> values[window.ordinal()] = requireValid(window, value));
        return new EngagementCounters(values);
    }

    /**
     * Builds counters in {@link EngagementWindow} declaration order:
     * all, 24h, 48h, 7d, 30d, 3m, 6m, 12m.
     */
    public static EngagementCounters of(double... inOrder) {
        if (inOrder.length != WINDOWS.length) {
            throw new IllegalArgumentException(
                    "Expected " + WINDOWS.length + " counter values, got " + inOrder.length);
        }
        double[] values = new double[WINDOWS.length];
        for (EngagementWindow window : WINDOWS) {
            values[window.ordinal()] = requireValid(window, inOrder[window.ordinal()]);
        }
        return new EngagementCounters(values);
    }

    public double get(EngagementWindow window) {
        return values[window.ordinal()];
    }

    /**
     * Returns a copy with a single window replaced.
     */
    public EngagementCounters with(EngagementWindow window, double value) {
        double[] copy = values.clone();
        copy[window.ordinal()] = requireValid(window, value);
        return new EngagementCounters(copy);
    }

    public Map<EngagementWindow, Double> asMap() {
        Map<EngagementWindow, Double> map = new EnumMap<>(EngagementWindow.class);
        for (EngagementWindow window : WINDOWS) {
            map.put(window, values[window.ordinal()]);
        }
        return map;
    }

    private static double requireValid(EngagementWindow window, Double value) {
        if (value == null || value.isNaN() || value.isInfinite() || value < 0) {
            throw new IllegalArgumentException("Invalid counter value for " + window.label() + ": " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EngagementCounters))
            return false;
        return Arrays.equals(values, ((EngagementCounters) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EngagementCounters[");
        for (EngagementWindow window : WINDOWS) {
            if (window.ordinal() > 0)
                sb.append(", ");
            sb.append(window.label()).append('=').append(values[window.ordinal()]);
        }
        return sb.append(']').toString();
    }
}
