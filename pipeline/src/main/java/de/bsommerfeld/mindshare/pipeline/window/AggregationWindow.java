package de.bsommerfeld.mindshare.pipeline.window;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The inclusive time range {@code [start, end]} one run aggregates over.
 */
public record AggregationWindow(Instant start, Instant end) {

    public AggregationWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    /**
     * Length of the window in days, rounded up to whole days.
     */
    public long days() {
        long millis = Duration.between(start, end).toMillis();
        return (millis + Duration.ofDays(1).toMillis() - 1) / Duration.ofDays(1).toMillis();
    }
}
