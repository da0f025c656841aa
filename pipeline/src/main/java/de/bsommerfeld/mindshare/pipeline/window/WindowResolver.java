package de.bsommerfeld.mindshare.pipeline.window;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Computes the aggregation window for "now".
 *
 * <p>
 * The window ends at the current instant and starts at local midnight of the
 * Monday of the running week. A run on a Monday would see an almost empty
 * window, so on Mondays the start moves back to the previous week's Monday
 * and the window covers the full prior week plus today.
 *
 * <p>
 * "Local" is the zone of the injected {@link Clock}.
 */
@Singleton
public class WindowResolver {

    private static final Logger LOG = LoggerFactory.getLogger(WindowResolver.class);

    private final Clock clock;

    @Inject
    public WindowResolver(Clock clock) {
        this.clock = clock;
    }

    public AggregationWindow resolve() {
        return resolve(ZonedDateTime.now(clock));
    }

    /**
     * Resolves the window ending at {@code now}, using the zone of {@code now}
     * for the midnight boundary.
     */
    public AggregationWindow resolve(ZonedDateTime now) {
        DayOfWeek today = now.getDayOfWeek();
        boolean monday = today == DayOfWeek.MONDAY;
        int daysBack = monday ? 7 : today.getValue() - DayOfWeek.MONDAY.getValue();

        ZonedDateTime start = now.toLocalDate().minusDays(daysBack).atStartOfDay(now.getZone());

        LOG.info("Today is {}, using {} as start date",
                today.getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                monday ? "previous Monday" : "current week Monday");
        return new AggregationWindow(start.toInstant(), now.toInstant());
    }
}
