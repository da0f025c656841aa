package de.bsommerfeld.mindshare.core.util;

import de.bsommerfeld.mindshare.core.domain.EngagementCounters;
import de.bsommerfeld.mindshare.core.domain.EngagementWindow;
import de.bsommerfeld.mindshare.core.domain.RawEngagementRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates plausible engagement records for TEST mode and local runs.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li><strong>Authors</strong>: ids {@code author-0001...}, handles drawn from a
 * small pool with a numeric suffix so they stay unique</li>
 * <li><strong>Content score</strong>: 0 to 250 per period, roughly a quarter of
 * periods score 0</li>
 * <li><strong>Counters</strong>: monotone across windows (24h &le; 48h &le; 7d
 * &le; ... &le; all), so every period looks like a real cumulative report</li>
 * <li><strong>Tweets</strong>: 0-4 numeric references per period</li>
 * <li><strong>Timestamps</strong>: spread evenly over the seven days before
 * {@code now}; batches are returned oldest first</li>
 * </ul>
 */
public class TestDataGenerator {

    private static final Random RND = new Random();

    private static final String[] HANDLES = { "yapmaxi", "ctguy", "alphaleaks", "degenwhale", "threadboi",
            "onchainsleuth", "memelord", "gmgm" };

    private static final EngagementWindow[] CUMULATIVE_ORDER = {
            EngagementWindow.LAST_24H, EngagementWindow.LAST_48H, EngagementWindow.LAST_7D,
            EngagementWindow.LAST_30D, EngagementWindow.LAST_3M, EngagementWindow.LAST_6M,
            EngagementWindow.LAST_12M, EngagementWindow.ALL };

    private TestDataGenerator() {
    }

    /**
     * Generates a single record for the given author at {@code createdAt}.
     */
    public static RawEngagementRecord generateRecord(String authorId, String username, Instant createdAt) {
        double contentScore = RND.nextInt(4) == 0 ? 0 : round2(RND.nextDouble() * 250);
        return new RawEngagementRecord(authorId, username, contentScore, generateCounters(),
                generateTweetRefs(), createdAt);
    }

    /**
     * Generates {@code periodsPerAuthor} records for each of {@code authors}
     * authors, spread across the seven days before {@code now}.
     *
     * @return records sorted ascending by {@code createdAt}
     */
    public static List<RawEngagementRecord> generateWeek(Instant now, int authors, int periodsPerAuthor) {
        List<RawEngagementRecord> list = new ArrayList<>();
        long spanSeconds = Duration.ofDays(7).getSeconds();
        for (int a = 1; a <= authors; a++) {
            String authorId = String.format("author-%04d", a);
            String username = HANDLES[a % HANDLES.length] + a;
            for (int p = 0; p < periodsPerAuthor; p++) {
                long offset = (long) ((p / (double) Math.max(1, periodsPerAuthor)) * spanSeconds);
                list.add(generateRecord(authorId, username, now.minusSeconds(spanSeconds - offset)));
            }
        }
        list.sort(Comparator.comparing(RawEngagementRecord::createdAt));
        return list;
    }

    private static EngagementCounters generateCounters() {
        Map<EngagementWindow, Double> values = new EnumMap<>(EngagementWindow.class);
        double running = 0;
        for (EngagementWindow window : CUMULATIVE_ORDER) {
            running += round2(RND.nextDouble() * 20);
            values.put(window, running);
        }
        return EngagementCounters.of(values);
    }

    private static List<String> generateTweetRefs() {
        int count = RND.nextInt(5);
        List<String> refs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            refs.add(Long.toString(1_700_000_000_000_000_000L + (RND.nextLong() & 0xFFFFFFFFFFFFL)));
        }
        return refs;
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
