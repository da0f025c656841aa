package de.bsommerfeld.mindshare.core.domain;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The complete output of one run: entries ranked by composite score
 * (descending, ties in grouping order) together with the window they were
 * aggregated over.
 *
 * <p>
 * Entries are unmodifiable and every {@code authorId} appears at most once.
 *
 * @param entries     ranked entries, index 0 is rank 1
 * @param windowStart inclusive window start
 * @param windowEnd   inclusive window end
 * @param generatedAt the run's wall-clock instant
 * @param stats       pool totals and averages
 */
public record LeaderboardSnapshot(
        List<AggregatedAuthorScore> entries,
        Instant windowStart,
        Instant windowEnd,
        Instant generatedAt,
        LeaderboardStats stats) {

    public LeaderboardSnapshot {
        Objects.requireNonNull(windowStart, "windowStart");
        Objects.requireNonNull(windowEnd, "windowEnd");
        Objects.requireNonNull(generatedAt, "generatedAt");
        Objects.requireNonNull(stats, "stats");
        entries = List.copyOf(entries);

        Set<String> seen = new HashSet<>();
        for (AggregatedAuthorScore entry : entries) {
            if (!seen.add(entry.authorId())) {
                throw new IllegalArgumentException("Duplicate authorId in snapshot: " + entry.authorId());
            }
        }
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
