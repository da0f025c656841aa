package de.bsommerfeld.mindshare.pipeline.rank;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.mindshare.core.config.RankingConfig;
import de.bsommerfeld.mindshare.core.domain.AggregatedAuthorScore;
import de.bsommerfeld.mindshare.core.domain.AuthorAggregate;
import de.bsommerfeld.mindshare.core.domain.EngagementWindow;
import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;
import de.bsommerfeld.mindshare.core.domain.LeaderboardStats;
import de.bsommerfeld.mindshare.pipeline.window.AggregationWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores, sorts and normalizes grouped aggregates into a
 * {@link LeaderboardSnapshot}.
 *
 * <h3>Scoring</h3>
 *
 * <pre>
 *   multiplierFactor = 1 + 7d / 100
 *   compositeScore   = contentScore × multiplierFactor
 * </pre>
 *
 * <h3>Mindshare</h3>
 * Entries are sorted by composite score, descending and stable. Two
 * denominators are taken from the head of that order: the composite total of
 * the first {@code mindSharePool} entries (100 by default) and of the first
 * {@code normalizedPool} entries (25 by default). Every entry, in the pools or
 * not, is divided by both totals. A zero total yields a share of 0.
 *
 * <p>
 * No rounding happens here; that is left to the exporters.
 */
@Singleton
public class LeaderboardRanker {

    private static final Comparator<AggregatedAuthorScore> BY_COMPOSITE_DESC = Comparator
            .comparingDouble(AggregatedAuthorScore::compositeScore).reversed();

    private final int mindSharePool;
    private final int normalizedPool;

    @Inject
    public LeaderboardRanker(RankingConfig config) {
        this(config.getMindSharePool(), config.getNormalizedPool());
    }

    public LeaderboardRanker(int mindSharePool, int normalizedPool) {
        if (mindSharePool <= 0 || normalizedPool <= 0) {
            throw new IllegalArgumentException(
                    "Pool sizes must be positive: " + mindSharePool + ", " + normalizedPool);
        }
        this.mindSharePool = mindSharePool;
        this.normalizedPool = normalizedPool;
    }

    public static double multiplierFactor(AuthorAggregate aggregate) {
        return 1 + aggregate.counters().get(EngagementWindow.LAST_7D) / 100;
    }

    public LeaderboardSnapshot rank(List<AuthorAggregate> aggregates, AggregationWindow window, Instant generatedAt) {
        List<AggregatedAuthorScore> scored = new ArrayList<>(aggregates.size());
        for (AuthorAggregate aggregate : aggregates) {
            double multiplier = multiplierFactor(aggregate);
            scored.add(new AggregatedAuthorScore(aggregate, multiplier, aggregate.contentScore() * multiplier, 0, 0));
        }

        // ArrayList.sort is a stable merge sort; ties keep grouping order
        scored.sort(BY_COMPOSITE_DESC);

        double top100Total = headTotal(scored, mindSharePool);
        double top25Total = headTotal(scored, normalizedPool);

        List<AggregatedAuthorScore> ranked = new ArrayList<>(scored.size());
        for (AggregatedAuthorScore entry : scored) {
            ranked.add(new AggregatedAuthorScore(entry.aggregate(), entry.multiplierFactor(), entry.compositeScore(),
                    share(entry.compositeScore(), top100Total), share(entry.compositeScore(), top25Total)));
        }

        // Mean share over the filled slice, not the nominal pool size
        LeaderboardStats stats = new LeaderboardStats(ranked.size(), top100Total, top25Total,
                top100Total > 0 ? 1.0 / Math.min(mindSharePool, ranked.size()) : 0,
                top25Total > 0 ? 1.0 / Math.min(normalizedPool, ranked.size()) : 0);

        return new LeaderboardSnapshot(ranked, window.start(), window.end(), generatedAt, stats);
    }

    private static double headTotal(List<AggregatedAuthorScore> sorted, int poolSize) {
        double total = 0;
        for (AggregatedAuthorScore entry : sorted.subList(0, Math.min(poolSize, sorted.size()))) {
            total += entry.compositeScore();
        }
        return total;
    }

    private static double share(double compositeScore, double total) {
        return total > 0 ? compositeScore / total : 0;
    }
}
