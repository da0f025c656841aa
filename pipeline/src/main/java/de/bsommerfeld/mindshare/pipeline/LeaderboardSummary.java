package de.bsommerfeld.mindshare.pipeline;

import de.bsommerfeld.mindshare.core.domain.AggregatedAuthorScore;
import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;
import de.bsommerfeld.mindshare.core.domain.LeaderboardStats;
import de.bsommerfeld.mindshare.pipeline.export.NumberFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable run summary: the top entries followed by the run statistics.
 */
public final class LeaderboardSummary {

    private static final Logger LOG = LoggerFactory.getLogger(LeaderboardSummary.class);

    private LeaderboardSummary() {
    }

    /**
     * One line per entry for the first {@code limit} ranks, e.g.
     * {@code "1. yapper - Score: 300.00 - MindShare: 50.00%"}.
     */
    public static List<String> topLines(LeaderboardSnapshot snapshot, int limit) {
        List<AggregatedAuthorScore> entries = snapshot.entries();
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < Math.min(limit, entries.size()); i++) {
            AggregatedAuthorScore entry = entries.get(i);
            lines.add((i + 1) + ". " + entry.username()
                    + " - Score: " + NumberFormats.padded(entry.compositeScore(), 2)
                    + " - MindShare: " + NumberFormats.padded(entry.mindShare() * 100, 2) + "%");
        }
        return lines;
    }

    public static List<String> statisticLines(LeaderboardStats stats) {
        return List.of(
                "Total entries: " + stats.entryCount(),
                "Total Top 100 Score: " + NumberFormats.padded(stats.top100Total(), 2),
                "Total Top 25 Score: " + NumberFormats.padded(stats.top25Total(), 2),
                "Average MindShare: " + NumberFormats.padded(stats.averageMindShare() * 100, 4) + "%",
                "Average Normalized MindShare: "
                        + NumberFormats.padded(stats.averageNormalizedMindShare() * 100, 4) + "%");
    }

    public static void log(LeaderboardSnapshot snapshot, int limit) {
        if (limit > 0) {
            LOG.info("Top {} Results:", limit);
            topLines(snapshot, limit).forEach(LOG::info);
        }
        LOG.info("Statistics:");
        statisticLines(snapshot.stats()).forEach(LOG::info);
    }
}
