package de.bsommerfeld.mindshare.core.domain;

/**
 * Run statistics reported alongside a snapshot.
 *
 * @param entryCount                 number of ranked authors
 * @param top100Total                composite-score sum of the mindshare pool
 * @param top25Total                 composite-score sum of the normalized pool
 * @param averageMindShare           {@code 1 / poolSize}, 0 when the pool total
 *                                   is 0
 * @param averageNormalizedMindShare {@code 1 / normalizedPoolSize}, 0 when that
 *                                   pool total is 0
 */
public record LeaderboardStats(
        int entryCount,
        double top100Total,
        double top25Total,
        double averageMindShare,
        double averageNormalizedMindShare) {

    public static LeaderboardStats empty() {
        return new LeaderboardStats(0, 0, 0, 0, 0);
    }
}
