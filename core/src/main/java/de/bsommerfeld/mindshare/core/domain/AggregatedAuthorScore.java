package de.bsommerfeld.mindshare.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A leaderboard entry: the author's aggregate plus the scores derived from it.
 *
 * @param aggregate           the grouped per-author values
 * @param multiplierFactor    {@code 1 + 7d / 100}
 * @param compositeScore      {@code contentScore * multiplierFactor}
 * @param mindShare           share of the top-100 composite total, 0 if that
 *                            total is 0
 * @param normalizedMindShare share of the top-25 composite total, 0 if that
 *                            total is 0
 */
public record AggregatedAuthorScore(
        AuthorAggregate aggregate,
        double multiplierFactor,
        double compositeScore,
        double mindShare,
        double normalizedMindShare) {

    public AggregatedAuthorScore {
        Objects.requireNonNull(aggregate, "aggregate");
    }

    public String authorId() {
        return aggregate.authorId();
    }

    public String username() {
        return aggregate.username();
    }

    public double contentScore() {
        return aggregate.contentScore();
    }

    public double counter(EngagementWindow window) {
        return aggregate.counters().get(window);
    }

    public List<String> tweetRefs() {
        return aggregate.tweetRefs();
    }

    public Instant createdAt() {
        return aggregate.createdAt();
    }
}
