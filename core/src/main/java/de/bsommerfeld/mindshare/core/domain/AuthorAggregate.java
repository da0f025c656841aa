package de.bsommerfeld.mindshare.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * All raw records of one author inside the aggregation window, folded into a
 * single row. Derived scores are not part of this type; see
 * {@link AggregatedAuthorScore}.
 *
 * @param authorId     grouping key
 * @param username     handle of the first contributing record
 * @param contentScore summed content score
 * @param counters     combined counters (summed, except the 7d window)
 * @param tweetRefs    concatenated tweet references in retrieval order
 * @param createdAt    timestamp of the first contributing record
 */
public record AuthorAggregate(
        String authorId,
        String username,
        double contentScore,
        EngagementCounters counters,
        List<String> tweetRefs,
        Instant createdAt) {

    public AuthorAggregate {
        Objects.requireNonNull(authorId, "authorId");
        Objects.requireNonNull(counters, "counters");
        tweetRefs = tweetRefs == null ? List.of() : List.copyOf(tweetRefs);
    }

    /**
     * Single-record aggregate, the seed of every per-author fold.
     */
    public static AuthorAggregate of(RawEngagementRecord record) {
        return new AuthorAggregate(record.authorId(), record.username(), record.contentScore(),
                record.counters(), record.tweetRefs(), record.createdAt());
    }
}
