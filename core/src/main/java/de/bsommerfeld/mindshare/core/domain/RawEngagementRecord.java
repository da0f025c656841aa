package de.bsommerfeld.mindshare.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One author's engagement for a single ingestion period, as written by the
 * upstream ingestion process. Read-only from this job's point of view.
 *
 * @param authorId     stable author identity
 * @param username     display handle at the time of ingestion, may change
 *                     between periods
 * @param contentScore non-negative content score for the period
 * @param counters     windowed engagement counters
 * @param tweetRefs    opaque content identifiers produced in the period, in
 *                     ingestion order
 * @param createdAt    the period this record represents
 */
public record RawEngagementRecord(
        String authorId,
        String username,
        double contentScore,
        EngagementCounters counters,
        List<String> tweetRefs,
        Instant createdAt) {

    public RawEngagementRecord {
        Objects.requireNonNull(authorId, "authorId");
        Objects.requireNonNull(counters, "counters");
        Objects.requireNonNull(createdAt, "createdAt");
        if (Double.isNaN(contentScore) || Double.isInfinite(contentScore) || contentScore < 0) {
            throw new IllegalArgumentException("contentScore must be a non-negative number: " + contentScore);
        }
        tweetRefs = tweetRefs == null ? List.of() : List.copyOf(tweetRefs);
    }
}
