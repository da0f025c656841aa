package de.bsommerfeld.mindshare.pipeline.aggregate;

import de.bsommerfeld.mindshare.core.domain.AuthorAggregate;
import de.bsommerfeld.mindshare.core.domain.EngagementCounters;
import de.bsommerfeld.mindshare.core.domain.EngagementWindow;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-field combination rules for folding one author's records into an
 * {@link AuthorAggregate}.
 *
 * <h3>Standard rules</h3>
 * <ul>
 * <li>{@code contentScore} and every counter except {@code 7d}: sum</li>
 * <li>{@code 7d}: value of the last record in retrieval order</li>
 * <li>{@code tweetRefs}: concatenation in retrieval order</li>
 * <li>{@code username}, {@code createdAt}: first record</li>
 * </ul>
 *
 * The {@code 7d} rule does not match the other windows. It reproduces the
 * published leaderboard's behavior and may be an upstream defect; new fields
 * should not copy it.
 */
public final class AggregationRules {

    private final FieldReducer<Double> contentScore;
    private final Map<EngagementWindow, FieldReducer<Double>> counters;
    private final FieldReducer<List<String>> tweetRefs;
    private final FieldReducer<String> username;
    private final FieldReducer<Instant> createdAt;

    public AggregationRules(FieldReducer<Double> contentScore,
            Map<EngagementWindow, FieldReducer<Double>> counters,
            FieldReducer<List<String>> tweetRefs,
            FieldReducer<String> username,
            FieldReducer<Instant> createdAt) {
        this.contentScore = Objects.requireNonNull(contentScore, "contentScore");
        this.tweetRefs = Objects.requireNonNull(tweetRefs, "tweetRefs");
        this.username = Objects.requireNonNull(username, "username");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.counters = new EnumMap<>(EngagementWindow.class);
        for (EngagementWindow window : EngagementWindow.values()) {
            FieldReducer<Double> rule = counters.get(window);
            if (rule == null) {
                throw new IllegalArgumentException("No reducer for counter window " + window.label());
            }
            this.counters.put(window, rule);
        }
    }

    public static AggregationRules standard() {
        Map<EngagementWindow, FieldReducer<Double>> counters = new EnumMap<>(EngagementWindow.class);
        for (EngagementWindow window : EngagementWindow.values()) {
            counters.put(window, Reducers.sum());
        }
        counters.put(EngagementWindow.LAST_7D, Reducers.takeLast());
        return new AggregationRules(Reducers.sum(), counters, Reducers.concat(),
                Reducers.takeFirst(), Reducers.takeFirst());
    }

    FieldReducer<Double> counterRule(EngagementWindow window) {
        return counters.get(window);
    }

    /**
     * Merges two partial aggregates of the same author. {@code earlier} must
     * cover records retrieved before those in {@code later}.
     */
    public AuthorAggregate merge(AuthorAggregate earlier, AuthorAggregate later) {
        if (!earlier.authorId().equals(later.authorId())) {
            throw new IllegalArgumentException(
                    "Cannot merge aggregates of " + earlier.authorId() + " and " + later.authorId());
        }

        Map<EngagementWindow, Double> merged = new EnumMap<>(EngagementWindow.class);
        for (EngagementWindow window : EngagementWindow.values()) {
            merged.put(window, counters.get(window).combine(
                    earlier.counters().get(window), later.counters().get(window)));
        }

        return new AuthorAggregate(
                earlier.authorId(),
                username.combine(earlier.username(), later.username()),
                contentScore.combine(earlier.contentScore(), later.contentScore()),
                EngagementCounters.of(merged),
                tweetRefs.combine(earlier.tweetRefs(), later.tweetRefs()),
                createdAt.combine(earlier.createdAt(), later.createdAt()));
    }
}
