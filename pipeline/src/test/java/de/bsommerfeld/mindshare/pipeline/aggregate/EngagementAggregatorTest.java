package de.bsommerfeld.mindshare.pipeline.aggregate;

import de.bsommerfeld.mindshare.core.domain.AuthorAggregate;
import de.bsommerfeld.mindshare.core.domain.EngagementCounters;
import de.bsommerfeld.mindshare.core.domain.EngagementWindow;
import de.bsommerfeld.mindshare.core.domain.RawEngagementRecord;
import de.bsommerfeld.mindshare.db.DatabaseService;
import de.bsommerfeld.mindshare.db.StoreException;
import de.bsommerfeld.mindshare.pipeline.window.AggregationWindow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EngagementAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-06-03T00:00:00Z");

    @Mock
    private DatabaseService store;

    private final EngagementAggregator aggregator = new EngagementAggregator();

    @Test
    void aggregate_shouldReturnEmptyForNoRecords() {
        assertTrue(aggregator.aggregate(List.of()).isEmpty());
    }

    @Test
    void aggregate_shouldApplyFieldRules() {
        List<RawEngagementRecord> records = List.of(
                record("a", "first-name", 10, 0, List.of("t1"), counters(1, 2, 3, 40, 5, 6, 7, 8)),
                record("a", "second-name", 5, 1, List.of("t2", "t1"), counters(1, 1, 1, 70, 1, 1, 1, 1)));

        AuthorAggregate result = aggregator.aggregate(records).get(0);

        assertEquals("a", result.authorId());
        assertEquals("first-name", result.username());
        assertEquals(T0, result.createdAt());
        assertEquals(15, result.contentScore());
        assertEquals(counters(2, 3, 4, 70, 6, 7, 8, 9), result.counters());
        assertEquals(List.of("t1", "t2", "t1"), result.tweetRefs());
    }

    @Test
    void aggregate_shouldKeepFirstSeenAuthorOrder() {
        List<RawEngagementRecord> records = List.of(
                record("b", "b", 1, 0, List.of(), EngagementCounters.zero()),
                record("a", "a", 1, 1, List.of(), EngagementCounters.zero()),
                record("b", "b", 1, 2, List.of(), EngagementCounters.zero()),
                record("c", "c", 1, 3, List.of(), EngagementCounters.zero()));

        List<String> order = aggregator.aggregate(records).stream().map(AuthorAggregate::authorId).toList();

        assertEquals(List.of("b", "a", "c"), order);
    }

    @Test
    void merge_ofPartitionsShouldEqualAggregateOfAll() {
        List<RawEngagementRecord> records = List.of(
                record("a", "x", 3, 0, List.of("1"), counters(1, 2, 3, 10, 5, 6, 7, 8)),
                record("a", "y", 4, 1, List.of("2"), counters(2, 2, 2, 20, 2, 2, 2, 2)),
                record("a", "z", 5, 2, List.of(), counters(3, 0, 1, 30, 0, 4, 0, 9)),
                record("a", "w", 6, 3, List.of("3", "4"), counters(0, 5, 0, 25, 1, 0, 3, 0)));
        AggregationRules rules = AggregationRules.standard();
        AuthorAggregate whole = aggregator.aggregate(records).get(0);

        for (int split = 1; split < records.size(); split++) {
            AuthorAggregate head = aggregator.aggregate(records.subList(0, split)).get(0);
            AuthorAggregate tail = aggregator.aggregate(records.subList(split, records.size())).get(0);

            assertEquals(whole, rules.merge(head, tail), "split at " + split);
        }
        assertEquals(25, whole.counters().get(EngagementWindow.LAST_7D), "7d is taken from the last record");
    }

    @Test
    void merge_shouldRejectDifferentAuthors() {
        AuthorAggregate a = AuthorAggregate.of(record("a", "a", 1, 0, List.of(), EngagementCounters.zero()));
        AuthorAggregate b = AuthorAggregate.of(record("b", "b", 1, 0, List.of(), EngagementCounters.zero()));

        assertThrows(IllegalArgumentException.class, () -> AggregationRules.standard().merge(a, b));
    }

    @Test
    void standard_shouldOnlyTakeLastFor7d() {
        AggregationRules rules = AggregationRules.standard();
        for (EngagementWindow window : EngagementWindow.values()) {
            double expected = window == EngagementWindow.LAST_7D ? 2 : 3;
            assertEquals(expected, rules.counterRule(window).combine(1.0, 2.0).doubleValue(), window.label());
        }
    }

    @Test
    void collect_shouldQueryWindowBounds() throws StoreException {
        AggregationWindow window = new AggregationWindow(T0, T0.plusSeconds(3600));
        when(store.findRecordsBetween(T0, T0.plusSeconds(3600)))
                .thenReturn(List.of(record("a", "a", 1, 0, List.of(), EngagementCounters.zero())));

        List<AuthorAggregate> result = aggregator.collect(store, window);

        assertEquals(1, result.size());
        verify(store).findRecordsBetween(T0, T0.plusSeconds(3600));
    }

    private static EngagementCounters counters(double... values) {
        return EngagementCounters.of(values);
    }

    private static RawEngagementRecord record(String authorId, String username, double score, int minute,
            List<String> tweets, EngagementCounters counters) {
        return new RawEngagementRecord(authorId, username, score, counters, tweets, T0.plusSeconds(60L * minute));
    }
}
