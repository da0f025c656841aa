package de.bsommerfeld.mindshare.pipeline.aggregate;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.mindshare.core.domain.AuthorAggregate;
import de.bsommerfeld.mindshare.core.domain.RawEngagementRecord;
import de.bsommerfeld.mindshare.db.DatabaseService;
import de.bsommerfeld.mindshare.db.StoreException;
import de.bsommerfeld.mindshare.pipeline.window.AggregationWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups in-window records by author, folding each group with
 * {@link AggregationRules}.
 *
 * <p>
 * Output order is the order in which authors are first seen in the retrieval
 * order. The ranker's stable sort relies on it for ties.
 */
@Singleton
public class EngagementAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(EngagementAggregator.class);

    private final AggregationRules rules;

    @Inject
    public EngagementAggregator() {
        this(AggregationRules.standard());
    }

    public EngagementAggregator(AggregationRules rules) {
        this.rules = rules;
    }

    /**
     * Loads every record in {@code window} from {@code store} and groups it.
     * An empty window yields an empty list.
     */
    public List<AuthorAggregate> collect(DatabaseService store, AggregationWindow window) throws StoreException {
        List<RawEngagementRecord> records = store.findRecordsBetween(window.start(), window.end());
        LOG.info("Loaded {} raw records from the current week", records.size());

        List<AuthorAggregate> aggregates = aggregate(records);
        LOG.info("Found {} authors in window", aggregates.size());
        if (!aggregates.isEmpty()) {
            LOG.debug("First aggregated entry: {}", aggregates.get(0));
        }
        return aggregates;
    }

    /**
     * Folds {@code records}, which must be in retrieval order, into one
     * aggregate per author.
     */
    public List<AuthorAggregate> aggregate(List<RawEngagementRecord> records) {
        Map<String, AuthorAggregate> byAuthor = new LinkedHashMap<>();
        for (RawEngagementRecord record : records) {
            byAuthor.merge(record.authorId(), AuthorAggregate.of(record), rules::merge);
        }
        return new ArrayList<>(byAuthor.values());
    }
}
