package de.bsommerfeld.mindshare.pipeline;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.mindshare.core.config.GlobalConfig;
import de.bsommerfeld.mindshare.core.domain.AuthorAggregate;
import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;
import de.bsommerfeld.mindshare.core.event.ApplicationEventBus;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.RunCompletedEvent;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.SnapshotPersistedEvent;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.SnapshotWriteFailedEvent;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.Target;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.WindowResolvedEvent;
import de.bsommerfeld.mindshare.db.DatabaseService;
import de.bsommerfeld.mindshare.db.StoreException;
import de.bsommerfeld.mindshare.pipeline.PipelineException.Stage;
import de.bsommerfeld.mindshare.pipeline.aggregate.EngagementAggregator;
import de.bsommerfeld.mindshare.pipeline.export.CsvSnapshotExporter;
import de.bsommerfeld.mindshare.pipeline.export.SnapshotNames;
import de.bsommerfeld.mindshare.pipeline.rank.LeaderboardRanker;
import de.bsommerfeld.mindshare.pipeline.window.AggregationWindow;
import de.bsommerfeld.mindshare.pipeline.window.WindowResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Runs one leaderboard aggregation end to end.
 *
 * <pre>
 *   connect ─► resolve window ─► load + group ─► score + rank
 *                                                     │
 *        close ◄── summary ◄── write CSV ◄── write table
 * </pre>
 *
 * <h3>Connection</h3>
 * The store connection belongs to the run: opened first, closed in a
 * {@code finally} block on every path after a successful connect.
 *
 * <h3>Writes</h3>
 * The snapshot table and the CSV file are written as two separate steps, each
 * reported through {@link ApplicationEventBus}. There is no transaction
 * spanning both. If the CSV fails after the table was written, the table stays
 * and the failure is logged with its name before the run aborts.
 *
 * <h3>Failures</h3>
 * Checked and unchecked failures of a stage surface as a
 * {@link PipelineException} carrying that stage. Nothing is retried.
 */
@Singleton
public class AggregationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationPipeline.class);

    private final DatabaseService store;
    private final WindowResolver windowResolver;
    private final EngagementAggregator aggregator;
    private final LeaderboardRanker ranker;
    private final CsvSnapshotExporter csvExporter;
    private final GlobalConfig config;
    private final Clock clock;
    private final ApplicationEventBus eventBus;

    @Inject
    public AggregationPipeline(DatabaseService store, WindowResolver windowResolver,
            EngagementAggregator aggregator, LeaderboardRanker ranker, CsvSnapshotExporter csvExporter,
            GlobalConfig config, Clock clock, ApplicationEventBus eventBus) {
        this.store = store;
        this.windowResolver = windowResolver;
        this.aggregator = aggregator;
        this.ranker = ranker;
        this.csvExporter = csvExporter;
        this.config = config;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public RunReport run() throws PipelineException {
        LOG.info("Starting Mindshare Aggregation Pipeline...");

        try {
            store.connect();
        } catch (StoreException e) {
            store.close();
            throw new PipelineException(Stage.CONNECTION, "Failed to connect to the store", e);
        }

        try {
            AggregationWindow window = windowResolver.resolve();
            LOG.info("Running weekly aggregation ({} days of data)", window.days());
            LOG.info("From: {}", window.start());
            LOG.info("To: {}", window.end());
            eventBus.post(new WindowResolvedEvent(window.start(), window.end()));

            Instant generatedAt = clock.instant();
            LeaderboardSnapshot snapshot = aggregateAndRank(window, generatedAt);
            if (config.isDebugMode() && !snapshot.isEmpty()) {
                LOG.info("Sample record: {}", snapshot.entries().get(0));
            }
            String name = SnapshotNames.forTimestamp(config.getExport().getTablePrefix(),
                    LocalDateTime.ofInstant(generatedAt, clock.getZone()));

            writeStore(name, snapshot);
            Path csvFile = writeCsv(name, snapshot);

            LeaderboardSummary.log(snapshot, config.getRanking().getSummarySize());
            LOG.info("Aggregation completed successfully!");
            LOG.info("Results saved to table: {}", name);
            LOG.info("Results saved to CSV file: {}", csvFile);

            eventBus.post(new RunCompletedEvent(name, csvFile, snapshot.size()));
            return new RunReport(name, csvFile, snapshot);
        } finally {
            store.close();
        }
    }

    private LeaderboardSnapshot aggregateAndRank(AggregationWindow window, Instant generatedAt)
            throws PipelineException {
        try {
            List<AuthorAggregate> aggregates = aggregator.collect(store, window);
            return ranker.rank(aggregates, window, generatedAt);
        } catch (StoreException | RuntimeException e) {
            throw new PipelineException(Stage.AGGREGATION, "Aggregation failed: " + e.getMessage(), e);
        }
    }

    private void writeStore(String name, LeaderboardSnapshot snapshot) throws PipelineException {
        try {
            int written = store.replaceSnapshot(name, snapshot);
            eventBus.post(new SnapshotPersistedEvent(Target.STORE, name, written));
        } catch (StoreException | RuntimeException e) {
            eventBus.post(new SnapshotWriteFailedEvent(Target.STORE, name, e));
            throw new PipelineException(Stage.STORE_WRITE, "Failed to write snapshot table " + name, e);
        }
    }

    private Path writeCsv(String name, LeaderboardSnapshot snapshot) throws PipelineException {
        try {
            Path file = csvExporter.export(name, snapshot);
            eventBus.post(new SnapshotPersistedEvent(Target.CSV, name, snapshot.size()));
            return file;
        } catch (IOException | RuntimeException e) {
            eventBus.post(new SnapshotWriteFailedEvent(Target.CSV, name, e));
            LOG.error("CSV export failed after snapshot table {} was written; the table has no CSV counterpart",
                    name);
            throw new PipelineException(Stage.EXPORT_WRITE, "Failed to write CSV for " + name, e);
        }
    }
}
