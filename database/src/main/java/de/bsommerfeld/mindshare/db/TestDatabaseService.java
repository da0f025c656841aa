package de.bsommerfeld.mindshare.db;

import com.google.inject.Singleton;
import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;
import de.bsommerfeld.mindshare.core.domain.RawEngagementRecord;
import de.bsommerfeld.mindshare.core.util.TestDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link DatabaseService} for TEST mode: no disk I/O, no SQLite,
 * no schema. Bound by Guice when the job starts with {@code app.mode=TEST}.
 *
 * <h3>Startup behavior</h3>
 * The no-arg constructor pre-seeds the store with 40 authors and five
 * reporting periods each, spread over the last seven days, so a TEST run
 * produces a populated leaderboard without any source database.
 *
 * <h3>Snapshots</h3>
 * Snapshot "tables" are kept in a map keyed by name. Replacing a snapshot
 * swaps the whole entry list, which mirrors the create/clear/insert cycle of
 * {@link SqlDatabaseService}.
 */
@Singleton
public class TestDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(TestDatabaseService.class);

    private final List<RawEngagementRecord> records = new ArrayList<>();
    private final Map<String, LeaderboardSnapshot> snapshots = new ConcurrentHashMap<>();
    private boolean connected;

    public TestDatabaseService() {
        this(TestDataGenerator.generateWeek(Instant.now(), 40, 5));
    }

    public TestDatabaseService(List<RawEngagementRecord> seed) {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");
        records.addAll(seed);
    }

    @Override
    public void connect() {
        connected = true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized List<RawEngagementRecord> findRecordsBetween(Instant start, Instant end)
            throws StoreException {
        requireConnection();
        List<RawEngagementRecord> result = new ArrayList<>();
        for (RawEngagementRecord r : records) {
            if (!r.createdAt().isBefore(start) && !r.createdAt().isAfter(end)) {
                result.add(r);
            }
        }
        // List.sort is stable, so ties keep insertion order like ORDER BY created_at, id
        result.sort(Comparator.comparing(RawEngagementRecord::createdAt));
        return result;
    }

    @Override
    public synchronized void insertRecords(List<RawEngagementRecord> batch) throws StoreException {
        requireConnection();
        records.addAll(batch);
    }

    @Override
    public int replaceSnapshot(String name, LeaderboardSnapshot snapshot) throws StoreException {
        requireConnection();
        snapshots.put(name, snapshot);
        LOG.info("[DB] Saved {} entries to in-memory table {}", snapshot.size(), name);
        return snapshot.size();
    }

    /**
     * Returns the snapshot last written under {@code name}, or {@code null}.
     */
    public LeaderboardSnapshot getSnapshot(String name) {
        return snapshots.get(name);
    }

    @Override
    public void close() {
        connected = false;
    }

    private void requireConnection() throws StoreException {
        if (!connected) {
            throw new StoreException("Database is not connected; call connect() first");
        }
    }
}
