package de.bsommerfeld.mindshare.db;

import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;
import de.bsommerfeld.mindshare.core.domain.RawEngagementRecord;

import java.time.Instant;
import java.util.List;

/**
 * Persistence contract for the leaderboard job: reads raw engagement records
 * and writes ranked snapshots.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}: production persistence via SQLite</li>
 * <li>{@link TestDatabaseService}: in-memory store for TEST mode,
 * pre-seeded with generated records, no disk I/O</li>
 * </ul>
 *
 * <h3>Lifecycle</h3>
 * A service is connected once per run with {@link #connect()} and released
 * with {@link #close()}. The orchestrator owns both calls; every other method
 * requires an open connection. {@code close()} is idempotent and never throws,
 * so it can sit in a {@code finally} block.
 */
public interface DatabaseService extends AutoCloseable {

    /**
     * Opens the connection and makes sure the source schema exists.
     *
     * @throws StoreException if the store is unreachable or the schema cannot
     *                        be applied
     */
    void connect() throws StoreException;

    boolean isConnected();

    /**
     * Returns every record whose {@code createdAt} lies in
     * {@code [start, end]}, both ends inclusive, ordered by {@code createdAt}
     * and then by insertion order. This order is what "first" and "last"
     * contributing record mean during aggregation.
     */
    List<RawEngagementRecord> findRecordsBetween(Instant start, Instant end) throws StoreException;

    /**
     * Appends raw records to the source collection. The production feed is
     * written by the upstream ingestion process; this exists for seeding and
     * local runs.
     */
    void insertRecords(List<RawEngagementRecord> records) throws StoreException;

    /**
     * Writes the snapshot under {@code name}, first removing whatever an
     * earlier run stored under the same name. Entries are stored in rank order
     * together with the snapshot's window bounds and generation time.
     *
     * @return number of stored entries
     */
    int replaceSnapshot(String name, LeaderboardSnapshot snapshot) throws StoreException;

    @Override
    void close();
}
