package de.bsommerfeld.mindshare.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.mindshare.core.config.DatabaseConfig;
import de.bsommerfeld.mindshare.core.domain.AggregatedAuthorScore;
import de.bsommerfeld.mindshare.core.domain.EngagementCounters;
import de.bsommerfeld.mindshare.core.domain.EngagementWindow;
import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;
import de.bsommerfeld.mindshare.core.domain.RawEngagementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SQLite-backed {@link DatabaseService} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The source schema is applied from {@code schema.sql} on every connect; every
 * DDL statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * Unlike a long-running service this job holds exactly one {@link Connection}
 * for the whole run: opened in {@link #connect()}, closed in {@link #close()}.
 * The orchestrator is single-threaded, so the connection is never shared
 * across threads.
 *
 * <h3>Transaction boundaries</h3>
 * Seeding and snapshot replacement run in explicit transactions with
 * rollback-on-failure, so a snapshot table is never left half-written.
 * The window query uses auto-commit.
 *
 * <h3>Snapshot tables</h3>
 * Each run writes to its own table whose name is only known at runtime. The
 * name is spliced into DDL, so it is checked against a plain-identifier
 * pattern before any statement is built.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final String dbUrl;
    private final ObjectMapper mapper = new ObjectMapper();
    private Connection connection;

    @Inject
    public SqlDatabaseService(DatabaseConfig config) {
        this(config.getUrl());
    }

    public SqlDatabaseService(String dbUrl) {
        this.dbUrl = dbUrl;
    }

    Connection openConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    @Override
    public void connect() throws StoreException {
        if (connection != null)
            return;

        LOG.info("Connecting to database at {}", dbUrl);
        try {
            connection = openConnection();
            applySchema(connection);
        } catch (SQLException e) {
            close();
            throw new StoreException("Failed to connect to " + dbUrl, e);
        }
        LOG.info("Connected to database.");
    }

    @Override
    public boolean isConnected() {
        return connection != null;
    }

    /**
     * Applies the full DDL from {@code schema.sql}. Splits on semicolons and
     * executes each statement individually.
     */
    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                throw new SQLException("schema.sql not found in classpath");
            }

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.debug("Database schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } catch (Exception e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        } finally {
            conn.setAutoCommit(true);
        }
    }

    @Override
    public void close() {
        if (connection == null)
            return;
        try {
            connection.close();
            LOG.info("Database connection closed.");
        } catch (SQLException e) {
            LOG.warn("Failed to close database connection cleanly", e);
        } finally {
            connection = null;
        }
    }

    // =====================================================================
    // Source Records
    // =====================================================================

    @Override
    public List<RawEngagementRecord> findRecordsBetween(Instant start, Instant end) throws StoreException {
        Connection conn = requireConnection();
        List<RawEngagementRecord> results = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-records-in-window"))) {
            ps.setLong(1, start.toEpochMilli());
            ps.setLong(2, end.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRecord(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query records between " + start + " and " + end, e);
        }
        LOG.debug("[DB] Loaded {} records in window.", results.size());
        return results;
    }

    @Override
    public void insertRecords(List<RawEngagementRecord> records) throws StoreException {
        if (records == null || records.isEmpty())
            return;

        Connection conn = requireConnection();
        try {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-record"))) {
                for (RawEngagementRecord r : records) {
                    bindRecord(ps, r);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to insert " + records.size() + " records", e);
        }
        LOG.info("[DB] Inserted {} records.", records.size());
    }

    /** Binds all 13 source columns to the insert prepared statement. */
    private void bindRecord(PreparedStatement ps, RawEngagementRecord r) throws SQLException {
        ps.setString(1, r.authorId());
        ps.setString(2, r.username());
        ps.setDouble(3, r.contentScore());
        int idx = 4;
        for (EngagementWindow window : EngagementWindow.values()) {
            ps.setDouble(idx++, r.counters().get(window));
        }
        ps.setString(idx++, toJson(r.tweetRefs()));
        ps.setLong(idx, r.createdAt().toEpochMilli());
    }

    // =====================================================================
    // Snapshot Tables
    // =====================================================================

    /**
     * Creates the snapshot table if needed, empties it and inserts every entry
     * in rank order, all in one transaction.
     */
    @Override
    public int replaceSnapshot(String name, LeaderboardSnapshot snapshot) throws StoreException {
        if (name == null || !TABLE_NAME.matcher(name).matches()) {
            throw new StoreException("Illegal snapshot table name: " + name);
        }

        Connection conn = requireConnection();
        Map<String, String> vars = Map.of("TABLE", name);
        try {
            conn.setAutoCommit(false);
            try {
                // SQLite compiles on prepare, so the table must exist first
                try (Statement ddl = conn.createStatement()) {
                    ddl.execute(SqlLoader.load("create-snapshot-table", vars));
                    int cleared = ddl.executeUpdate(SqlLoader.load("clear-snapshot-table", vars));
                    if (cleared > 0) {
                        LOG.info("[DB] Cleared {} stale rows from {}", cleared, name);
                    }
                }

                try (PreparedStatement insert = conn.prepareStatement(
                        SqlLoader.load("insert-snapshot-entry", vars))) {
                    for (AggregatedAuthorScore entry : snapshot.entries()) {
                        bindSnapshotEntry(insert, entry, snapshot);
                        insert.addBatch();
                    }
                    insert.executeBatch();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to write snapshot table " + name, e);
        }

        LOG.info("[DB] Saved {} entries to table {}", snapshot.size(), name);
        return snapshot.size();
    }

    /** Binds all 20 snapshot columns. Rank is the insertion order. */
    private void bindSnapshotEntry(PreparedStatement ps, AggregatedAuthorScore e, LeaderboardSnapshot snapshot)
            throws SQLException {
        ps.setString(1, e.authorId());
        ps.setString(2, e.username());
        ps.setDouble(3, e.contentScore());
        int idx = 4;
        for (EngagementWindow window : EngagementWindow.values()) {
            ps.setDouble(idx++, e.counter(window));
        }
        ps.setDouble(idx++, e.multiplierFactor());
        ps.setDouble(idx++, e.compositeScore());
        ps.setString(idx++, toJson(e.tweetRefs()));
        ps.setLong(idx++, e.createdAt().toEpochMilli());
        ps.setDouble(idx++, e.mindShare());
        ps.setDouble(idx++, e.normalizedMindShare());
        ps.setLong(idx++, snapshot.generatedAt().toEpochMilli());
        ps.setLong(idx++, snapshot.windowStart().toEpochMilli());
        ps.setLong(idx, snapshot.windowEnd().toEpochMilli());
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private RawEngagementRecord mapRecord(ResultSet rs) throws SQLException {
        Map<EngagementWindow, Double> counters = new EnumMap<>(EngagementWindow.class);
        for (EngagementWindow window : EngagementWindow.values()) {
            counters.put(window, rs.getDouble(window.column()));
        }
        return new RawEngagementRecord(
                rs.getString("author_id"), rs.getString("username"),
                rs.getDouble("total_content_score"), EngagementCounters.of(counters),
                fromJson(rs.getString("tweets"), rs.getLong("id")),
                Instant.ofEpochMilli(rs.getLong("created_at")));
    }

    private String toJson(List<String> tweetRefs) throws SQLException {
        try {
            return mapper.writeValueAsString(tweetRefs);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to encode tweet references", e);
        }
    }

    /** Tweets are stored as a JSON array; {@code NULL} or blank means none. */
    private List<String> fromJson(String json, long rowId) throws SQLException {
        if (json == null || json.isBlank())
            return List.of();
        try {
            return mapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLException("Malformed tweets column in row " + rowId, e);
        }
    }

    private Connection requireConnection() throws StoreException {
        if (connection == null) {
            throw new StoreException("Database is not connected; call connect() first");
        }
        return connection;
    }
}
