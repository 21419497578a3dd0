package engine;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SqliteDurableStore implements DurableStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteDurableStore.class);

    public static final String DEFAULT_URL = "jdbc:sqlite:shorts-engine.db";

    private final Connection connection;
    private final Clock clock;

    public SqliteDurableStore() {
        this(DEFAULT_URL);
    }

    public SqliteDurableStore(String jdbcUrl) {
        this(jdbcUrl, Clock.systemUTC());
    }

    public SqliteDurableStore(String jdbcUrl, Clock clock) {
        this.clock = clock;
        try {
            // Force SQLite JDBC driver to load
            Class.forName("org.sqlite.JDBC");

            this.connection = DriverManager.getConnection(jdbcUrl);
            initializeSchema();
            log.info("Checkpoint store opened at {}", jdbcUrl);
        } catch (Exception e) {
            throw new CheckpointStoreException("Failed to initialize SQLite store", e);
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS runs (
                  run_id TEXT NOT NULL PRIMARY KEY,
                  owner_id TEXT,
                  created_at TEXT,
                  updated_at TEXT,
                  stage TEXT,
                  state_json TEXT,
                  suspension_stage TEXT,
                  suspension_payload TEXT,
                  suspended_at TEXT
                )
            """);
        }
    }

    @Override
    public synchronized Optional<RunRecord> load(String runId) {
        String sql = """
            SELECT owner_id, created_at, updated_at, stage, state_json
            FROM runs
            WHERE run_id = ?
        """;

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, runId);

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new RunRecord(
                        runId,
                        rs.getString("owner_id"),
                        parseInstant(rs.getString("created_at")),
                        parseInstant(rs.getString("updated_at")),
                        rs.getString("stage"),
                        rs.getString("state_json")));
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to load run " + runId, e);
        }
    }

    // Single statement, so a concurrent reader never observes a half-written run.
    // Suspension columns are left untouched on update.
    @Override
    public synchronized void save(RunRecord record) {
        String sql = """
            INSERT INTO runs (run_id, owner_id, created_at, updated_at, stage, state_json)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(run_id) DO UPDATE SET
              owner_id = excluded.owner_id,
              created_at = excluded.created_at,
              updated_at = excluded.updated_at,
              stage = excluded.stage,
              state_json = excluded.state_json
        """;

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, record.getRunId());
            ps.setString(2, record.getOwnerId());
            ps.setString(3, formatInstant(record.getCreatedAt()));
            ps.setString(4, formatInstant(record.getUpdatedAt()));
            ps.setString(5, record.getStage());
            ps.setString(6, record.getStateJson());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to save run " + record.getRunId(), e);
        }
    }

    @Override
    public synchronized void recordSuspension(String runId, String stage, String payloadJson) {
        String sql = """
            UPDATE runs
            SET suspension_stage = ?, suspension_payload = ?, suspended_at = ?
            WHERE run_id = ?
        """;

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, stage);
            ps.setString(2, payloadJson);
            ps.setString(3, formatInstant(clock.instant()));
            ps.setString(4, runId);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("Cannot suspend unknown run: " + runId);
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to record suspension for " + runId, e);
        }
    }

    @Override
    public synchronized void clearSuspension(String runId) {
        String sql = """
            UPDATE runs
            SET suspension_stage = NULL, suspension_payload = NULL, suspended_at = NULL
            WHERE run_id = ?
        """;

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to clear suspension for " + runId, e);
        }
    }

    @Override
    public synchronized Optional<SuspensionRecord> pendingSuspension(String runId) {
        String sql = """
            SELECT suspension_stage, suspension_payload, suspended_at
            FROM runs
            WHERE run_id = ? AND suspension_stage IS NOT NULL
        """;

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, runId);

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new SuspensionRecord(
                        runId,
                        rs.getString("suspension_stage"),
                        rs.getString("suspension_payload"),
                        parseInstant(rs.getString("suspended_at"))));
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to read suspension for " + runId, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to close SQLite store", e);
        }
    }

    private static String formatInstant(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant parseInstant(String text) {
        return text == null ? null : Instant.parse(text);
    }
}
