package com.appforge.core.persistence;

import com.appforge.core.graph.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link CheckpointStore}.
 * <p>
 * Each transition is one immutable row keyed by {@code (generation_id, seq_no)}, holding
 * the JSON-encoded graph snapshot. Rows are only ever inserted, so the full transition
 * history of a generation stays available for inspection. Works against PostgreSQL in
 * production and H2 in tests.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    private static final String TABLE_NAME = "appforge_checkpoints";

    /** SQLState for unique constraint violations, shared by PostgreSQL and H2. */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                generation_id VARCHAR(255) NOT NULL,
                seq_no        BIGINT NOT NULL,
                snapshot      TEXT NOT NULL,
                created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (generation_id, seq_no)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (generation_id, seq_no, snapshot)
            VALUES (?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT snapshot
            FROM %s
            WHERE generation_id = ?
            ORDER BY seq_no DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_SEQUENCE_SQL = """
            SELECT snapshot
            FROM %s
            WHERE generation_id = ? AND seq_no = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_SEQUENCES_SQL = """
            SELECT seq_no FROM %s WHERE generation_id = ? ORDER BY seq_no ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_GENERATIONS_SQL = """
            SELECT DISTINCT generation_id FROM %s ORDER BY generation_id
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final SnapshotCodec codec;

    public JdbcCheckpointStore(DataSource dataSource, SnapshotCodec codec) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.codec = codec;
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void save(String generationId, GraphSnapshot snapshot, long sequence) {
        String json = codec.encode(snapshot);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, generationId);
            stmt.setLong(2, sequence);
            stmt.setString(3, json);
            stmt.executeUpdate();
            log.debug("Saved checkpoint {} for generation '{}'", sequence, generationId);
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                verifyDuplicate(generationId, sequence, json);
                return;
            }
            throw new CheckpointException(
                    "Failed to save checkpoint %d for generation '%s'".formatted(sequence, generationId), e);
        }
    }

    @Override
    public Optional<GraphSnapshot> load(String generationId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_SQL)) {
            stmt.setString(1, generationId);
            return readSnapshot(stmt);
        } catch (SQLException e) {
            throw new CheckpointException("Failed to load checkpoint for generation '" + generationId + "'", e);
        }
    }

    @Override
    public Optional<GraphSnapshot> load(String generationId, long sequence) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_SEQUENCE_SQL)) {
            stmt.setString(1, generationId);
            stmt.setLong(2, sequence);
            return readSnapshot(stmt);
        } catch (SQLException e) {
            throw new CheckpointException(
                    "Failed to load checkpoint %d for generation '%s'".formatted(sequence, generationId), e);
        }
    }

    @Override
    public List<Long> listSequences(String generationId) {
        List<Long> sequences = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SEQUENCES_SQL)) {
            stmt.setString(1, generationId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sequences.add(rs.getLong("seq_no"));
                }
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to list checkpoints for generation '" + generationId + "'", e);
        }
        return sequences;
    }

    @Override
    public List<String> listGenerationIds() {
        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_GENERATIONS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("generation_id"));
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to list generation ids", e);
        }
        return ids;
    }

    @Override
    public boolean isAvailable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.warn("Checkpoint store unavailable: {}", e.getMessage());
            return false;
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /**
     * A retried write whose first attempt landed stores the same payload again; any
     * other payload under an existing sequence means two writers share the generation.
     */
    private void verifyDuplicate(String generationId, long sequence, String json) {
        String stored = null;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_SEQUENCE_SQL)) {
            stmt.setString(1, generationId);
            stmt.setLong(2, sequence);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    stored = rs.getString("snapshot");
                }
            }
        } catch (SQLException e) {
            throw new CheckpointException(
                    "Failed to verify checkpoint %d for generation '%s'".formatted(sequence, generationId), e);
        }
        if (!json.equals(stored)) {
            throw new CheckpointConflictException(generationId, sequence);
        }
        log.debug("Checkpoint {} for generation '{}' already stored", sequence, generationId);
    }

    private Optional<GraphSnapshot> readSnapshot(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return Optional.of(codec.decode(rs.getString("snapshot")));
            }
        }
        return Optional.empty();
    }
}
