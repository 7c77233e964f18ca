package com.agentide.core.persistence;

import com.agentide.core.model.SessionSnapshot;
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
 * {@link CheckpointStore} backed by a PostgreSQL table with one row per session.
 * <p>
 * Snapshots are stored as JSON text. Writes are single-row upserts, so concurrent
 * sessions only ever contend on their own row.
 * <p>
 * The table {@code agentide_checkpoints} is created by {@link #createTables()}.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    static final String TABLE_NAME = "agentide_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                session_id  VARCHAR(255) PRIMARY KEY,
                snapshot    TEXT NOT NULL,
                updated_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (session_id, snapshot)
            VALUES (?, ?)
            ON CONFLICT (session_id)
            DO UPDATE SET snapshot = EXCLUDED.snapshot,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT snapshot FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private static final String EXISTS_SQL = """
            SELECT 1 FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_IDS_SQL = """
            SELECT session_id FROM %s ORDER BY updated_at DESC
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcCheckpointStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void save(String sessionId, SessionSnapshot snapshot) {
        String json = CheckpointSerializer.toJson(snapshot);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, sessionId);
            stmt.setString(2, json);
            stmt.executeUpdate();
            log.debug("Saved checkpoint for session '{}' ({} chars)", sessionId, json.length());
        } catch (SQLException e) {
            throw new CheckpointException("Failed to save checkpoint for session " + sessionId, e);
        }
    }

    @Override
    public Optional<SessionSnapshot> load(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(CheckpointSerializer.fromJson(rs.getString("snapshot")));
                }
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to load checkpoint for session " + sessionId, e);
        }
        return Optional.empty();
    }

    @Override
    public boolean exists(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(EXISTS_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to query checkpoint for session " + sessionId, e);
        }
    }

    @Override
    public List<String> listSessionIds() {
        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_IDS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("session_id"));
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to list checkpointed sessions", e);
        }
        return ids;
    }

    @Override
    public boolean delete(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, sessionId);
            int deleted = stmt.executeUpdate();
            log.debug("Deleted {} checkpoint row(s) for session '{}'", deleted, sessionId);
            return deleted > 0;
        } catch (SQLException e) {
            throw new CheckpointException("Failed to delete checkpoint for session " + sessionId, e);
        }
    }

    @Override
    public boolean isDurable() {
        return true;
    }
}
