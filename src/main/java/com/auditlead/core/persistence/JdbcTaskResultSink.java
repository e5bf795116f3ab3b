package com.auditlead.core.persistence;

import com.auditlead.core.model.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC-based {@link TaskResultSink} that persists one row per agent and run to a
 * PostgreSQL table.
 * <p>
 * Rows are keyed by {@code (run_id, agent_name)} and written with upserts, so repeated
 * writes are last-write-wins. Result payloads are stored as JSON text. The table
 * {@code agent_results} is created by {@link #createTables()}.
 */
public class JdbcTaskResultSink implements TaskResultSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskResultSink.class);

    private static final String TABLE_NAME = "agent_results";
    private static final int MAX_LABEL_LENGTH = 255;

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                run_id        VARCHAR(64)  NOT NULL,
                agent_name    VARCHAR(100) NOT NULL,
                status        VARCHAR(20)  NOT NULL,
                progress_pct  INTEGER      NOT NULL DEFAULT 0,
                current_task  VARCHAR(255),
                result_data   TEXT,
                error_message TEXT,
                started_at    TIMESTAMP,
                completed_at  TIMESTAMP,
                updated_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (run_id, agent_name)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_PENDING_SQL = """
            INSERT INTO %s (run_id, agent_name, status, progress_pct)
            VALUES (?, ?, 'pending', 0)
            ON CONFLICT (run_id, agent_name) DO NOTHING
            """.formatted(TABLE_NAME);

    private static final String UPSERT_STARTED_SQL = """
            INSERT INTO %s (run_id, agent_name, status, started_at)
            VALUES (?, ?, 'running', ?)
            ON CONFLICT (run_id, agent_name)
            DO UPDATE SET status = EXCLUDED.status,
                          started_at = EXCLUDED.started_at,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String UPSERT_PROGRESS_SQL = """
            INSERT INTO %s (run_id, agent_name, status, progress_pct, current_task)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (run_id, agent_name)
            DO UPDATE SET status = EXCLUDED.status,
                          progress_pct = EXCLUDED.progress_pct,
                          current_task = EXCLUDED.current_task,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String UPSERT_RESULT_SQL = """
            INSERT INTO %1$s (run_id, agent_name, status, progress_pct, result_data, error_message, completed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (run_id, agent_name)
            DO UPDATE SET status = EXCLUDED.status,
                          progress_pct = CASE WHEN EXCLUDED.status = 'completed' THEN 100
                                              ELSE %1$s.progress_pct END,
                          result_data = EXCLUDED.result_data,
                          error_message = EXCLUDED.error_message,
                          completed_at = EXCLUDED.completed_at,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_RUN_SQL = """
            SELECT run_id, agent_name, status, progress_pct, current_task, result_data,
                   error_message, started_at, completed_at
            FROM %s
            WHERE run_id = ?
            ORDER BY agent_name
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcTaskResultSink(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Creates the results table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Results table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void registerTasks(String runId, List<String> taskNames) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_PENDING_SQL)) {
            for (String name : taskNames) {
                stmt.setString(1, runId);
                stmt.setString(2, name);
                stmt.addBatch();
            }
            stmt.executeBatch();
            log.debug("Registered {} result rows for run '{}'", taskNames.size(), runId);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to register result rows for run " + runId, e);
        }
    }

    @Override
    public void saveStarted(String runId, String taskName, Instant startedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_STARTED_SQL)) {
            stmt.setString(1, runId);
            stmt.setString(2, taskName);
            stmt.setTimestamp(3, Timestamp.from(startedAt));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save start of " + taskName, e);
        }
    }

    @Override
    public void saveProgress(String runId, String taskName, int percent, String label, TaskStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_PROGRESS_SQL)) {
            stmt.setString(1, runId);
            stmt.setString(2, taskName);
            stmt.setString(3, status.wireName());
            stmt.setInt(4, percent);
            stmt.setString(5, truncate(label));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save progress of " + taskName, e);
        }
    }

    @Override
    public void saveResult(String runId, String taskName, TaskStatus status,
                           Map<String, Object> payload, String errorDetail) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_RESULT_SQL)) {
            stmt.setString(1, runId);
            stmt.setString(2, taskName);
            stmt.setString(3, status.wireName());
            stmt.setInt(4, status == TaskStatus.COMPLETED ? 100 : 0);
            if (payload != null) {
                stmt.setString(5, serialize(payload));
            } else {
                stmt.setNull(5, Types.VARCHAR);
            }
            stmt.setString(6, errorDetail);
            stmt.setTimestamp(7, Timestamp.from(Instant.now()));
            stmt.executeUpdate();
            log.debug("Saved {} result for '{}' in run '{}'", status, taskName, runId);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save result of " + taskName, e);
        }
    }

    /**
     * Returns all rows for a run, or an empty list if the query fails.
     */
    public List<StoredTaskResult> findByRun(String runId) {
        List<StoredTaskResult> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_RUN_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load result rows for run '{}'", runId, e);
        }
        return rows;
    }

    // -- Helpers --------------------------------------------------------------

    private String serialize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize result payload", e);
        }
    }

    private Map<String, Object> deserialize(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (IOException e) {
            throw new PersistenceException("Failed to deserialize result payload", e);
        }
    }

    private StoredTaskResult fromResultSet(ResultSet rs) throws SQLException {
        Timestamp started = rs.getTimestamp("started_at");
        Timestamp completed = rs.getTimestamp("completed_at");
        return new StoredTaskResult(
                rs.getString("run_id"),
                rs.getString("agent_name"),
                TaskStatus.valueOf(rs.getString("status").toUpperCase(Locale.ROOT)),
                rs.getInt("progress_pct"),
                rs.getString("current_task"),
                deserialize(rs.getString("result_data")),
                rs.getString("error_message"),
                started != null ? started.toInstant() : null,
                completed != null ? completed.toInstant() : null);
    }

    private static String truncate(String label) {
        if (label == null || label.length() <= MAX_LABEL_LENGTH) {
            return label;
        }
        return label.substring(0, MAX_LABEL_LENGTH);
    }
}
