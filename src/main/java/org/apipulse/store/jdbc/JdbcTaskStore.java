package org.apipulse.store.jdbc;

import org.apipulse.model.HttpMethod;
import org.apipulse.model.Task;
import org.apipulse.store.PersistenceException;
import org.apipulse.store.TaskStore;
import org.apipulse.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.apipulse.store.jdbc.JdbcSupport.getInstant;
import static org.apipulse.store.jdbc.JdbcSupport.getUuid;
import static org.apipulse.store.jdbc.JdbcSupport.setInstant;

public class JdbcTaskStore implements TaskStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcTaskStore.class);

    private static final String COLUMNS = """
            id, user_id, task_name, api_url, method, request_headers, request_body,
            schedule_interval, is_active, include_response, last_run_at, next_run_at
            """;

    // The CTE locks the due rows (skipping rows another scheduler holds) and the
    // outer UPDATE moves them to the lease; RETURNING reports the pre-lease due time.
    static final String CLAIM_SQL = """
            WITH due AS (
                SELECT id, next_run_at AS due_at
                FROM api_tasks
                WHERE is_active = TRUE AND next_run_at <= ?
                ORDER BY next_run_at
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            UPDATE api_tasks t
            SET next_run_at = ?
            FROM due
            WHERE t.id = due.id
            RETURNING t.id, t.user_id, t.task_name, t.api_url, t.method, t.request_headers, t.request_body,
                      t.schedule_interval, t.is_active, t.include_response, t.last_run_at,
                      due.due_at AS next_run_at
            """;

    private final DataSource dataSource;

    public JdbcTaskStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Task> claimDueTasks(Instant now, Instant leaseUntil, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(CLAIM_SQL)) {
            setInstant(ps, 1, now);
            ps.setInt(2, limit);
            setInstant(ps, 3, leaseUntil);

            List<Task> claimed = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    claimed.add(mapTask(rs));
                }
            }
            logger.debug("Claimed {} due task(s) with lease until {}", claimed.size(), leaseUntil);
            return claimed;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to claim due tasks: " + e.getMessage(), e);
        }
    }

    @Override
    public void recordRun(UUID taskId, Instant lastRunAt, Instant nextRunAt) {
        String sql = "UPDATE api_tasks SET last_run_at = ?, next_run_at = ? WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, lastRunAt);
            setInstant(ps, 2, nextRunAt);
            ps.setObject(3, taskId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update schedule of task " + taskId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Task insert(Task task) {
        String sql = "INSERT INTO api_tasks (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, task.id());
            ps.setObject(2, task.userId());
            ps.setString(3, task.name());
            ps.setString(4, task.url());
            ps.setString(5, task.method().name());
            ps.setString(6, task.requestHeaders().isEmpty() ? null : JsonUtil.writeStringMap(task.requestHeaders()));
            ps.setString(7, task.requestBody());
            ps.setString(8, task.scheduleInterval());
            ps.setBoolean(9, task.active());
            ps.setBoolean(10, task.captureResponse());
            setInstant(ps, 11, task.lastRunAt());
            setInstant(ps, 12, task.nextRunAt());
            ps.executeUpdate();
            return task;
        } catch (SQLException | IOException e) {
            throw new PersistenceException("Failed to insert task: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        String sql = "SELECT " + COLUMNS + " FROM api_tasks WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTask(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load task " + taskId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean pause(UUID taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("UPDATE api_tasks SET is_active = FALSE WHERE id = ?")) {
            ps.setObject(1, taskId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to pause task " + taskId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean resume(UUID taskId, Instant nextRunAt) {
        // GREATEST ignores NULL, so a task without a stored time gets the new one
        String sql = "UPDATE api_tasks SET is_active = TRUE, next_run_at = GREATEST(next_run_at, ?) "
                + "WHERE id = ? AND NOT is_active";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, nextRunAt);
            ps.setObject(2, taskId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to resume task " + taskId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(UUID taskId) {
        // logs and links go with ON DELETE CASCADE
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM api_tasks WHERE id = ?")) {
            ps.setObject(1, taskId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to delete task " + taskId + ": " + e.getMessage(), e);
        }
    }

    static Task mapTask(ResultSet rs) throws SQLException {
        try {
            return new Task(
                    getUuid(rs, "id"),
                    getUuid(rs, "user_id"),
                    rs.getString("task_name"),
                    rs.getString("api_url"),
                    HttpMethod.fromString(rs.getString("method")),
                    JsonUtil.readStringMap(rs.getString("request_headers")),
                    rs.getString("request_body"),
                    rs.getString("schedule_interval"),
                    rs.getBoolean("is_active"),
                    rs.getBoolean("include_response"),
                    getInstant(rs, "last_run_at"),
                    getInstant(rs, "next_run_at")
            );
        } catch (IOException e) {
            throw new SQLException("Malformed request_headers on task row: " + e.getMessage(), e);
        }
    }
}
