package org.apipulse.store.jdbc;

import org.apipulse.model.ExecutionLog;
import org.apipulse.store.ExecutionLogStore;
import org.apipulse.store.PersistenceException;
import org.apipulse.utils.JsonUtil;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.apipulse.store.jdbc.JdbcSupport.getInstant;
import static org.apipulse.store.jdbc.JdbcSupport.getNullableInt;
import static org.apipulse.store.jdbc.JdbcSupport.getUuid;
import static org.apipulse.store.jdbc.JdbcSupport.setInstant;

public class JdbcExecutionLogStore implements ExecutionLogStore {

    private final DataSource dataSource;

    public JdbcExecutionLogStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public ExecutionLog insert(ExecutionLog log) {
        String sql = """
                INSERT INTO api_task_logs
                    (task_id, user_id, status_code, response_headers, response_body,
                     response_time_ms, error_message, executed_at)
                VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?)
                RETURNING id
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, log.taskId());
            ps.setObject(2, log.userId());
            if (log.statusCode() == null) {
                ps.setNull(3, Types.INTEGER);
            } else {
                ps.setInt(3, log.statusCode());
            }
            ps.setString(4, JsonUtil.writeStringMap(log.responseHeaders()));
            ps.setString(5, log.responseBody());
            ps.setLong(6, log.responseTimeMs());
            ps.setString(7, log.errorMessage());
            setInstant(ps, 8, log.executedAt());

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new PersistenceException("Insert of execution log for task " + log.taskId() + " returned no id");
                }
                return log.withId(rs.getLong("id"));
            }
        } catch (SQLException | IOException e) {
            throw new PersistenceException("Failed to store execution log for task " + log.taskId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ExecutionLog> findRecent(UUID taskId, int limit) {
        String sql = """
                SELECT id, task_id, user_id, status_code, response_headers, response_body,
                       response_time_ms, error_message, executed_at
                FROM api_task_logs
                WHERE task_id = ?
                ORDER BY executed_at DESC, id DESC
                LIMIT ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, taskId);
            ps.setInt(2, limit);
            List<ExecutionLog> logs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String headers = rs.getString("response_headers");
                    logs.add(new ExecutionLog(
                            rs.getLong("id"),
                            getUuid(rs, "task_id"),
                            getUuid(rs, "user_id"),
                            getNullableInt(rs, "status_code"),
                            headers == null ? null : JsonUtil.readStringMap(headers),
                            rs.getString("response_body"),
                            rs.getLong("response_time_ms"),
                            rs.getString("error_message"),
                            getInstant(rs, "executed_at")
                    ));
                }
            }
            return logs;
        } catch (SQLException | IOException e) {
            throw new PersistenceException("Failed to read logs of task " + taskId + ": " + e.getMessage(), e);
        }
    }
}
