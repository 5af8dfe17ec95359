package org.apipulse.store.jdbc;

import org.apipulse.store.PersistenceException;
import org.apipulse.store.UsageCounter;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Delegates to the {@code increment_run_count} database function so the monthly bucket is computed server side.
 */
public class JdbcUsageCounter implements UsageCounter {

    private final DataSource dataSource;

    public JdbcUsageCounter(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void increment(UUID userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT increment_run_count(?)")) {
            ps.setObject(1, userId);
            ps.execute();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to increment usage for user " + userId + ": " + e.getMessage(), e);
        }
    }
}
