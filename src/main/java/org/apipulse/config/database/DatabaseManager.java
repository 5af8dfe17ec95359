package org.apipulse.config.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apipulse.config.XmlConfiguration;
import org.apipulse.config.utils.LogContext;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single HikariCP pool of the process. The service starts without it when
 * PostgreSQL is down and {@link DBTaskScheduler} calls {@link #initialize} again later.
 * Stores see the pool only through {@link PooledDataSource}.
 */
public final class DatabaseManager {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    static final String POOL_NAME = "apipulse-pool";
    static final String DEFAULT_SSL_MODE = "disable";
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private static final AtomicReference<HikariDataSource> pool = new AtomicReference<>();

    private DatabaseManager() {}

    /**
     * Opens a new pool, checks one connection, then swaps it in and closes the previous pool.
     *
     * @throws SQLException when the configuration is incomplete or no valid connection can be made
     */
    public static synchronized void initialize(XmlConfiguration cfg) throws SQLException {
        LogContext.start("DatabaseManager");
        try {
            if (cfg == null || cfg.dataSource == null || cfg.connectionPool == null) {
                throw new SQLException("dataSource and connectionPool sections are required");
            }
            HikariConfig hc = poolConfig(cfg);
            logger.info("Connecting to {} as {} (sslmode={})", hc.getJdbcUrl(), hc.getUsername(),
                    hc.getDataSourceProperties().getProperty("sslmode"));

            HikariDataSource fresh = open(hc);
            HikariDataSource old = pool.getAndSet(fresh);
            if (old != null) old.close();
            logger.info("Database pool {} ready, max {} connections", POOL_NAME, hc.getMaximumPoolSize());
        } catch (SQLException e) {
            shutdown();
            logger.error("Database unavailable: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            // Hikari reports a failed first connection as PoolInitializationException
            shutdown();
            logger.error("Database unavailable: {}", e.getMessage());
            throw new SQLException(e.getMessage(), e);
        } finally {
            LogContext.clear();
        }
    }

    private static HikariDataSource open(HikariConfig hc) throws SQLException {
        HikariDataSource candidate = new HikariDataSource(hc);
        try (Connection conn = candidate.getConnection()) {
            if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new SQLException("connection did not validate within " + VALIDATION_TIMEOUT_SECONDS + "s");
            }
            return candidate;
        } catch (SQLException e) {
            candidate.close();
            throw e;
        }
    }

    @NotNull
    static HikariConfig poolConfig(XmlConfiguration cfg) {
        XmlConfiguration.DataSource db = cfg.dataSource;
        XmlConfiguration.ConnectionPool limits = cfg.connectionPool;

        HikariConfig hc = new HikariConfig();
        hc.setPoolName(POOL_NAME);
        hc.setDriverClassName(db.driverClassName == null ? "org.postgresql.Driver" : db.driverClassName);
        hc.setJdbcUrl(db.jdbcUrl);
        hc.setUsername(db.username);
        hc.setPassword(db.password);
        hc.addDataSourceProperty("sslmode",
                db.sslMode == null || db.sslMode.isBlank() ? DEFAULT_SSL_MODE : db.sslMode.trim());

        hc.setMaximumPoolSize(limits.maximumPoolSize);
        hc.setMinimumIdle(limits.minimumIdle);
        hc.setIdleTimeout(limits.idleTimeout);
        hc.setConnectionTimeout(limits.connectionTimeout);
        hc.setMaxLifetime(limits.maxLifetime);
        return hc;
    }

    /**
     * Returns the live pool, or null while the database is unavailable.
     */
    public static HikariDataSource getDataSource() {
        return pool.get();
    }

    public static synchronized void shutdown() {
        HikariDataSource current = pool.getAndSet(null);
        if (current == null) return;
        try {
            current.close();
            logger.info("Database pool {} closed", POOL_NAME);
        } catch (RuntimeException e) {
            logger.warn("Closing database pool failed: {}", e.getMessage());
        }
    }
}
