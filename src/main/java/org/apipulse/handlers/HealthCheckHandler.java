package org.apipulse.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.apipulse.config.database.DatabaseManager;
import org.apipulse.scheduling.SchedulerLoop;
import org.apipulse.utils.ResponseUtil;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handler for health check endpoint.
 * Returns  -  basic app info,
 *          -  database status,
 *          -  the last scheduler tick.
 */
public class HealthCheckHandler implements HttpHandler {

    private static final Instant START_TIME = Instant.now();

    private final String environment;
    private final String storeType;
    private final boolean usesDatabase;
    private final SchedulerLoop loop;

    public HealthCheckHandler(String environment, String storeType, boolean usesDatabase, SchedulerLoop loop) {
        this.environment = environment;
        this.storeType = storeType;
        this.usesDatabase = usesDatabase;
        this.loop = loop;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", "API Pulse Scheduler");
        response.put("version", "1.0.0");
        response.put("environment", environment);
        response.put("uptime_seconds", Duration.between(START_TIME, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now().toString());
        response.put("store", storeType);
        response.put("database_status", databaseStatus());
        response.put("last_tick", loop.lastReport().orElse(null));

        ResponseUtil.sendSuccess(exchange, "Health check completed", response);
    }

    private String databaseStatus() {
        if (!usesDatabase) return "not used";
        DataSource ds = DatabaseManager.getDataSource();
        if (ds == null) return "unavailable";
        try (Connection conn = ds.getConnection()) {
            return conn.isValid(2) ? "connected" : "unavailable";
        } catch (SQLException e) {
            return "unavailable";
        }
    }
}
