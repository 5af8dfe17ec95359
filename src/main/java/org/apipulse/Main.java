package org.apipulse;

import io.undertow.Undertow;
import org.apipulse.config.ConfigLoader;
import org.apipulse.config.XmlConfiguration;
import org.apipulse.config.database.DBTaskScheduler;
import org.apipulse.config.database.DatabaseManager;
import org.apipulse.config.database.PooledDataSource;
import org.apipulse.config.utils.KeyProvider;
import org.apipulse.config.utils.LogContext;
import org.apipulse.handlers.HealthCheckHandler;
import org.apipulse.rest.RestApiServer;
import org.apipulse.services.ApplicationServices;
import org.apipulse.services.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

import static org.apipulse.services.ApplicationTasks.registerApplicationTasks;

/**
 * Entry point
 * Load Configuration from Xml
 * Connect to Database
 * Start the REST API and the scheduler timer
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        LogContext.start("Main");

        try {
            String environment = KeyProvider.getEnvironment();
            logger.info("[------------ Starting API Pulse Scheduler ({}) ------------]", environment);

            String configPath = (args.length > 0) ? args[0] : "config.xml";
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            logger.debug("Configuration loaded from {}", configPath);

            boolean usesPostgres = ConfigLoader.usesPostgres(cfg);
            boolean dbAvailable = false;
            if (usesPostgres) {
                try {
                    DatabaseManager.initialize(cfg);
                    dbAvailable = true;
                } catch (Exception e) {
                    logger.error("Database initialization failed: {}", e.getMessage());
                    logger.warn("[------------ Continuing in DEGRADED MODE, database unavailable ------------]");
                }
            }

            ApplicationServices services = ApplicationServices.fromConfig(cfg, new PooledDataSource(), Clock.systemUTC());
            HealthCheckHandler health = new HealthCheckHandler(environment,
                    usesPostgres ? "postgres" : "memory", usesPostgres, services.schedulerLoop());

            logger.info("[------------ Starting Undertow server ------------]");
            Undertow server = RestApiServer.startUndertow(cfg, services, health);

            TaskScheduler appScheduler = new TaskScheduler(1);
            registerApplicationTasks(appScheduler, cfg, services.schedulerLoop());
            appScheduler.start();

            DBTaskScheduler reconnect = new DBTaskScheduler();
            if (usesPostgres && !dbAvailable) {
                logger.info("[------------ Starting background DB reconnection monitor ------------]");
                reconnect.scheduleReconnect(() -> {
                    DatabaseManager.initialize(cfg);
                    return true;
                });
            }

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                appScheduler.shutdown();
                server.stop();
                services.close();
                reconnect.shutdown();
                DatabaseManager.shutdown();
                logger.info("[------------ API Pulse shutdown complete ------------]");
            }, "shutdown"));

        } catch (Exception e) {
            logger.error("[------------ System startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }
}
