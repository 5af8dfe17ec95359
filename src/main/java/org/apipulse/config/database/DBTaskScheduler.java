package org.apipulse.config.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background database reconnection while running in degraded mode.
 */
public class DBTaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(DBTaskScheduler.class);

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "db-reconnect");
        t.setDaemon(true);
        return t;
    });
    private volatile ScheduledFuture<?> future;

    /**
     * Runs {@code attempt} every 20 seconds until it returns true.
     */
    public synchronized void scheduleReconnect(ReconnectAttempt attempt) {
        future = executor.scheduleAtFixedRate(() -> {
            try {
                if (attempt.tryReconnect()) {
                    logger.info("[------------ Database reconnected successfully ------------]");
                    future.cancel(false);
                }
            } catch (Exception e) {
                logger.warn("Database still unavailable: {}", e.getMessage());
            }
        }, 10, 20, TimeUnit.SECONDS);
    }

    public void shutdown() {
        executor.shutdownNow();
        logger.info("DB reconnect scheduler stopped.");
    }

    @FunctionalInterface
    public interface ReconnectAttempt {
        boolean tryReconnect() throws Exception;
    }
}
