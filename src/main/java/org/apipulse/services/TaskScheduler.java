package org.apipulse.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs registered {@link ScheduledTask}s at a fixed rate on a small scheduled pool.
 * A run that overruns its period delays the next run of the same task instead of overlapping it.
 */
public class TaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledThreadPoolExecutor executor;
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private final List<ScheduledTask> tasks = new ArrayList<>();

    public TaskScheduler(int poolSize) {
        this.executor = new ScheduledThreadPoolExecutor(poolSize, runnable -> {
            Thread t = new Thread(runnable, "apipulse-timer");
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
    }

    public synchronized void register(ScheduledTask task) {
        tasks.add(task);
    }

    public synchronized void start() {
        for (ScheduledTask t : tasks) {
            logger.info("Scheduling task {} every {}s", t.name(), t.intervalSeconds());
            ScheduledFuture<?> f = executor.scheduleAtFixedRate(() -> runTaskWithLogging(t),
                    t.intervalSeconds(), t.intervalSeconds(), TimeUnit.SECONDS);
            futures.add(f);
        }
    }

    private void runTaskWithLogging(ScheduledTask task) {
        long start = System.currentTimeMillis();
        try {
            task.execute();
        } catch (Exception e) {
            // an exception escaping scheduleAtFixedRate would cancel every later run
            logger.error("Error in scheduled task {}: {}", task.name(), e.getMessage(), e);
        } finally {
            logger.debug("Scheduled task {} ran in {}ms", task.name(), System.currentTimeMillis() - start);
        }
    }

    public synchronized void shutdown() {
        logger.info("Shutting down TaskScheduler...");
        for (ScheduledFuture<?> f : futures) f.cancel(false);
        futures.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("TaskScheduler did not terminate gracefully");
                executor.shutdownNow();
            } else {
                logger.info("TaskScheduler stopped.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            logger.warn("TaskScheduler shutdown interrupted.");
        }
    }
}
