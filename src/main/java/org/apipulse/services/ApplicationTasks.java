package org.apipulse.services;

import org.apipulse.config.XmlConfiguration;
import org.apipulse.scheduling.SchedulerLoop;
import org.apipulse.services.tasks.SchedulerTickTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ApplicationTasks {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationTasks.class);

    private ApplicationTasks() {}

    /**
     * Registers the timer trigger of the scheduler loop unless the configuration leaves
     * ticking to the HTTP trigger alone.
     */
    public static void registerApplicationTasks(TaskScheduler appScheduler, XmlConfiguration cfg, SchedulerLoop loop) {
        logger.info("[------------ Registering Services ------------]");

        if (cfg.scheduler.enabled) {
            appScheduler.register(new SchedulerTickTask(loop, cfg.scheduler.tickIntervalSeconds));
            logger.info("[***** Scheduler tick every {}s, batch {}, {} worker(s) *****]",
                    cfg.scheduler.tickIntervalSeconds, cfg.scheduler.batchSize, cfg.scheduler.workerThreads);
        } else {
            logger.info("[***** Timer trigger disabled, ticks only via POST /scheduler/tick *****]");
        }

        logger.info("[------------ Application tasks registered ------------]");
    }
}
