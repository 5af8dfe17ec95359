package org.apipulse.services;

public interface ScheduledTask {
    /**
     * A short name used for logging.
     */
    String name();

    /**
     * Interval in seconds between executions.
     */
    long intervalSeconds();

    /**
     * The work to do. Exceptions escaping here are logged by the scheduler and do not stop later runs.
     */
    void execute();
}
