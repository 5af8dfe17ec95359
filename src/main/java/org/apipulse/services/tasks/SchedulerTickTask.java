package org.apipulse.services.tasks;

import org.apipulse.scheduling.SchedulerLoop;
import org.apipulse.services.ScheduledTask;

/**
 * Timer trigger for the scheduler loop.
 */
public class SchedulerTickTask implements ScheduledTask {

    private final SchedulerLoop loop;
    private final long intervalSeconds;

    public SchedulerTickTask(SchedulerLoop loop, long intervalSeconds) {
        this.loop = loop;
        this.intervalSeconds = intervalSeconds;
    }

    @Override
    public String name() {
        return "[ SchedulerTickTask ]";
    }

    @Override
    public long intervalSeconds() {
        return intervalSeconds;
    }

    @Override
    public void execute() {
        loop.tick();
    }
}
