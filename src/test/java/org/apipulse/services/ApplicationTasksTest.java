package org.apipulse.services;

import org.apipulse.config.XmlConfiguration;
import org.apipulse.scheduling.SchedulerLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApplicationTasksTest {

    private final TaskScheduler scheduler = new TaskScheduler(1);

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private static XmlConfiguration config(boolean enabled) {
        XmlConfiguration cfg = new XmlConfiguration();
        cfg.scheduler = new XmlConfiguration.Scheduler();
        cfg.scheduler.enabled = enabled;
        cfg.scheduler.tickIntervalSeconds = 1;
        return cfg;
    }

    @Test
    void timerTicksTheLoopAndSurvivesFailures() {
        SchedulerLoop loop = mock(SchedulerLoop.class);
        when(loop.tick()).thenThrow(new IllegalStateException("first tick blows up")).thenReturn(null);

        ApplicationTasks.registerApplicationTasks(scheduler, config(true), loop);
        scheduler.start();

        // the second invocation proves the failing first run did not cancel the schedule
        verify(loop, timeout(3500).times(2)).tick();
    }

    @Test
    void disabledTimerNeverTicks() {
        SchedulerLoop loop = mock(SchedulerLoop.class);

        ApplicationTasks.registerApplicationTasks(scheduler, config(false), loop);
        scheduler.start();

        verify(loop, after(1500).never()).tick();
    }
}
