package org.apipulse.scheduling;

import org.apipulse.TestFixtures;
import org.apipulse.execution.TaskExecutor;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Task;
import org.apipulse.notifications.NotificationDispatcher;
import org.apipulse.store.memory.InMemoryExecutionLogStore;
import org.apipulse.store.memory.InMemoryTaskStore;
import org.apipulse.store.memory.InMemoryUsageCounter;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Several scheduler instances ticking at once against one store must run each due task exactly once.
 */
class AtMostOnceExecutionTest {

    @Test
    void concurrentTicksNeverRunATaskTwice() throws Exception {
        Clock clock = Clock.fixed(TestFixtures.NOW, ZoneOffset.UTC);
        InMemoryTaskStore tasks = new InMemoryTaskStore();
        InMemoryExecutionLogStore logs = new InMemoryExecutionLogStore();
        for (int i = 0; i < 50; i++) {
            tasks.insert(TestFixtures.dueTask("https://api.example.com/" + i, TestFixtures.NOW.minusSeconds(i)));
        }

        Map<UUID, AtomicInteger> executions = new ConcurrentHashMap<>();
        TaskExecutor executor = mock(TaskExecutor.class);
        when(executor.execute(any())).thenAnswer(inv -> {
            Task task = inv.getArgument(0);
            executions.computeIfAbsent(task.id(), id -> new AtomicInteger()).incrementAndGet();
            return ExecutionLog.completed(task, 200, null, null, 1, TestFixtures.NOW);
        });

        int instances = 4;
        ExecutorService pool = Executors.newFixedThreadPool(instances * 5);
        ExecutorService tickers = Executors.newFixedThreadPool(instances);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<TickReport>> reports = new ArrayList<>();
            for (int i = 0; i < instances; i++) {
                SchedulerLoop loop = new SchedulerLoop(tasks, logs, new InMemoryUsageCounter(clock), executor,
                        mock(NotificationDispatcher.class), IntervalCalculator.utc(), pool, Runnable::run, clock,
                        new SchedulerLoop.Settings(100, Duration.ofMinutes(5), Duration.ofSeconds(10)));
                reports.add(tickers.submit(() -> {
                    start.await();
                    return loop.tick();
                }));
            }
            start.countDown();

            int claimed = 0;
            for (Future<TickReport> report : reports) {
                claimed += report.get(15, TimeUnit.SECONDS).claimed();
            }

            assertThat(claimed).isEqualTo(50);
            assertThat(executions).hasSize(50);
            assertThat(executions.values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
            assertThat(logs.all()).hasSize(50);
        } finally {
            tickers.shutdownNow();
            pool.shutdownNow();
        }
    }
}
