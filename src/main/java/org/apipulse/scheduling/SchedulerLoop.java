package org.apipulse.scheduling;

import org.apipulse.config.XmlConfiguration;
import org.apipulse.config.utils.LogContext;
import org.apipulse.execution.TaskExecutor;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Task;
import org.apipulse.notifications.NotificationDispatcher;
import org.apipulse.store.ExecutionLogStore;
import org.apipulse.store.TaskStore;
import org.apipulse.store.UsageCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One tick: claim due tasks, run them on the bounded worker pool, and for each run
 * persist the log, count usage, dispatch notifications and move the schedule forward.
 * <p>
 * The loop holds no state between ticks apart from the last report. Overlapping ticks are
 * safe because a claimed task is leased in the store before it is executed.
 */
public class SchedulerLoop {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerLoop.class);

    static final String CANCELLED_MESSAGE = "Execution cancelled: scheduler tick deadline exceeded";

    public record Settings(int batchSize, Duration claimLease, Duration tickDeadline) {

        public static Settings fromConfig(XmlConfiguration.Scheduler cfg) {
            return new Settings(cfg.batchSize,
                    Duration.ofSeconds(cfg.claimLeaseSeconds),
                    Duration.ofSeconds(cfg.tickDeadlineSeconds));
        }
    }

    private enum Stage { QUEUED, EXECUTING, PERSISTING, DONE, CANCELLED, DEFERRED }

    private final TaskStore tasks;
    private final ExecutionLogStore logs;
    private final UsageCounter usage;
    private final TaskExecutor executor;
    private final NotificationDispatcher dispatcher;
    private final IntervalCalculator intervals;
    private final ExecutorService workers;
    private final Executor usageExecutor;
    private final Clock clock;
    private final Settings settings;

    private volatile TickReport lastReport;

    public SchedulerLoop(TaskStore tasks, ExecutionLogStore logs, UsageCounter usage,
                         TaskExecutor executor, NotificationDispatcher dispatcher, IntervalCalculator intervals,
                         ExecutorService workers, Executor usageExecutor, Clock clock, Settings settings) {
        this.tasks = tasks;
        this.logs = logs;
        this.usage = usage;
        this.executor = executor;
        this.dispatcher = dispatcher;
        this.intervals = intervals;
        this.workers = workers;
        this.usageExecutor = usageExecutor;
        this.clock = clock;
        this.settings = settings;
    }

    public Optional<TickReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public TickReport tick() {
        LogContext.start("scheduler-tick");
        Instant now = clock.instant();
        long deadlineNanos = System.nanoTime() + settings.tickDeadline().toNanos();
        try {
            List<Task> claimed;
            try {
                claimed = tasks.claimDueTasks(now, now.plus(settings.claimLease()), settings.batchSize());
            } catch (RuntimeException e) {
                logger.error("Claiming due tasks failed, tick skipped: {}", e.getMessage(), e);
                return remember(TickReport.empty(now, clock.instant()));
            }

            if (claimed.isEmpty()) {
                logger.debug("No tasks due at {}", now);
                return remember(TickReport.empty(now, clock.instant()));
            }
            logger.info("Tick at {} claimed {} task(s)", now, claimed.size());

            List<TaskRun> runs = new ArrayList<>(claimed.size());
            for (Task task : claimed) {
                TaskRun run = new TaskRun(task, now);
                try {
                    run.future = workers.submit(run);
                } catch (RejectedExecutionException e) {
                    logger.warn("Worker pool rejected task {}, handing it back", task.id());
                    run.defer();
                }
                runs.add(run);
            }

            awaitAll(runs, deadlineNanos);

            TickReport report = summarize(runs, now);
            logger.info("Tick finished: claimed={}, succeeded={}, failed={}, cancelled={}, deferred={}",
                    report.claimed(), report.succeeded(), report.failed(), report.cancelled(), report.deferred());
            return remember(report);
        } finally {
            LogContext.clear();
        }
    }

    private void awaitAll(List<TaskRun> runs, long deadlineNanos) {
        boolean interrupted = false;
        for (TaskRun run : runs) {
            if (run.future == null) continue;
            long remaining = interrupted ? 0 : deadlineNanos - System.nanoTime();
            try {
                run.future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                run.onDeadline();
            } catch (InterruptedException e) {
                interrupted = true;
                run.onDeadline();
            } catch (ExecutionException e) {
                logger.error("Run of task {} failed unexpectedly", run.task.id(), e.getCause());
            } catch (CancellationException e) {
                logger.debug("Run of task {} was cancelled before completion", run.task.id());
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    private TickReport summarize(List<TaskRun> runs, Instant startedAt) {
        int succeeded = 0, failed = 0, cancelled = 0, deferred = 0;
        for (TaskRun run : runs) {
            switch (run.stage.get()) {
                case CANCELLED -> cancelled++;
                case DEFERRED -> deferred++;
                default -> {
                    if (run.succeeded) succeeded++;
                    else failed++;
                }
            }
        }
        return new TickReport(runs.size(), succeeded, failed, cancelled, deferred, startedAt, clock.instant());
    }

    private TickReport remember(TickReport report) {
        lastReport = report;
        return report;
    }

    /**
     * Persists the log, counts the run, notifies and reschedules. Every step is attempted
     * even when an earlier one fails.
     */
    private boolean complete(Task task, ExecutionLog log, Instant now) {
        ExecutionLog stored = log;
        try {
            stored = logs.insert(log);
        } catch (RuntimeException e) {
            logger.error("Failed to persist execution log of task {}: {}", task.id(), e.getMessage(), e);
        }

        try {
            CompletableFuture.runAsync(() -> usage.increment(task.userId()), usageExecutor)
                    .exceptionally(ex -> {
                        logger.warn("Usage increment for user {} failed: {}", task.userId(), ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            logger.warn("Usage increment for user {} not scheduled: {}", task.userId(), e.getMessage());
        }

        try {
            dispatcher.dispatch(task, stored);
        } catch (RuntimeException e) {
            logger.error("Notification dispatch for task {} failed: {}", task.id(), e.getMessage(), e);
        }

        try {
            Instant next = intervals.nextRun(now, task.scheduleInterval());
            tasks.recordRun(task.id(), now, next);
            logger.debug("Task {} next run at {}", task.id(), next);
        } catch (InvalidIntervalException e) {
            logger.error("Task {} has an unusable interval '{}', it stays leased: {}",
                    task.id(), e.expression(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Failed to reschedule task {}: {}", task.id(), e.getMessage(), e);
        }
        return log.isSuccess();
    }

    private final class TaskRun implements Runnable {

        private final Task task;
        private final Instant now;
        private final AtomicReference<Stage> stage = new AtomicReference<>(Stage.QUEUED);
        private volatile Future<?> future;
        private volatile long startedNanos;
        private volatile boolean succeeded;

        private TaskRun(Task task, Instant now) {
            this.task = task;
            this.now = now;
        }

        @Override
        public void run() {
            if (!stage.compareAndSet(Stage.QUEUED, Stage.EXECUTING)) return;
            startedNanos = System.nanoTime();
            LogContext.start("task-run", task.id().toString());
            try {
                ExecutionLog log = executor.execute(task);
                // the tick thread owns completion once it has cancelled this run
                if (!stage.compareAndSet(Stage.EXECUTING, Stage.PERSISTING)) return;
                succeeded = complete(task, log, now);
                stage.set(Stage.DONE);
            } finally {
                LogContext.clear();
            }
        }

        /**
         * Called on the tick thread when the deadline passed before this run finished.
         */
        private void onDeadline() {
            if (stage.get() == Stage.QUEUED && defer()) {
                future.cancel(false);
                return;
            }
            if (stage.compareAndSet(Stage.EXECUTING, Stage.CANCELLED)) {
                future.cancel(true);
                long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
                logger.warn("Task {} cancelled at tick deadline after {}ms", task.id(), elapsed);
                complete(task, ExecutionLog.failed(task, CANCELLED_MESSAGE, elapsed, now), now);
                return;
            }
            // already persisting: wait so the log and schedule are written
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for task {} to persist", task.id());
            } catch (ExecutionException e) {
                logger.error("Run of task {} failed unexpectedly", task.id(), e.getCause());
            }
        }

        /**
         * Hands a never-started task back to the store with its original due time.
         */
        private boolean defer() {
            if (!stage.compareAndSet(Stage.QUEUED, Stage.DEFERRED)) return false;
            try {
                tasks.recordRun(task.id(), task.lastRunAt(), task.nextRunAt());
            } catch (RuntimeException e) {
                logger.error("Failed to release claim on task {}, it runs after the lease expires: {}",
                        task.id(), e.getMessage(), e);
            }
            return true;
        }
    }
}
