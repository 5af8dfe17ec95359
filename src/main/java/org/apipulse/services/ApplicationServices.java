package org.apipulse.services;

import org.apipulse.config.ConfigLoader;
import org.apipulse.config.XmlConfiguration;
import org.apipulse.execution.TaskExecutor;
import org.apipulse.model.IntegrationType;
import org.apipulse.notifications.JsonPostClient;
import org.apipulse.notifications.MultiChannelSender;
import org.apipulse.notifications.NotificationDispatcher;
import org.apipulse.notifications.TemplateLoader;
import org.apipulse.notifications.discord.DiscordSender;
import org.apipulse.notifications.email.EmailSender;
import org.apipulse.notifications.format.EmailFormatter;
import org.apipulse.notifications.slack.SlackSender;
import org.apipulse.notifications.webhook.WebhookSender;
import org.apipulse.scheduling.IntervalCalculator;
import org.apipulse.scheduling.SchedulerLoop;
import org.apipulse.store.ExecutionLogStore;
import org.apipulse.store.NotificationLinkStore;
import org.apipulse.store.TaskStore;
import org.apipulse.store.UsageCounter;
import org.apipulse.store.jdbc.JdbcExecutionLogStore;
import org.apipulse.store.jdbc.JdbcNotificationLinkStore;
import org.apipulse.store.jdbc.JdbcTaskStore;
import org.apipulse.store.jdbc.JdbcUsageCounter;
import org.apipulse.store.memory.InMemoryExecutionLogStore;
import org.apipulse.store.memory.InMemoryNotificationLinkStore;
import org.apipulse.store.memory.InMemoryTaskStore;
import org.apipulse.store.memory.InMemoryUsageCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the engine from configuration: stores, executor, dispatcher, scheduler loop and task service.
 * Owns the worker pools and shuts them down on {@link #close()}.
 */
public class ApplicationServices implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationServices.class);

    private final TaskStore taskStore;
    private final ExecutionLogStore logStore;
    private final NotificationLinkStore linkStore;
    private final SchedulerLoop schedulerLoop;
    private final TaskService taskService;
    private final ExecutorService taskWorkers;
    private final ExecutorService notificationWorkers;
    private final ExecutorService usageWorkers;

    private ApplicationServices(XmlConfiguration cfg, TaskStore taskStore, ExecutionLogStore logStore,
                                NotificationLinkStore linkStore, UsageCounter usage, Clock clock) {
        this.taskStore = taskStore;
        this.logStore = logStore;
        this.linkStore = linkStore;

        IntervalCalculator intervals = new IntervalCalculator(ZoneId.of(cfg.scheduler.timeZone));
        TaskExecutor executor = TaskExecutor.fromConfig(cfg.execution, clock);

        this.taskWorkers = Executors.newFixedThreadPool(cfg.scheduler.workerThreads, threads("task-worker"));
        this.notificationWorkers = Executors.newFixedThreadPool(cfg.notification.workerThreads, threads("notify"));
        this.usageWorkers = Executors.newSingleThreadExecutor(threads("usage"));

        NotificationDispatcher dispatcher = new NotificationDispatcher(linkStore, channelSenders(cfg.notification),
                notificationWorkers, cfg.notification.enabled);

        this.schedulerLoop = new SchedulerLoop(taskStore, logStore, usage, executor, dispatcher, intervals,
                taskWorkers, usageWorkers, clock, SchedulerLoop.Settings.fromConfig(cfg.scheduler));
        this.taskService = new TaskService(taskStore, logStore, linkStore, intervals, clock);
    }

    /**
     * PostgreSQL backed services. {@code dataSource} may point to a pool that is not up yet.
     */
    public static ApplicationServices postgres(XmlConfiguration cfg, DataSource dataSource, Clock clock) {
        logger.info("Using PostgreSQL stores");
        return new ApplicationServices(cfg,
                new JdbcTaskStore(dataSource),
                new JdbcExecutionLogStore(dataSource),
                new JdbcNotificationLinkStore(dataSource),
                new JdbcUsageCounter(dataSource),
                clock);
    }

    public static ApplicationServices inMemory(XmlConfiguration cfg, Clock clock) {
        logger.warn("Using in-memory stores, nothing survives a restart");
        InMemoryTaskStore tasks = new InMemoryTaskStore();
        InMemoryExecutionLogStore logs = new InMemoryExecutionLogStore();
        InMemoryNotificationLinkStore links = new InMemoryNotificationLinkStore();
        tasks.onDelete(logs::deleteByTask);
        tasks.onDelete(links::deleteByTask);
        return new ApplicationServices(cfg, tasks, logs, links, new InMemoryUsageCounter(clock), clock);
    }

    public static ApplicationServices fromConfig(XmlConfiguration cfg, DataSource dataSource, Clock clock) {
        return ConfigLoader.usesPostgres(cfg) ? postgres(cfg, dataSource, clock) : inMemory(cfg, clock);
    }

    private static MultiChannelSender channelSenders(XmlConfiguration.Notification cfg) {
        JsonPostClient client = JsonPostClient.create(cfg.requestTimeoutSeconds);
        MultiChannelSender sender = new MultiChannelSender()
                .addSender(IntegrationType.SLACK, new SlackSender(client))
                .addSender(IntegrationType.DISCORD, new DiscordSender(client))
                .addSender(IntegrationType.WEBHOOK, new WebhookSender(client));

        if (cfg.email != null && cfg.email.apiUrl != null && !cfg.email.apiUrl.isBlank()) {
            sender.addSender(IntegrationType.EMAIL,
                    new EmailSender(cfg.email, new EmailFormatter(new TemplateLoader()), client));
        } else {
            logger.warn("Email API is not configured, email notifications will fail");
        }
        return sender;
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public ExecutionLogStore logStore() {
        return logStore;
    }

    public NotificationLinkStore linkStore() {
        return linkStore;
    }

    public SchedulerLoop schedulerLoop() {
        return schedulerLoop;
    }

    public TaskService taskService() {
        return taskService;
    }

    @Override
    public void close() {
        shutdown("task workers", taskWorkers);
        shutdown("notification workers", notificationWorkers);
        shutdown("usage worker", usageWorkers);
    }

    private static void shutdown(String name, ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("{} did not finish in time, interrupting", name);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
