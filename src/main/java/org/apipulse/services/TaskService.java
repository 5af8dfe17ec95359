package org.apipulse.services;

import org.apipulse.model.ExecutionLog;
import org.apipulse.model.HttpMethod;
import org.apipulse.model.Integration;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.NotifyOn;
import org.apipulse.model.Task;
import org.apipulse.scheduling.IntervalCalculator;
import org.apipulse.store.ExecutionLogStore;
import org.apipulse.store.NotificationLinkStore;
import org.apipulse.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Task management on behalf of an owner. Tasks owned by somebody else are reported as not found.
 * <p>
 * Validation failures are {@link IllegalArgumentException}s; a malformed interval is the
 * {@link org.apipulse.scheduling.InvalidIntervalException} subtype.
 */
public class TaskService {

    private static final Logger logger = LoggerFactory.getLogger(TaskService.class);

    public static final int MAX_LOG_LIMIT = 100;
    public static final int DEFAULT_LOG_LIMIT = 20;

    /**
     * Fields of a task to create.
     */
    public record TaskDraft(
            String name,
            String url,
            String method,
            Map<String, String> headers,
            String body,
            String interval,
            boolean captureResponse
    ) {}

    private final TaskStore tasks;
    private final ExecutionLogStore logs;
    private final NotificationLinkStore links;
    private final IntervalCalculator intervals;
    private final Clock clock;

    public TaskService(TaskStore tasks, ExecutionLogStore logs, NotificationLinkStore links,
                       IntervalCalculator intervals, Clock clock) {
        this.tasks = tasks;
        this.logs = logs;
        this.links = links;
        this.intervals = intervals;
        this.clock = clock;
    }

    public Task createTask(UUID owner, TaskDraft draft) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        String url = requireHttpUrl(draft.url());
        HttpMethod method = HttpMethod.fromString(draft.method());
        String interval = draft.interval() == null ? null : draft.interval().trim();

        Instant now = clock.instant();
        Instant firstRun = intervals.nextRun(now, interval);

        Task task = new Task(UUID.randomUUID(), owner, draft.name().trim(), url, method,
                draft.headers() == null ? Map.of() : draft.headers(),
                method == HttpMethod.POST ? draft.body() : null,
                interval, true, draft.captureResponse(), null, firstRun);
        tasks.insert(task);
        logger.info("Task '{}' ({}) created for user {}, first run at {}", task.name(), task.id(), owner, firstRun);
        return task;
    }

    /**
     * Pauses or resumes a task. Resuming a paused task schedules its next run one interval from now;
     * resuming an active task changes nothing, so a lease held by a running tick stays in place.
     */
    public Task setActive(UUID owner, UUID taskId, boolean active) {
        Task task = ownedTask(owner, taskId);
        if (!active) {
            if (!tasks.pause(taskId)) {
                throw new TaskNotFoundException("Task", taskId);
            }
            logger.info("Task {} paused", taskId);
        } else if (task.active()) {
            logger.debug("Task {} is already active", taskId);
            return task;
        } else if (tasks.resume(taskId, intervals.nextRun(clock.instant(), task.scheduleInterval()))) {
            logger.info("Task {} resumed", taskId);
        }
        return tasks.findById(taskId).orElseThrow(() -> new TaskNotFoundException("Task", taskId));
    }

    public void deleteTask(UUID owner, UUID taskId) {
        ownedTask(owner, taskId);
        if (!tasks.delete(taskId)) {
            throw new TaskNotFoundException("Task", taskId);
        }
        logger.info("Task {} deleted by user {}", taskId, owner);
    }

    /**
     * Creates or updates the link between a task and one of the owner's integrations.
     *
     * @param notifyOn policy code; null or blank means {@code always}
     */
    public NotificationLink linkNotification(UUID owner, UUID taskId, UUID integrationId,
                                             String notifyOn, boolean includeResponse) {
        ownedTask(owner, taskId);
        NotifyOn policy = NotifyOn.fromCode(notifyOn);
        Integration integration = links.findIntegration(integrationId)
                .filter(i -> owner.equals(i.userId()))
                .orElseThrow(() -> new TaskNotFoundException("Integration", integrationId));

        NotificationLink link = links.upsert(taskId, integration.id(), policy, includeResponse);
        logger.info("Task {} linked to {} integration {} with policy {}",
                taskId, integration.type().code(), integrationId, policy.code());
        return link;
    }

    /**
     * Newest first. The limit is clamped to [1, {@value #MAX_LOG_LIMIT}].
     */
    public List<ExecutionLog> recentLogs(UUID owner, UUID taskId, Integer limit) {
        ownedTask(owner, taskId);
        int effective = limit == null ? DEFAULT_LOG_LIMIT : Math.max(1, Math.min(limit, MAX_LOG_LIMIT));
        return logs.findRecent(taskId, effective);
    }

    private Task ownedTask(UUID owner, UUID taskId) {
        return tasks.findById(taskId)
                .filter(t -> t.userId().equals(owner))
                .orElseThrow(() -> new TaskNotFoundException("Task", taskId));
    }

    private static String requireHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
                throw new IllegalArgumentException("url must be an absolute http or https URL");
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("url is malformed: " + e.getReason());
        }
        return trimmed;
    }
}
