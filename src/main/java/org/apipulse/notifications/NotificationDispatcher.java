package org.apipulse.notifications;

import org.apipulse.config.utils.LogContext;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.Task;
import org.apipulse.store.NotificationLinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Fans an execution result out to every notification link of the task whose policy matches.
 * <p>
 * Sends run concurrently on the notification executor and are all awaited. A failing channel
 * is logged and reported in its {@link DeliveryOutcome}; it never affects its siblings and
 * nothing is thrown to the caller.
 */
public class NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationLinkStore links;
    private final NotificationSender sender;
    private final ExecutorService executor;
    private final boolean enabled;

    public NotificationDispatcher(NotificationLinkStore links, NotificationSender sender, ExecutorService executor) {
        this(links, sender, executor, true);
    }

    /**
     * @param enabled false turns every dispatch into a no-op, links are not even loaded
     */
    public NotificationDispatcher(NotificationLinkStore links, NotificationSender sender, ExecutorService executor,
                                  boolean enabled) {
        this.links = links;
        this.sender = sender;
        this.executor = executor;
        this.enabled = enabled;
    }

    public List<DeliveryOutcome> dispatch(Task task, ExecutionLog log) {
        if (!enabled) {
            logger.debug("Notifications disabled, nothing sent for task {}", task.id());
            return List.of();
        }
        List<NotificationLink> matching;
        try {
            matching = links.findByTask(task.id()).stream()
                    .filter(link -> link.appliesTo(log))
                    .toList();
        } catch (RuntimeException e) {
            logger.error("Could not load notification links for task {}: {}", task.id(), e.getMessage(), e);
            return List.of();
        }

        if (matching.isEmpty()) {
            logger.debug("No notification links match execution of task {}", task.id());
            return List.of();
        }

        String traceId = LogContext.getTraceId();
        List<CompletableFuture<DeliveryOutcome>> futures = new ArrayList<>(matching.size());
        for (NotificationLink link : matching) {
            CompletableFuture<DeliveryOutcome> future;
            try {
                future = CompletableFuture.supplyAsync(() -> deliver(link, task, log, traceId), executor);
            } catch (RuntimeException e) {
                // executor rejected the job, usually during shutdown
                future = CompletableFuture.completedFuture(failure(link, "Delivery not scheduled: " + e.getMessage()));
            }
            futures.add(future);
        }

        List<DeliveryOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).join());
            } catch (CompletionException e) {
                outcomes.add(failure(matching.get(i), String.valueOf(e.getCause())));
            }
        }

        long delivered = outcomes.stream().filter(DeliveryOutcome::delivered).count();
        logger.info("Task {} notifications: {} delivered, {} failed", task.id(), delivered, outcomes.size() - delivered);
        return outcomes;
    }

    private DeliveryOutcome deliver(NotificationLink link, Task task, ExecutionLog log, String traceId) {
        LogContext.start("notification-" + link.integration().type().code(), traceId);
        try {
            sender.send(link, task, log);
            return DeliveryOutcome.delivered(link.integration().id(), link.integration().type());
        } catch (ChannelDeliveryException e) {
            logger.error("{} delivery to integration '{}' failed for task {}: {}",
                    link.integration().type().code(), link.integration().name(), task.id(), e.getMessage(), e);
            return failure(link, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error delivering {} notification for task {}",
                    link.integration().type().code(), task.id(), e);
            return failure(link, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            LogContext.clear();
        }
    }

    private static DeliveryOutcome failure(NotificationLink link, String error) {
        return DeliveryOutcome.failed(link.integration().id(), link.integration().type(), error);
    }
}
