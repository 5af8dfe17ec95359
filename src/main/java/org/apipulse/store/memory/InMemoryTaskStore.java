package org.apipulse.store.memory;

import org.apipulse.model.Task;
import org.apipulse.store.TaskStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Task store for running without PostgreSQL. Claims are a compare-and-swap per row.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentMap<UUID, Task> tasks = new ConcurrentHashMap<>();
    private final List<DeleteListener> deleteListeners = new CopyOnWriteArrayList<>();

    /**
     * Registers cleanup for rows owned by a task, such as logs and links held by sibling stores.
     */
    public void onDelete(DeleteListener listener) {
        deleteListeners.add(listener);
    }

    @Override
    public List<Task> claimDueTasks(Instant now, Instant leaseUntil, int limit) {
        List<Task> due = tasks.values().stream()
                .filter(t -> isDue(t, now))
                .sorted(Comparator.comparing(Task::nextRunAt))
                .toList();

        List<Task> claimed = new ArrayList<>();
        for (Task candidate : due) {
            if (claimed.size() >= limit) break;
            Task leased = candidate.withSchedule(candidate.lastRunAt(), leaseUntil);
            // only the caller whose expected row is still current wins
            if (tasks.replace(candidate.id(), candidate, leased)) {
                claimed.add(candidate);
            }
        }
        return claimed;
    }

    private static boolean isDue(Task t, Instant now) {
        return t.active() && t.nextRunAt() != null && !t.nextRunAt().isAfter(now);
    }

    @Override
    public void recordRun(UUID taskId, Instant lastRunAt, Instant nextRunAt) {
        tasks.computeIfPresent(taskId, (id, t) -> t.withSchedule(lastRunAt, nextRunAt));
    }

    @Override
    public Task insert(Task task) {
        tasks.put(task.id(), task);
        return task;
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public boolean pause(UUID taskId) {
        return tasks.computeIfPresent(taskId, (id, t) -> t.withActive(false, t.nextRunAt())) != null;
    }

    @Override
    public boolean resume(UUID taskId, Instant nextRunAt) {
        while (true) {
            Task current = tasks.get(taskId);
            if (current == null || current.active()) return false;
            Instant next = current.nextRunAt() != null && current.nextRunAt().isAfter(nextRunAt)
                    ? current.nextRunAt() : nextRunAt;
            if (tasks.replace(taskId, current, current.withActive(true, next))) return true;
        }
    }

    @Override
    public boolean delete(UUID taskId) {
        boolean removed = tasks.remove(taskId) != null;
        if (removed) deleteListeners.forEach(l -> l.taskDeleted(taskId));
        return removed;
    }

    @FunctionalInterface
    public interface DeleteListener {
        void taskDeleted(UUID taskId);
    }
}
