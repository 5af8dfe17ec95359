package org.apipulse.store;

import org.apipulse.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of tasks. {@code next_run_at} is the only field contended by concurrent schedulers.
 */
public interface TaskStore {

    /**
     * Atomically selects active tasks due at {@code now} and moves their {@code next_run_at}
     * to {@code leaseUntil}. A task returned to one caller cannot be returned to a concurrent
     * caller until the lease expires or {@link #recordRun} moves it again.
     *
     * @return the claimed tasks as they were before the lease was applied
     */
    List<Task> claimDueTasks(Instant now, Instant leaseUntil, int limit);

    /**
     * Stores the outcome timestamps of an execution.
     */
    void recordRun(UUID taskId, Instant lastRunAt, Instant nextRunAt);

    Task insert(Task task);

    Optional<Task> findById(UUID taskId);

    /**
     * Marks the task inactive. {@code next_run_at} is left alone so a running claim keeps its lease.
     *
     * @return false when no such task exists
     */
    boolean pause(UUID taskId);

    /**
     * Reactivates a paused task. {@code next_run_at} becomes the later of {@code nextRunAt} and the
     * stored value, so an outstanding claim lease is never pulled forward.
     *
     * @return false when no such task exists or the task is already active
     */
    boolean resume(UUID taskId, Instant nextRunAt);

    /**
     * Deletes the task together with its execution logs and notification links.
     *
     * @return false when no such task exists
     */
    boolean delete(UUID taskId);
}
