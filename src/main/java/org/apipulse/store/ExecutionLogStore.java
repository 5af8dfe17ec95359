package org.apipulse.store;

import org.apipulse.model.ExecutionLog;

import java.util.List;
import java.util.UUID;

/**
 * Insert-only log rows.
 */
public interface ExecutionLogStore {

    /**
     * @return the stored log with its generated id
     */
    ExecutionLog insert(ExecutionLog log);

    /**
     * Newest first.
     */
    List<ExecutionLog> findRecent(UUID taskId, int limit);
}
