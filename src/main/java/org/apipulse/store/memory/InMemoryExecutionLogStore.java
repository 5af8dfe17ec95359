package org.apipulse.store.memory;

import org.apipulse.model.ExecutionLog;
import org.apipulse.store.ExecutionLogStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryExecutionLogStore implements ExecutionLogStore {

    private final AtomicLong sequence = new AtomicLong();
    private final List<ExecutionLog> logs = new CopyOnWriteArrayList<>();

    @Override
    public ExecutionLog insert(ExecutionLog log) {
        ExecutionLog stored = log.withId(sequence.incrementAndGet());
        logs.add(stored);
        return stored;
    }

    @Override
    public List<ExecutionLog> findRecent(UUID taskId, int limit) {
        return logs.stream()
                .filter(l -> l.taskId().equals(taskId))
                .sorted(Comparator.comparing(ExecutionLog::id).reversed())
                .limit(limit)
                .toList();
    }

    public List<ExecutionLog> all() {
        return new ArrayList<>(logs);
    }

    public void deleteByTask(UUID taskId) {
        logs.removeIf(l -> l.taskId().equals(taskId));
    }
}
