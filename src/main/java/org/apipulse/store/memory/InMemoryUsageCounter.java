package org.apipulse.store.memory;

import org.apipulse.store.UsageCounter;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run counts per user and calendar month.
 */
public class InMemoryUsageCounter implements UsageCounter {

    private final Clock clock;
    private final Map<String, Long> counts = new ConcurrentHashMap<>();

    public InMemoryUsageCounter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void increment(UUID userId) {
        counts.merge(key(userId, YearMonth.now(clock)), 1L, Long::sum);
    }

    public long runs(UUID userId, YearMonth month) {
        return counts.getOrDefault(key(userId, month), 0L);
    }

    private static String key(UUID userId, YearMonth month) {
        return userId + "@" + month;
    }
}
