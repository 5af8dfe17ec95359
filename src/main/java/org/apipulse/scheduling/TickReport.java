package org.apipulse.scheduling;

import java.time.Instant;

/**
 * Summary of one scheduler tick.
 *
 * @param claimed   tasks claimed from the store
 * @param succeeded runs whose log classifies as success
 * @param failed    runs whose log classifies as failure
 * @param cancelled runs cut off by the tick deadline while executing; a failed log was still written
 * @param deferred  runs that never started before the deadline and were handed back to the store
 */
public record TickReport(
        int claimed,
        int succeeded,
        int failed,
        int cancelled,
        int deferred,
        Instant startedAt,
        Instant finishedAt
) {

    public static TickReport empty(Instant startedAt, Instant finishedAt) {
        return new TickReport(0, 0, 0, 0, 0, startedAt, finishedAt);
    }
}
