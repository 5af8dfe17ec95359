package org.apipulse.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of one task execution.
 * <p>
 * {@code statusCode} is null when the exchange never completed (DNS, refused connection,
 * timeout, TLS); in that case {@code errorMessage} carries the cause.
 */
public record ExecutionLog(
        Long id,
        UUID taskId,
        UUID userId,
        Integer statusCode,
        Map<String, String> responseHeaders,
        String responseBody,
        long responseTimeMs,
        String errorMessage,
        Instant executedAt
) {

    public ExecutionLog {
        responseHeaders = responseHeaders == null ? null : Map.copyOf(responseHeaders);
    }

    public static ExecutionLog completed(Task task, int statusCode, Map<String, String> headers,
                                         String body, long responseTimeMs, Instant executedAt) {
        return new ExecutionLog(null, task.id(), task.userId(), statusCode, headers, body,
                responseTimeMs, null, executedAt);
    }

    public static ExecutionLog failed(Task task, String errorMessage, long responseTimeMs, Instant executedAt) {
        return new ExecutionLog(null, task.id(), task.userId(), null, null, null,
                responseTimeMs, errorMessage, executedAt);
    }

    /**
     * Success means a status code in [200, 400). Everything else, a missing code included, is a failure.
     */
    public boolean isSuccess() {
        return statusCode != null && statusCode >= 200 && statusCode < 400;
    }

    public ExecutionLog withId(Long newId) {
        return new ExecutionLog(newId, taskId, userId, statusCode, responseHeaders, responseBody,
                responseTimeMs, errorMessage, executedAt);
    }
}
