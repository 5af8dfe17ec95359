package org.apipulse.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A user-configured scheduled HTTP request.
 *
 * @param captureResponse whether response headers and body are kept on the execution log
 */
public record Task(
        UUID id,
        UUID userId,
        String name,
        String url,
        HttpMethod method,
        Map<String, String> requestHeaders,
        String requestBody,
        String scheduleInterval,
        boolean active,
        boolean captureResponse,
        Instant lastRunAt,
        Instant nextRunAt
) {

    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(scheduleInterval, "scheduleInterval");
        method = method == null ? HttpMethod.GET : method;
        requestHeaders = requestHeaders == null ? Map.of() : Map.copyOf(requestHeaders);
    }

    public Task withSchedule(Instant lastRunAt, Instant nextRunAt) {
        return new Task(id, userId, name, url, method, requestHeaders, requestBody, scheduleInterval,
                active, captureResponse, lastRunAt, nextRunAt);
    }

    public Task withActive(boolean active, Instant nextRunAt) {
        return new Task(id, userId, name, url, method, requestHeaders, requestBody, scheduleInterval,
                active, captureResponse, lastRunAt, nextRunAt);
    }
}
