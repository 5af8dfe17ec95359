package org.apipulse.execution;

import org.apipulse.config.XmlConfiguration;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.HttpMethod;
import org.apipulse.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Performs the HTTP request of one task and condenses the outcome into an {@link ExecutionLog}.
 * Never throws for transport failures: they become failed logs with a null status code.
 * The request timeout bounds the whole exchange. No retries are attempted.
 */
public class TaskExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TaskExecutor.class);

    static final String REDACTED = "[REDACTED]";

    private final HttpClient client;
    private final Duration requestTimeout;
    private final Set<String> redactedHeaders;
    private final Clock clock;

    public TaskExecutor(HttpClient client, Duration requestTimeout, Set<String> redactedHeaders, Clock clock) {
        this.client = client;
        this.requestTimeout = requestTimeout;
        this.redactedHeaders = redactedHeaders.stream()
                .map(h -> h.trim().toLowerCase(Locale.ROOT))
                .filter(h -> !h.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.clock = clock;
    }

    public static TaskExecutor fromConfig(XmlConfiguration.Execution cfg, Clock clock) {
        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(cfg.connectTimeoutSeconds))
                .followRedirects(cfg.followRedirects ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .build();
        Set<String> redacted = cfg.redactedHeaders == null ? Set.of()
                : Arrays.stream(cfg.redactedHeaders.split(",")).collect(Collectors.toSet());
        return new TaskExecutor(client, Duration.ofSeconds(cfg.requestTimeoutSeconds), redacted, clock);
    }

    public ExecutionLog execute(Task task) {
        Instant executedAt = clock.instant();
        long start = System.nanoTime();
        try {
            HttpRequest request = buildRequest(task);
            HttpResponse<?> response = exchange(request, task.captureResponse());
            long elapsed = elapsedMillis(start);

            Map<String, String> headers = null;
            String body = null;
            if (task.captureResponse()) {
                headers = flatten(response.headers());
                body = (String) response.body();
            }
            logger.info("Task '{}' ({}) {} {} -> {} in {}ms",
                    task.name(), task.id(), task.method(), task.url(), response.statusCode(), elapsed);
            return ExecutionLog.completed(task, response.statusCode(), headers, body, elapsed, executedAt);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Task '{}' ({}) interrupted while executing", task.name(), task.id());
            return ExecutionLog.failed(task, "Execution interrupted", elapsedMillis(start), executedAt);
        } catch (IOException | IllegalArgumentException e) {
            String error = TransportErrors.describe(e);
            logger.warn("Task '{}' ({}) {} {} failed: {}", task.name(), task.id(), task.method(), task.url(), error);
            return ExecutionLog.failed(task, error, elapsedMillis(start), executedAt);
        }
    }

    /**
     * Sends the request and waits at most {@code requestTimeout} for the whole exchange, body included.
     * An uncaptured body is read and dropped instead of being buffered.
     */
    private HttpResponse<?> exchange(HttpRequest request, boolean capture) throws IOException, InterruptedException {
        CompletableFuture<? extends HttpResponse<?>> future;
        if (capture) {
            future = client.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } else {
            future = client.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        }

        try {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HttpTimeoutException("request timed out after " + requestTimeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) throw (IOException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IOException(cause);
        }
    }

    HttpRequest buildRequest(Task task) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(task.url()))
                .timeout(requestTimeout);

        boolean hasContentType = false;
        for (Map.Entry<String, String> header : task.requestHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
            if ("content-type".equalsIgnoreCase(header.getKey())) hasContentType = true;
        }

        if (task.method() == HttpMethod.POST) {
            String body = task.requestBody();
            if (body != null && !body.isEmpty()) {
                if (!hasContentType) builder.header("Content-Type", "application/json");
                builder.POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
            } else {
                builder.POST(HttpRequest.BodyPublishers.noBody());
            }
        } else {
            builder.GET();
        }
        return builder.build();
    }

    Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : headers.map().entrySet()) {
            String name = entry.getKey();
            if (name.startsWith(":")) continue; // HTTP/2 pseudo headers
            String value = redactedHeaders.contains(name.toLowerCase(Locale.ROOT))
                    ? REDACTED
                    : String.join(", ", entry.getValue());
            flat.put(name, value);
        }
        return flat;
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
