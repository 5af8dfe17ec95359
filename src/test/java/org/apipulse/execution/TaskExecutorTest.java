package org.apipulse.execution;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.apipulse.TestFixtures;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.HttpMethod;
import org.apipulse.model.Task;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TaskExecutorTest {

    private MockWebServer server;
    private TaskExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
        executor = new TaskExecutor(client, Duration.ofMillis(800), Set.of("Set-Cookie"),
                Clock.fixed(TestFixtures.NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    @Test
    void serverErrorIsACompletedExchangeWithoutErrorMessage() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        ExecutionLog log = executor.execute(TestFixtures.task(url("/orders")));

        assertThat(log.statusCode()).isEqualTo(500);
        assertThat(log.errorMessage()).isNull();
        assertThat(log.isSuccess()).isFalse();
        assertThat(log.executedAt()).isEqualTo(TestFixtures.NOW);
        assertThat(log.responseTimeMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void responseIsNotCapturedUnlessRequested() {
        server.enqueue(new MockResponse().setBody("{\"ok\":true}").addHeader("X-Trace", "abc"));

        ExecutionLog log = executor.execute(TestFixtures.task(url("/orders")));

        assertThat(log.statusCode()).isEqualTo(200);
        assertThat(log.responseBody()).isNull();
        assertThat(log.responseHeaders()).isNull();
    }

    @Test
    void capturesBodyAndHeadersWithRedaction() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setResponseCode(201)
                .setBody("{\"id\":42}")
                .addHeader("X-Trace", "abc")
                .addHeader("Set-Cookie", "session=secret"));

        Task task = TestFixtures.capturingPost(url("/orders"), "{\"sku\":\"A-1\"}");
        ExecutionLog log = executor.execute(task);

        assertThat(log.statusCode()).isEqualTo(201);
        assertThat(log.responseBody()).isEqualTo("{\"id\":42}");
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(log.responseHeaders());
        assertThat(headers.get("x-trace")).isEqualTo("abc");
        assertThat(headers.get("set-cookie")).isEqualTo(TaskExecutor.REDACTED);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"sku\":\"A-1\"}");
    }

    @Test
    void explicitContentTypeIsKept() throws InterruptedException {
        server.enqueue(new MockResponse());
        Task task = new Task(UUID.randomUUID(), TestFixtures.OWNER, "Form", url("/form"), HttpMethod.POST,
                Map.of("Content-Type", "application/x-www-form-urlencoded", "Authorization", "Bearer t"),
                "a=1", "1h", true, false, null, TestFixtures.NOW);

        executor.execute(task);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("Content-Type")).isEqualTo("application/x-www-form-urlencoded");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer t");
    }

    @Test
    void getSendsNoBody() throws InterruptedException {
        server.enqueue(new MockResponse());

        executor.execute(TestFixtures.task(url("/health")));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getBodySize()).isZero();
        assertThat(request.getHeader("Content-Type")).isNull();
    }

    @Test
    void unreachableEndpointBecomesFailedLog() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        ExecutionLog log = executor.execute(TestFixtures.task("http://127.0.0.1:" + closedPort + "/down"));

        assertThat(log.statusCode()).isNull();
        assertThat(log.responseBody()).isNull();
        assertThat(log.errorMessage()).isNotBlank();
    }

    @Test
    void slowEndpointHitsTheRequestTimeout() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(3, TimeUnit.SECONDS));

        ExecutionLog log = executor.execute(TestFixtures.task(url("/slow")));

        assertThat(log.statusCode()).isNull();
        assertThat(log.errorMessage()).isEqualTo("Request timed out");
        assertThat(log.responseTimeMs()).isLessThan(3000);
    }

    @Test
    void tricklingBodyIsCutOffByTheRequestTimeout() {
        server.enqueue(new MockResponse().setBody("12345678").throttleBody(1, 500, TimeUnit.MILLISECONDS));

        long started = System.nanoTime();
        ExecutionLog log = executor.execute(TestFixtures.capturingPost(url("/trickle"), "{}"));
        long wallMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertThat(log.statusCode()).isNull();
        assertThat(log.errorMessage()).isEqualTo("Request timed out");
        assertThat(wallMillis).isLessThan(2500);
    }

    @Test
    void uncapturedTricklingBodyIsAlsoBounded() {
        server.enqueue(new MockResponse().setBody("12345678").throttleBody(1, 500, TimeUnit.MILLISECONDS));

        ExecutionLog log = executor.execute(TestFixtures.task(url("/trickle")));

        assertThat(log.errorMessage()).isEqualTo("Request timed out");
        assertThat(log.responseTimeMs()).isLessThan(2500);
    }

    @Test
    void droppedConnectionBecomesFailedLog() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        ExecutionLog log = executor.execute(TestFixtures.task(url("/drop")));

        assertThat(log.statusCode()).isNull();
        assertThat(log.errorMessage()).isNotBlank();
    }

    @Test
    void malformedUrlBecomesFailedLog() {
        ExecutionLog log = executor.execute(TestFixtures.task("http://exa mple.com/"));

        assertThat(log.statusCode()).isNull();
        assertThat(log.errorMessage()).isNotBlank();
    }
}
