package org.apipulse.rest;

import com.fasterxml.jackson.databind.JsonNode;
import io.undertow.Undertow;
import org.apipulse.TestFixtures;
import org.apipulse.config.ConfigLoader;
import org.apipulse.config.XmlConfiguration;
import org.apipulse.handlers.HealthCheckHandler;
import org.apipulse.services.ApplicationServices;
import org.apipulse.utils.JsonUtil;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RestApiServerTest {

    private static ApplicationServices services;
    private static Undertow server;
    private static String base;
    private static final HttpClient client = HttpClient.newHttpClient();

    @BeforeAll
    static void start() {
        XmlConfiguration cfg = ConfigLoader.loadConfig("test-config.xml");
        services = ApplicationServices.inMemory(cfg, Clock.systemUTC());
        HealthCheckHandler health = new HealthCheckHandler("TEST", "memory", false, services.schedulerLoop());
        server = RestApiServer.startUndertow(cfg, services, health);
        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        base = "http://127.0.0.1:" + address.getPort() + cfg.server.basePath;
    }

    @AfterAll
    static void stop() {
        server.stop();
        services.close();
    }

    private HttpResponse<String> send(HttpRequest.Builder request) throws IOException, InterruptedException {
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws IOException {
        return JsonUtil.mapper().readTree(response.body());
    }

    @Test
    void healthReportsStore() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/system/health")));

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode data = json(response).path("data");
        assertThat(data.path("store").asText()).isEqualTo("memory");
        assertThat(data.path("database_status").asText()).isEqualTo("not used");
    }

    @Test
    void tickRunsOverPost() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/scheduler/tick"))
                .POST(HttpRequest.BodyPublishers.noBody()));

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).path("message").asText()).isEqualTo("Scheduler executed");
        assertThat(json(response).path("data").has("claimed")).isTrue();
    }

    @Test
    void tickRejectsGet() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/scheduler/tick")));

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(json(response).path("message").asText()).isEqualTo("Only POST requests are allowed");
    }

    @Test
    void taskEndpointsNeedCaller() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/tasks"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{}")));

        assertThat(response.statusCode()).isEqualTo(401);
    }

    @Test
    void taskLifecycleOverHttp() throws Exception {
        String owner = TestFixtures.OWNER.toString();
        HttpResponse<String> created = send(HttpRequest.newBuilder(URI.create(base + "/tasks"))
                .header("Content-Type", "application/json")
                .header("X-User-Id", owner)
                .POST(HttpRequest.BodyPublishers.ofString("""
                        {"task_name": "Orders", "api_url": "https://api.example.com/orders",
                         "schedule_interval": "30m", "method": "GET"}
                        """)));

        assertThat(created.statusCode()).isEqualTo(201);
        JsonNode task = json(created).path("data");
        assertThat(task.path("is_active").asBoolean()).isTrue();
        String id = task.path("id").asText();

        HttpResponse<String> paused = send(HttpRequest.newBuilder(URI.create(base + "/tasks/" + id + "/status"))
                .header("Content-Type", "application/json")
                .header("X-User-Id", owner)
                .method("PATCH", HttpRequest.BodyPublishers.ofString("{\"is_active\": false}")));
        assertThat(paused.statusCode()).isEqualTo(200);
        assertThat(json(paused).path("message").asText()).isEqualTo("Task paused");

        HttpResponse<String> logs = send(HttpRequest.newBuilder(URI.create(base + "/tasks/" + id + "/logs?limit=5"))
                .header("X-User-Id", owner));
        assertThat(logs.statusCode()).isEqualTo(200);
        assertThat(json(logs).path("data").isArray()).isTrue();

        HttpResponse<String> foreign = send(HttpRequest.newBuilder(URI.create(base + "/tasks/" + id))
                .header("X-User-Id", UUID.randomUUID().toString())
                .DELETE());
        assertThat(foreign.statusCode()).isEqualTo(404);

        HttpResponse<String> deleted = send(HttpRequest.newBuilder(URI.create(base + "/tasks/" + id))
                .header("X-User-Id", owner)
                .DELETE());
        assertThat(deleted.statusCode()).isEqualTo(200);
    }

    @Test
    void statusRoutePausesAndResumesOverPatch() throws Exception {
        String owner = TestFixtures.OWNER.toString();
        HttpResponse<String> created = send(HttpRequest.newBuilder(URI.create(base + "/tasks"))
                .header("Content-Type", "application/json")
                .header("X-User-Id", owner)
                .POST(HttpRequest.BodyPublishers.ofString("""
                        {"task_name": "Stock", "api_url": "https://api.example.com/stock", "schedule_interval": "1h"}
                        """)));
        String id = json(created).path("data").path("id").asText();
        URI status = URI.create(base + "/tasks/" + id + "/status");

        HttpResponse<String> paused = send(HttpRequest.newBuilder(status)
                .header("Content-Type", "application/json")
                .header("X-User-Id", owner)
                .method("PATCH", HttpRequest.BodyPublishers.ofString("{\"is_active\": false}")));
        HttpResponse<String> resumed = send(HttpRequest.newBuilder(status)
                .header("Content-Type", "application/json")
                .header("X-User-Id", owner)
                .method("PATCH", HttpRequest.BodyPublishers.ofString("{\"is_active\": true}")));
        HttpResponse<String> wrongMethod = send(HttpRequest.newBuilder(status)
                .header("X-User-Id", owner)
                .PUT(HttpRequest.BodyPublishers.ofString("{\"is_active\": true}")));

        assertThat(paused.statusCode()).isEqualTo(200);
        assertThat(json(paused).path("data").path("is_active").asBoolean()).isFalse();
        assertThat(resumed.statusCode()).isEqualTo(200);
        assertThat(json(resumed).path("message").asText()).isEqualTo("Task resumed");
        assertThat(json(resumed).path("data").path("is_active").asBoolean()).isTrue();
        assertThat(wrongMethod.statusCode()).isEqualTo(405);
    }

    @Test
    void malformedIntervalIsBadRequest() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/tasks"))
                .header("Content-Type", "application/json")
                .header("X-User-Id", TestFixtures.OWNER.toString())
                .POST(HttpRequest.BodyPublishers.ofString("""
                        {"task_name": "Orders", "api_url": "https://api.example.com/orders", "schedule_interval": "10x"}
                        """)));

        assertThat(response.statusCode()).isEqualTo(400);
    }

    @Test
    void preflightFromConfiguredOriginIsAnswered() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/tasks"))
                .header("Origin", "http://localhost:5173")
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody()));

        assertThat(response.statusCode()).isEqualTo(204);
        assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).hasValue("http://localhost:5173");
        assertThat(response.headers().firstValue("Access-Control-Allow-Headers").orElse("")).contains("X-User-Id");
    }

    @Test
    void preflightFromUnknownOriginIsRefused() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/tasks"))
                .header("Origin", "https://evil.example")
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody()));

        assertThat(response.statusCode()).isEqualTo(403);
        assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).isEmpty();
    }
}
