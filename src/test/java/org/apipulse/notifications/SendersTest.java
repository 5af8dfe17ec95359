package org.apipulse.notifications;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apipulse.TestFixtures;
import org.apipulse.config.XmlConfiguration;
import org.apipulse.model.Integration;
import org.apipulse.model.IntegrationType;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.NotifyOn;
import org.apipulse.model.Task;
import org.apipulse.notifications.discord.DiscordSender;
import org.apipulse.notifications.email.EmailSender;
import org.apipulse.notifications.format.EmailFormatter;
import org.apipulse.notifications.slack.SlackSender;
import org.apipulse.notifications.webhook.WebhookSender;
import org.apipulse.utils.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SendersTest {

    private MockWebServer server;
    private JsonPostClient client;

    private final Task task = TestFixtures.task("https://api.example.com/orders");

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = JsonPostClient.create(2);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private NotificationLink hookLink(IntegrationType type) {
        return TestFixtures.link(task,
                TestFixtures.integration(type, Integration.WEBHOOK_URL, server.url("/hook").toString()),
                NotifyOn.ALWAYS, false);
    }

    private JsonNode bodyOf(RecordedRequest request) throws IOException {
        return JsonUtil.mapper().readTree(request.getBody().readUtf8());
    }

    @Test
    void slackPostsJsonToWebhook() throws Exception {
        server.enqueue(new MockResponse().setBody("ok"));

        new SlackSender(client).send(hookLink(IntegrationType.SLACK), task, TestFixtures.log(task, 200, null));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/hook");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(bodyOf(request).path("attachments").isArray()).isTrue();
    }

    @Test
    void nonSuccessAnswerIsADeliveryFailure() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("no_service"));

        assertThatThrownBy(() -> new DiscordSender(client)
                .send(hookLink(IntegrationType.DISCORD), task, TestFixtures.log(task, 500, null)))
                .isInstanceOf(ChannelDeliveryException.class)
                .hasMessage("Endpoint answered HTTP 404: no_service")
                .satisfies(e -> assertThat(((ChannelDeliveryException) e).channel()).isEqualTo(IntegrationType.DISCORD));
    }

    @Test
    void missingWebhookUrlFailsWithoutRequest() {
        NotificationLink link = TestFixtures.link(task,
                new Integration(UUID.randomUUID(), TestFixtures.OWNER, IntegrationType.SLACK, "empty", Map.of(), true),
                NotifyOn.ALWAYS, false);

        assertThatThrownBy(() -> new SlackSender(client).send(link, task, TestFixtures.log(task, 200, null)))
                .isInstanceOf(ChannelDeliveryException.class)
                .hasMessageContaining("webhook_url");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void webhookCarriesEventHeader() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        new WebhookSender(client).send(hookLink(IntegrationType.WEBHOOK), task, TestFixtures.log(task, null, "boom"));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader(WebhookSender.EVENT_HEADER)).isEqualTo("task.failed");
        assertThat(bodyOf(request).path("error_message").asText()).isEqualTo("boom");
    }

    @Test
    void emailGoesToApiWithBearerKey() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"id\":\"em_1\"}"));
        XmlConfiguration.Notification.Email cfg = new XmlConfiguration.Notification.Email();
        cfg.apiUrl = server.url("/emails").toString();
        cfg.apiKey = "re_test";
        cfg.fromAddress = "alerts@apipulse.dev";
        cfg.fromName = "API Pulse";
        NotificationLink link = TestFixtures.link(task,
                TestFixtures.integration(IntegrationType.EMAIL, Integration.EMAIL, "ops@example.com"),
                NotifyOn.ALWAYS, false);

        new EmailSender(cfg, new EmailFormatter(new TemplateLoader()), client)
                .send(link, task, TestFixtures.log(task, 500, null));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        JsonNode body = bodyOf(request);
        assertThat(request.getPath()).isEqualTo("/emails");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer re_test");
        assertThat(body.path("from").asText()).isEqualTo("API Pulse <alerts@apipulse.dev>");
        assertThat(body.path("to").get(0).asText()).isEqualTo("ops@example.com");
        assertThat(body.path("subject").asText()).isEqualTo("❌ API Task Failed: Orders API");
        assertThat(body.path("html").asText()).contains("Orders API");
    }

    @Test
    void emailWithoutApiKeyFails() {
        XmlConfiguration.Notification.Email cfg = new XmlConfiguration.Notification.Email();
        cfg.apiUrl = server.url("/emails").toString();
        NotificationLink link = TestFixtures.link(task,
                TestFixtures.integration(IntegrationType.EMAIL, Integration.EMAIL, "ops@example.com"),
                NotifyOn.ALWAYS, false);

        assertThatThrownBy(() -> new EmailSender(cfg, new EmailFormatter(new TemplateLoader()), client)
                .send(link, task, TestFixtures.log(task, 500, null)))
                .isInstanceOf(ChannelDeliveryException.class)
                .hasMessageContaining("API key");
    }
}
