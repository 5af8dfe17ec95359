package org.apipulse.notifications.format;

import com.fasterxml.jackson.databind.JsonNode;
import org.apipulse.TestFixtures;
import org.apipulse.model.HttpMethod;
import org.apipulse.model.Task;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DiscordFormatterTest {

    private static final String HOOK = "https://discord.com/api/webhooks/1/abc";

    private final Task task = TestFixtures.task("https://api.example.com/orders");

    @Test
    void failureEmbedCarriesFieldsAndDisablesMentions() {
        JsonNode payload = DiscordFormatter.format(HOOK, task, TestFixtures.log(task, 503, null), false).payload();
        JsonNode embed = payload.path("embeds").get(0);

        assertThat(embed.path("title").asText()).isEqualTo("❌ API Task Failed: Orders API");
        assertThat(embed.path("color").asInt()).isEqualTo(0xff0000);
        List<String> names = new ArrayList<>();
        embed.path("fields").forEach(f -> names.add(f.path("name").asText()));
        assertThat(names).containsExactly("Task Name", "Status Code", "Response Time", "Method", "Endpoint");
        assertThat(embed.path("fields").get(1).path("value").asText()).isEqualTo("503");
        assertThat(embed.path("fields").get(4).path("value").asText()).isEqualTo("https://api.example.com/orders");
        assertThat(embed.path("footer").path("text").asText()).isEqualTo("API Pulse");
        assertThat(embed.path("timestamp").asText()).isEqualTo("2024-03-10T12:00:00Z");
        assertThat(payload.path("allowed_mentions").path("parse").isArray()).isTrue();
        assertThat(payload.path("allowed_mentions").path("parse").size()).isZero();
    }

    @Test
    void successIsGreen() {
        JsonNode embed = DiscordFormatter.format(HOOK, task, TestFixtures.log(task, 204, null), false)
                .payload().path("embeds").get(0);

        assertThat(embed.path("color").asInt()).isEqualTo(0x36a64f);
    }

    @Test
    void everyoneMentionInTaskNameIsNeutralized() {
        Task noisy = new Task(UUID.randomUUID(), TestFixtures.OWNER, "ping @everyone", "https://a.example.com",
                HttpMethod.GET, Map.of(), null, "5m", true, false, null, TestFixtures.NOW);

        JsonNode embed = DiscordFormatter.format(HOOK, noisy, TestFixtures.log(noisy, 200, null), false)
                .payload().path("embeds").get(0);

        assertThat(embed.toString()).doesNotContain("@everyone");
        assertThat(embed.path("fields").get(0).path("value").asText()).isEqualTo("ping @\u200Beveryone");
    }

    @Test
    void bodyFieldIsCodeBlockWithinFieldLimit() {
        JsonNode embed = DiscordFormatter.format(HOOK, task, TestFixtures.logWithBody(task, 500, "y".repeat(4000)), true)
                .payload().path("embeds").get(0);

        JsonNode body = embed.path("fields").get(5);
        String value = body.path("value").asText();

        assertThat(body.path("name").asText()).isEqualTo("Response Body");
        assertThat(value).startsWith("```\n").endsWith("\n```").contains(ExecutionSummary.TRUNCATION_MARKER);
        assertThat(value.length()).isLessThanOrEqualTo(1024);
    }

    @Test
    void errorFieldPresentForTransportFailure() {
        JsonNode embed = DiscordFormatter.format(HOOK, task, TestFixtures.log(task, null, "Could not resolve host"), false)
                .payload().path("embeds").get(0);

        assertThat(embed.path("fields").get(1).path("value").asText()).isEqualTo("N/A");
        assertThat(embed.path("fields").get(5).path("name").asText()).isEqualTo("Error");
        assertThat(embed.path("fields").get(5).path("value").asText()).isEqualTo("```\nCould not resolve host\n```");
    }
}
