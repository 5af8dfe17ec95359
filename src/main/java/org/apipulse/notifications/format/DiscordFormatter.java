package org.apipulse.notifications.format;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Task;

/**
 * Builds a Discord webhook payload with a single embed. Mentions are never parsed.
 */
public final class DiscordFormatter {

    public static final int FIELD_LIMIT = 1000;

    static final int COLOR_SUCCESS = 0x36a64f;
    static final int COLOR_FAILURE = 0xff0000;

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private DiscordFormatter() {}

    public static WebhookMessage format(String webhookUrl, Task task, ExecutionLog log, boolean includeResponse) {
        ObjectNode embed = NODES.objectNode();
        embed.put("title", ExecutionSummary.truncate(neutralize(ExecutionSummary.title(task, log)), 250, "..."));
        embed.put("color", log.isSuccess() ? COLOR_SUCCESS : COLOR_FAILURE);

        ArrayNode fields = embed.putArray("fields");
        field(fields, "Task Name", neutralize(task.name()), true);
        field(fields, "Status Code", ExecutionSummary.statusText(log), true);
        field(fields, "Response Time", ExecutionSummary.responseTime(log), true);
        field(fields, "Method", task.method().name(), true);
        field(fields, "Endpoint", task.url(), false);

        if (log.errorMessage() != null) {
            field(fields, "Error", codeBlock(log.errorMessage()), false);
        }

        String body = ExecutionSummary.attachableBody(log, includeResponse);
        if (body != null) {
            field(fields, "Response Body", codeBlock(ExecutionSummary.prettyJson(body)), false);
        }

        embed.putObject("footer").put("text", ExecutionSummary.PRODUCT_NAME);
        embed.put("timestamp", log.executedAt().toString());

        ObjectNode payload = NODES.objectNode();
        payload.putArray("embeds").add(embed);
        payload.putObject("allowed_mentions").putArray("parse");
        return new WebhookMessage(webhookUrl, payload);
    }

    /**
     * Breaks {@code @everyone}, {@code @here} and user pings with a zero-width space.
     */
    static String neutralize(String text) {
        if (text == null) return "";
        return text.replace("@", "@\u200B");
    }

    private static String codeBlock(String text) {
        String inner = neutralize(text).replace("```", "`\u200B`\u200B`");
        return "```\n" + ExecutionSummary.truncate(inner, FIELD_LIMIT, ExecutionSummary.TRUNCATION_MARKER) + "\n```";
    }

    private static void field(ArrayNode fields, String name, String value, boolean inline) {
        String shown = value.startsWith("```") ? value
                : ExecutionSummary.truncate(value, FIELD_LIMIT, ExecutionSummary.TRUNCATION_MARKER);
        fields.addObject()
                .put("name", name)
                .put("value", shown.isEmpty() ? "-" : shown)
                .put("inline", inline);
    }
}
