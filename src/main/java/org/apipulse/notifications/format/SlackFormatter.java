package org.apipulse.notifications.format;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Task;

import java.time.Instant;

/**
 * Builds a Slack incoming-webhook payload: one coloured attachment carrying Block Kit blocks.
 */
public final class SlackFormatter {

    public static final int BODY_LIMIT = 2000;
    static final int HEADER_LIMIT = 140;
    public static final String BODY_MARKER = "\n\n" + ExecutionSummary.TRUNCATION_MARKER;

    static final String COLOR_SUCCESS = "#36a64f";
    static final String COLOR_FAILURE = "#ff0000";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SlackFormatter() {}

    public static WebhookMessage format(String webhookUrl, Task task, ExecutionLog log, boolean includeResponse) {
        ArrayNode blocks = NODES.arrayNode();

        ObjectNode header = blocks.addObject().put("type", "header");
        header.putObject("text")
                .put("type", "plain_text")
                .put("text", ExecutionSummary.truncate(ExecutionSummary.title(task, log), HEADER_LIMIT, "..."))
                .put("emoji", true);

        ObjectNode fieldsSection = blocks.addObject().put("type", "section");
        ArrayNode fields = fieldsSection.putArray("fields");
        field(fields, "Task Name", escape(task.name()));
        field(fields, "Status Code", ExecutionSummary.statusText(log));
        field(fields, "Response Time", ExecutionSummary.responseTime(log));
        field(fields, "Method", task.method().name());

        section(blocks, "*Endpoint:*\n`" + fitted(task.url().replace("`", "'"), "...") + "`");

        if (log.errorMessage() != null) {
            section(blocks, "*Error:*\n```" + fitted(log.errorMessage(), BODY_MARKER) + "```");
        }

        String body = ExecutionSummary.attachableBody(log, includeResponse);
        if (body != null) {
            section(blocks, "*Response Body:*\n```" + fitted(ExecutionSummary.prettyJson(body), BODY_MARKER) + "```");
        }

        ObjectNode context = blocks.addObject().put("type", "context");
        context.putArray("elements").addObject()
                .put("type", "mrkdwn")
                .put("text", "Executed at: " + dateToken(log.executedAt()));

        ObjectNode payload = NODES.objectNode();
        ObjectNode attachment = payload.putArray("attachments").addObject();
        attachment.put("color", log.isSuccess() ? COLOR_SUCCESS : COLOR_FAILURE);
        attachment.set("blocks", blocks);
        return new WebhookMessage(webhookUrl, payload);
    }

    /**
     * Slack control characters in mrkdwn text.
     */
    static String escape(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    /**
     * Escaped text that cannot close the surrounding code fence.
     */
    static String code(String text) {
        return escape(text).replace("```", "`\u200B`\u200B`");
    }

    /**
     * Code-safe text of at most {@link #BODY_LIMIT} characters after escaping, plus the marker when cut.
     * The cut never splits an entity, a surrogate pair or a neutralized fence.
     */
    static String fitted(String text, String marker) {
        String escaped = code(text);
        if (escaped.length() <= BODY_LIMIT) return escaped;

        int end = BODY_LIMIT;
        if (Character.isHighSurrogate(escaped.charAt(end - 1))) end--;
        int amp = escaped.lastIndexOf('&', end - 1);
        if (amp >= 0 && escaped.indexOf(';', amp) >= end) end = amp;
        while (end > 0 && (escaped.charAt(end - 1) == '`' || escaped.charAt(end - 1) == '\u200B')) end--;
        return escaped.substring(0, end) + code(marker);
    }

    static String dateToken(Instant executedAt) {
        return "<!date^" + executedAt.getEpochSecond() + "^{date_short_pretty} at {time}|" + executedAt + ">";
    }

    private static void field(ArrayNode fields, String label, String value) {
        fields.addObject()
                .put("type", "mrkdwn")
                .put("text", "*" + label + ":*\n" + value);
    }

    private static void section(ArrayNode blocks, String markdown) {
        blocks.addObject().put("type", "section")
                .putObject("text")
                .put("type", "mrkdwn")
                .put("text", markdown);
    }
}
