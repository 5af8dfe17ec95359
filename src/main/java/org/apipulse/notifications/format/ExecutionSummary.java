package org.apipulse.notifications.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Task;
import org.apipulse.utils.JsonUtil;

/**
 * Wording and helpers shared by all channel formatters, so every channel
 * classifies and titles an execution the same way.
 */
public final class ExecutionSummary {

    public static final String TRUNCATION_MARKER = "... (truncated)";
    public static final String PRODUCT_NAME = "API Pulse";

    private ExecutionSummary() {}

    public static String emoji(ExecutionLog log) {
        return log.isSuccess() ? "✅" : "❌";
    }

    public static String title(Task task, ExecutionLog log) {
        return emoji(log) + " API Task " + (log.isSuccess() ? "Success" : "Failed") + ": " + task.name();
    }

    public static String statusText(ExecutionLog log) {
        return log.statusCode() == null ? "N/A" : String.valueOf(log.statusCode());
    }

    public static String responseTime(ExecutionLog log) {
        return log.responseTimeMs() + "ms";
    }

    /**
     * The body to attach, or null when the link does not ask for it or nothing was captured.
     */
    public static String attachableBody(ExecutionLog log, boolean includeResponse) {
        if (!includeResponse) return null;
        String body = log.responseBody();
        return body == null || body.isEmpty() ? null : body;
    }

    /**
     * Re-indents the text when it parses as a JSON object or array; anything else is returned as is.
     */
    public static String prettyJson(String text) {
        String trimmed = text.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) return text;
        try {
            JsonNode node = JsonUtil.mapper().readTree(trimmed);
            return JsonUtil.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return text;
        }
    }

    /**
     * Keeps the first {@code limit} characters and appends {@code marker} when the text is longer.
     */
    public static String truncate(String text, int limit, String marker) {
        if (text == null || text.length() <= limit) return text;
        int end = limit;
        // avoid splitting a surrogate pair
        if (Character.isHighSurrogate(text.charAt(end - 1))) end--;
        return text.substring(0, end) + marker;
    }
}
