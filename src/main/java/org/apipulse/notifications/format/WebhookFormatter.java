package org.apipulse.notifications.format;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Task;

/**
 * Flat JSON for generic webhooks. Nothing is truncated.
 */
public final class WebhookFormatter {

    private WebhookFormatter() {}

    public static WebhookMessage format(String webhookUrl, Task task, ExecutionLog log, boolean includeResponse) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("task_id", task.id().toString());
        payload.put("task_name", task.name());
        payload.put("api_url", task.url());
        payload.put("method", task.method().name());
        payload.put("status_code", log.statusCode());
        payload.put("success", log.isSuccess());
        payload.put("response_time_ms", log.responseTimeMs());
        payload.put("error_message", log.errorMessage());
        payload.put("executed_at", log.executedAt().toString());

        String body = ExecutionSummary.attachableBody(log, includeResponse);
        if (body != null) {
            payload.put("response_body", body);
        }
        return new WebhookMessage(webhookUrl, payload);
    }
}
