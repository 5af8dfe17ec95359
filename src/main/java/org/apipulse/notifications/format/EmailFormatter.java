package org.apipulse.notifications.format;

import org.apipulse.model.ExecutionLog;
import org.apipulse.model.Task;
import org.apipulse.notifications.TemplateLoader;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders the HTML email for an execution from {@code task-success.html} or {@code task-failure.html}.
 * All values go through Mustache's HTML escaping.
 */
public class EmailFormatter {

    static final String SUCCESS_TEMPLATE = "task-success.html";
    static final String FAILURE_TEMPLATE = "task-failure.html";

    private final TemplateLoader templates;

    public EmailFormatter(TemplateLoader templates) {
        this.templates = templates;
    }

    public EmailContent format(String recipient, Task task, ExecutionLog log, boolean includeResponse) {
        Map<String, Object> data = new HashMap<>();
        data.put("title", ExecutionSummary.title(task, log));
        data.put("taskName", task.name());
        data.put("url", task.url());
        data.put("method", task.method().name());
        data.put("statusCode", ExecutionSummary.statusText(log));
        data.put("responseTime", ExecutionSummary.responseTime(log));
        data.put("executedAt", log.executedAt().toString());
        data.put("errorMessage", log.errorMessage());
        data.put("responseBody", ExecutionSummary.attachableBody(log, includeResponse));
        data.put("productName", ExecutionSummary.PRODUCT_NAME);

        String template = log.isSuccess() ? SUCCESS_TEMPLATE : FAILURE_TEMPLATE;
        String html = templates.render(template, data);
        return new EmailContent(recipient, ExecutionSummary.title(task, log), html);
    }
}
