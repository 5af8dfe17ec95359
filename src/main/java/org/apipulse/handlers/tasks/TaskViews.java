package org.apipulse.handlers.tasks;

import org.apipulse.model.ExecutionLog;
import org.apipulse.model.NotificationLink;
import org.apipulse.model.Task;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shapes of the task resources, in the column naming the dashboard uses.
 */
final class TaskViews {

    private TaskViews() {}

    static Map<String, Object> task(Task task) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", task.id());
        view.put("task_name", task.name());
        view.put("api_url", task.url());
        view.put("method", task.method().name());
        view.put("request_headers", task.requestHeaders());
        view.put("request_body", task.requestBody());
        view.put("schedule_interval", task.scheduleInterval());
        view.put("is_active", task.active());
        view.put("capture_response", task.captureResponse());
        view.put("last_run_at", task.lastRunAt());
        view.put("next_run_at", task.nextRunAt());
        return view;
    }

    static Map<String, Object> log(ExecutionLog log) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", log.id());
        view.put("task_id", log.taskId());
        view.put("status_code", log.statusCode());
        view.put("success", log.isSuccess());
        view.put("response_time_ms", log.responseTimeMs());
        view.put("error_message", log.errorMessage());
        view.put("response_headers", log.responseHeaders());
        view.put("response_body", log.responseBody());
        view.put("executed_at", log.executedAt());
        return view;
    }

    static Map<String, Object> link(NotificationLink link) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", link.id());
        view.put("task_id", link.taskId());
        view.put("integration_id", link.integration().id());
        view.put("integration_type", link.integration().type().code());
        view.put("notify_on", link.notifyOn().code());
        view.put("include_response", link.includeResponse());
        return view;
    }
}
