package org.apipulse.handlers.tasks;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.apipulse.model.Task;
import org.apipulse.services.TaskService;
import org.apipulse.utils.HttpRequestUtil;
import org.apipulse.utils.ResponseUtil;
import org.apipulse.utils.ValidationUtil;

import java.util.Map;
import java.util.UUID;

/**
 * POST /tasks
 */
public class CreateTaskHandler extends TaskRequestHandler {

    public CreateTaskHandler(TaskService service) {
        super(service);
    }

    @Override
    protected void handle(HttpServerExchange exchange, UUID caller) {
        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);
        if (body == null) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid or empty JSON body");
            return;
        }

        String name = HttpRequestUtil.getString(body, "task_name");
        String url = HttpRequestUtil.getString(body, "api_url");
        String interval = HttpRequestUtil.getString(body, "schedule_interval");
        if (!ValidationUtil.requireNonBlank(exchange, name, "task_name")
                || !ValidationUtil.requireNonBlank(exchange, url, "api_url")
                || !ValidationUtil.requireNonBlank(exchange, interval, "schedule_interval")) {
            return;
        }

        Boolean capture = HttpRequestUtil.getBoolean(body, "capture_response");
        TaskService.TaskDraft draft = new TaskService.TaskDraft(
                name,
                url,
                HttpRequestUtil.getString(body, "method"),
                HttpRequestUtil.getStringMap(body, "request_headers"),
                HttpRequestUtil.getString(body, "request_body"),
                interval,
                capture != null && capture
        );

        Task task = service.createTask(caller, draft);
        ResponseUtil.sendCreated(exchange, "Task created", TaskViews.task(task));
    }
}
