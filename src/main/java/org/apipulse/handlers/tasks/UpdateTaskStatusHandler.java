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
 * PATCH /tasks/{id}/status with {@code {"is_active": true|false}}
 */
public class UpdateTaskStatusHandler extends TaskRequestHandler {

    public UpdateTaskStatusHandler(TaskService service) {
        super(service);
    }

    @Override
    protected void handle(HttpServerExchange exchange, UUID caller) {
        UUID taskId = taskId(exchange);
        if (taskId == null) return;

        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);
        if (body == null) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid or empty JSON body");
            return;
        }
        Boolean active = HttpRequestUtil.getBoolean(body, "is_active");
        if (!ValidationUtil.requireNonNull(exchange, active, "is_active")) return;

        Task task = service.setActive(caller, taskId, active);
        ResponseUtil.sendSuccess(exchange, active ? "Task resumed" : "Task paused", TaskViews.task(task));
    }
}
