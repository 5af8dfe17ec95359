package org.apipulse.handlers.tasks;

import io.undertow.server.HttpServerExchange;
import org.apipulse.services.TaskService;
import org.apipulse.utils.ResponseUtil;

import java.util.Map;
import java.util.UUID;

/**
 * DELETE /tasks/{id}
 */
public class DeleteTaskHandler extends TaskRequestHandler {

    public DeleteTaskHandler(TaskService service) {
        super(service);
    }

    @Override
    protected void handle(HttpServerExchange exchange, UUID caller) {
        UUID taskId = taskId(exchange);
        if (taskId == null) return;

        service.deleteTask(caller, taskId);
        ResponseUtil.sendSuccess(exchange, "Task deleted", Map.of("id", taskId));
    }
}
