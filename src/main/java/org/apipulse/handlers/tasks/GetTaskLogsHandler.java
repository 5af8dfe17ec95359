package org.apipulse.handlers.tasks;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.apipulse.services.TaskService;
import org.apipulse.utils.HttpRequestUtil;
import org.apipulse.utils.ResponseUtil;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * GET /tasks/{id}/logs?limit=
 */
public class GetTaskLogsHandler extends TaskRequestHandler {

    public GetTaskLogsHandler(TaskService service) {
        super(service);
    }

    @Override
    protected void handle(HttpServerExchange exchange, UUID caller) {
        UUID taskId = taskId(exchange);
        if (taskId == null) return;

        Integer limit = null;
        String rawLimit = HttpRequestUtil.queryParam(exchange, "limit");
        if (rawLimit != null) {
            try {
                limit = Integer.parseInt(rawLimit.trim());
            } catch (NumberFormatException e) {
                ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "limit must be a number");
                return;
            }
        }

        List<Map<String, Object>> logs = service.recentLogs(caller, taskId, limit).stream()
                .map(TaskViews::log)
                .toList();
        ResponseUtil.sendSuccess(exchange, "Execution logs", logs);
    }
}
