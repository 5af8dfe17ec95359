package org.apipulse.handlers.tasks;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.apipulse.model.NotificationLink;
import org.apipulse.services.TaskService;
import org.apipulse.utils.HttpRequestUtil;
import org.apipulse.utils.ResponseUtil;

import java.util.Map;
import java.util.UUID;

/**
 * PUT /tasks/{id}/notifications with {@code integration_id}, optional {@code notify_on}
 * and {@code include_response}.
 */
public class LinkNotificationHandler extends TaskRequestHandler {

    public LinkNotificationHandler(TaskService service) {
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
        UUID integrationId = HttpRequestUtil.parseUuid(HttpRequestUtil.getString(body, "integration_id"));
        if (integrationId == null) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "integration_id is required");
            return;
        }
        Boolean includeResponse = HttpRequestUtil.getBoolean(body, "include_response");

        NotificationLink link = service.linkNotification(caller, taskId, integrationId,
                HttpRequestUtil.getString(body, "notify_on"), includeResponse != null && includeResponse);
        ResponseUtil.sendSuccess(exchange, "Notification linked", TaskViews.link(link));
    }
}
