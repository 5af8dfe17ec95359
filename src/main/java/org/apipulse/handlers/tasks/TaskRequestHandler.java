package org.apipulse.handlers.tasks;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.apipulse.rest.base.CallerRequired;
import org.apipulse.services.TaskNotFoundException;
import org.apipulse.services.TaskService;
import org.apipulse.store.PersistenceException;
import org.apipulse.utils.HttpRequestUtil;
import org.apipulse.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Shared plumbing of the task endpoints: resolves the caller and the {@code {id}} path
 * parameter and maps service exceptions to error responses.
 */
abstract class TaskRequestHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(TaskRequestHandler.class);

    protected final TaskService service;

    protected TaskRequestHandler(TaskService service) {
        this.service = service;
    }

    @Override
    public final void handleRequest(HttpServerExchange exchange) {
        UUID caller = exchange.getAttachment(CallerRequired.CALLER);
        try {
            handle(exchange, caller);
        } catch (TaskNotFoundException e) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (PersistenceException e) {
            logger.error("Store failure on {} {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Storage unavailable, try again later");
        }
    }

    protected abstract void handle(HttpServerExchange exchange, UUID caller);

    /**
     * @return the task id, or null after an error response was sent
     */
    protected static UUID taskId(HttpServerExchange exchange) {
        UUID id = HttpRequestUtil.parseUuid(HttpRequestUtil.pathParam(exchange, "id"));
        if (id == null) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid task id");
        }
        return id;
    }
}
