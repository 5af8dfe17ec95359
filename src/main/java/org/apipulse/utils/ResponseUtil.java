package org.apipulse.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.apipulse.config.utils.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the JSON envelope every endpoint answers with:
 * {@code {"status":"success","message":...,"data":...}} or {@code {"status":"error","message":...,"trace_id":...}}.
 */
public class ResponseUtil {
    private static final Logger logger = LoggerFactory.getLogger(ResponseUtil.class);

    private ResponseUtil() {}

    public static void sendJson(HttpServerExchange exchange, int status, Map<String, Object> body) {
        String json;
        try {
            json = JsonUtil.mapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            logger.error("Could not serialise response body for {}: {}", exchange.getRequestPath(), e.getOriginalMessage(), e);
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            json = "{\"status\":\"error\",\"message\":\"Response could not be serialised\"}";
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=UTF-8");
        exchange.getResponseSender().send(json);
        logger.debug("{} {} -> {}", exchange.getRequestMethod(), exchange.getRequestPath(), status);
    }

    public static void sendError(HttpServerExchange exchange, int status, String message) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("status", "error");
        res.put("message", message);
        String traceId = LogContext.getTraceId();
        if (traceId != null) {
            res.put("trace_id", traceId);
        }
        sendJson(exchange, status, res);
    }

    public static void sendSuccess(HttpServerExchange exchange, String message, Object data) {
        send(exchange, StatusCodes.OK, message, data);
    }

    public static void sendCreated(HttpServerExchange exchange, String message, Object data) {
        send(exchange, StatusCodes.CREATED, message, data);
    }

    private static void send(HttpServerExchange exchange, int status, String message, Object data) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("status", "success");
        res.put("message", message);
        if (data != null) {
            res.put("data", data);
        }
        sendJson(exchange, status, res);
    }
}
