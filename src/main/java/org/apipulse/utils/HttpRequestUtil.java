package org.apipulse.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HttpString;
import io.undertow.util.PathTemplateMatch;

import java.io.InputStream;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Parsing JSON bodies, path parameters and the caller identity.
 */
public class HttpRequestUtil {

    /** Set by the upstream gateway once it has authenticated the caller. */
    public static final HttpString USER_ID_HEADER = new HttpString("X-User-Id");

    private HttpRequestUtil() {}

    /**
     * Returns the request body as a map, or null when it is missing or not a JSON object.
     */
    public static Map<String, Object> parseJson(HttpServerExchange exchange) {
        try (InputStream is = exchange.getInputStream()) {
            return JsonUtil.mapper().readValue(is, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            return null;
        }
    }

    public static String getString(Map<String, Object> body, String field) {
        Object value = body.get(field);
        return value != null ? value.toString() : null;
    }

    public static Boolean getBoolean(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) return null;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * Reads a nested JSON object of string values such as request headers. Non-string values are stringified.
     */
    public static Map<String, String> getStringMap(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (!(value instanceof Map<?, ?> raw)) return null;
        Map<String, String> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) out.put(k.toString(), v.toString());
        });
        return out;
    }

    public static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        if (match != null && match.getParameters().containsKey(name)) {
            return match.getParameters().get(name);
        }
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    public static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    /**
     * Parses a UUID, returning null for missing or malformed input.
     */
    public static UUID parseUuid(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static UUID callerId(HttpServerExchange exchange) {
        return parseUuid(exchange.getRequestHeaders().getFirst(USER_ID_HEADER));
    }
}
