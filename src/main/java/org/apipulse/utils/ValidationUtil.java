package org.apipulse.utils;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

public final class ValidationUtil {

    private ValidationUtil() {}

    public static boolean requireNonNull(HttpServerExchange exchange, Object value, String fieldName) {
        if (value == null) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, fieldName + " is required");
            return false;
        }
        return true;
    }

    public static boolean requireNonBlank(HttpServerExchange exchange, String value, String fieldName) {
        if (value == null || value.isBlank()) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, fieldName + " is required or blank");
            return false;
        }
        return true;
    }
}
