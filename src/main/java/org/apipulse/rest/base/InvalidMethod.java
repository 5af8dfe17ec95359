package org.apipulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.apipulse.utils.ResponseUtil;

/**
 * Handles unsupported HTTP methods
 * */
public class InvalidMethod implements HttpHandler {

    private final String message;

    public InvalidMethod() {
        this(null);
    }

    /**
     * @param message fixed error message; null reports the offending method
     */
    public InvalidMethod(String message) {
        this.message = message;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String text = message != null ? message : "Method " + exchange.getRequestMethod() + " not allowed";
        ResponseUtil.sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED, text);
    }
}
