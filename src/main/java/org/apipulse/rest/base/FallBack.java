package org.apipulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.apipulse.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 404 for paths no route matches.
 */
public class FallBack implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(FallBack.class);

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        logger.debug("No route for {} {}", exchange.getRequestMethod(), exchange.getRequestPath());
        ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND,
                "No route for " + exchange.getRequestMethod() + " " + exchange.getRequestPath());
    }
}
