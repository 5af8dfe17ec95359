package org.apipulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HttpString;
import org.apipulse.config.utils.LogContext;

/**
 * Opens the MDC context of one REST request on the worker thread, reusing the caller's
 * {@code X-Request-Id} as trace id when present.
 */
public class RequestLogContext implements HttpHandler {

    static final HttpString REQUEST_ID = new HttpString("X-Request-Id");

    private final HttpHandler next;

    public RequestLogContext(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        LogContext.start("rest", exchange.getRequestHeaders().getFirst(REQUEST_ID));
        try {
            next.handleRequest(exchange);
        } finally {
            LogContext.clear();
        }
    }
}
