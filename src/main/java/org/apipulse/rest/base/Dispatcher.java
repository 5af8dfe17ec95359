package org.apipulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

/**
 * Runs the wrapped handler on an Undertow worker thread in blocking mode.
 * Task endpoints hit the store and the tick endpoint runs a whole tick, so none of them may stay on the IO thread.
 */
public class Dispatcher implements HttpHandler {

    private final HttpHandler next;

    public Dispatcher(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }
        if (!exchange.isBlocking()) {
            exchange.startBlocking();
        }
        next.handleRequest(exchange);
    }
}
