package org.apipulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.AttachmentKey;
import io.undertow.util.StatusCodes;
import org.apipulse.utils.HttpRequestUtil;
import org.apipulse.utils.ResponseUtil;

import java.util.UUID;

/**
 * Rejects requests without a valid caller id. Authentication happens upstream; the gateway
 * forwards the authenticated user in {@code X-User-Id}.
 */
public class CallerRequired implements HttpHandler {

    public static final AttachmentKey<UUID> CALLER = AttachmentKey.create(UUID.class);

    private final HttpHandler next;

    public CallerRequired(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        UUID caller = HttpRequestUtil.callerId(exchange);
        if (caller == null) {
            ResponseUtil.sendError(exchange, StatusCodes.UNAUTHORIZED, "Missing or invalid X-User-Id header");
            return;
        }
        exchange.putAttachment(CALLER, caller);
        next.handleRequest(exchange);
    }
}
