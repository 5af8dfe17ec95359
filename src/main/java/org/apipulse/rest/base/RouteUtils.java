package org.apipulse.rest.base;

import io.undertow.server.HttpHandler;

public class RouteUtils {

    private RouteUtils() {}

    /**
     * Route that does not require a caller identity.
     */
    public static HttpHandler publicRoute(HttpHandler handler) {
        return new Dispatcher(new RequestLogContext(handler));
    }

    /**
     * Route that acts on behalf of the user forwarded by the gateway.
     */
    public static HttpHandler callerRoute(HttpHandler handler) {
        return new Dispatcher(new RequestLogContext(new CallerRequired(handler)));
    }
}
