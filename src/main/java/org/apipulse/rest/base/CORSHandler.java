package org.apipulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers preflight requests and decorates responses for configured browser origins.
 * A single {@code *} entry allows any origin.
 */
public class CORSHandler implements HttpHandler {

    private static final HttpString ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString MAX_AGE = new HttpString("Access-Control-Max-Age");

    private static final String METHODS = "GET, POST, PATCH, DELETE, OPTIONS";
    private static final String HEADERS = "Content-Type, Accept, X-User-Id, X-Request-Id";
    private static final String PREFLIGHT_MAX_AGE_SECONDS = "86400";

    private final HttpHandler next;
    private final Set<String> origins;
    private final boolean anyOrigin;

    private CORSHandler(HttpHandler next, Set<String> origins) {
        this.next = next;
        this.anyOrigin = origins.contains("*");
        this.origins = origins;
    }

    /**
     * @param allowedOrigins comma separated list as written in the configuration, may be null
     */
    public static CORSHandler fromList(HttpHandler next, String allowedOrigins) {
        Set<String> parsed = allowedOrigins == null ? Set.of()
                : Arrays.stream(allowedOrigins.split(","))
                        .map(s -> s.trim().toLowerCase(Locale.ROOT))
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
        return new CORSHandler(next, parsed);
    }

    private boolean isAllowed(String origin) {
        return origin != null && (anyOrigin || origins.contains(origin.toLowerCase(Locale.ROOT)));
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        boolean allowed = isAllowed(origin);

        if (allowed) {
            HeaderMap out = exchange.getResponseHeaders();
            out.put(ALLOW_ORIGIN, origin);
            out.put(ALLOW_METHODS, METHODS);
            out.put(ALLOW_HEADERS, HEADERS);
            out.put(MAX_AGE, PREFLIGHT_MAX_AGE_SECONDS);
            out.put(Headers.VARY, "Origin");
        }

        if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
            exchange.setStatusCode(allowed ? StatusCodes.NO_CONTENT : StatusCodes.FORBIDDEN);
            exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, "0");
            exchange.endExchange();
            return;
        }

        next.handleRequest(exchange);
    }
}
