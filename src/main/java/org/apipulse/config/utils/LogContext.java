package org.apipulse.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by every log line: {@code component} names the unit of work
 * (a tick, a task run, a channel delivery, a REST request) and {@code trace.id} ties
 * together the lines of one task run across the worker and notification threads.
 * Pool threads are reused, so every {@link #start} is paired with {@link #clear()} in a finally block.
 */
public final class LogContext {

    public static final String COMPONENT = "component";
    public static final String TRACE_ID = "trace.id";

    private LogContext() {}

    public static void start(String component) {
        start(component, null);
    }

    /**
     * @param traceId trace to continue; null or blank starts a new one
     */
    public static void start(String component, String traceId) {
        MDC.put(COMPONENT, component);
        MDC.put(TRACE_ID, traceId == null || traceId.isBlank() ? newTraceId() : traceId);
    }

    public static void clear() {
        MDC.remove(COMPONENT);
        MDC.remove(TRACE_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
