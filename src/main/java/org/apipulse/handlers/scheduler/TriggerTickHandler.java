package org.apipulse.handlers.scheduler;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.apipulse.scheduling.SchedulerLoop;
import org.apipulse.scheduling.TickReport;
import org.apipulse.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * POST /scheduler/tick runs one scheduler tick synchronously, for external cron triggers.
 */
public class TriggerTickHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(TriggerTickHandler.class);

    private final SchedulerLoop loop;

    public TriggerTickHandler(SchedulerLoop loop) {
        this.loop = loop;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        try {
            logger.info("Scheduler tick requested over HTTP from {}", exchange.getSourceAddress());
            TickReport report = loop.tick();
            ResponseUtil.sendSuccess(exchange, "Scheduler executed", report);
        } catch (RuntimeException e) {
            logger.error("Triggered tick failed: {}", e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Scheduler tick failed: " + e.getMessage());
        }
    }
}
