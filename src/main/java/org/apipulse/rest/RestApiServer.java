package org.apipulse.rest;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.handlers.PathHandler;
import org.apipulse.config.XmlConfiguration;
import org.apipulse.handlers.HealthCheckHandler;
import org.apipulse.rest.base.CORSHandler;
import org.apipulse.services.ApplicationServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private RestApiServer() {}

    public static Undertow startUndertow(XmlConfiguration cfg, ApplicationServices services, HealthCheckHandler health) {
        if (cfg == null || cfg.server == null) {
            logger.error("Invalid configuration: missing server configuration.");
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        String basePath = cfg.server.basePath == null ? "" : cfg.server.basePath;

        PathHandler pathHandler = Handlers.path()
                .addPrefixPath(basePath + "/system", Routes.health(health))
                .addPrefixPath(basePath + "/scheduler", Routes.scheduler(services.schedulerLoop()))
                .addPrefixPath(basePath + "/tasks", Routes.tasks(services.taskService()));

        Undertow server = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .setIoThreads(cfg.server.ioThreads)
                .setWorkerThreads(cfg.server.workerThreads)
                .addHttpListener(cfg.server.port, cfg.server.host)
                .setHandler(CORSHandler.fromList(pathHandler, cfg.server.allowedOrigins))
                .build();

        try {
            server.start();
        } catch (RuntimeException e) {
            logger.error("Error starting server: {}", e.getMessage());
            throw new IllegalStateException("Undertow failed to start on " + cfg.server.host + ":" + cfg.server.port, e);
        }
        logger.info("""

                        API PULSE SCHEDULER REST API
                        --------------------------------------
                        Undertow server started successfully!
                        Host   : http://{}:{}{}
                        """,
                cfg.server.host, cfg.server.port, basePath);
        return server;
    }
}
