package org.apipulse.rest;

import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Methods;
import org.apipulse.handlers.HealthCheckHandler;
import org.apipulse.handlers.scheduler.TriggerTickHandler;
import org.apipulse.handlers.tasks.CreateTaskHandler;
import org.apipulse.handlers.tasks.DeleteTaskHandler;
import org.apipulse.handlers.tasks.GetTaskLogsHandler;
import org.apipulse.handlers.tasks.LinkNotificationHandler;
import org.apipulse.handlers.tasks.UpdateTaskStatusHandler;
import org.apipulse.rest.base.Dispatcher;
import org.apipulse.rest.base.FallBack;
import org.apipulse.rest.base.InvalidMethod;
import org.apipulse.scheduling.SchedulerLoop;
import org.apipulse.services.TaskService;

import static org.apipulse.rest.base.RouteUtils.callerRoute;
import static org.apipulse.rest.base.RouteUtils.publicRoute;

public class Routes {

    private Routes() {}

    public static RoutingHandler health(HealthCheckHandler handler) {
        return Handlers.routing()
                .get("/health", publicRoute(handler))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }

    public static RoutingHandler scheduler(SchedulerLoop loop) {
        return Handlers.routing()
                .post("/tick", publicRoute(new TriggerTickHandler(loop)))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod("Only POST requests are allowed")))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }

    public static RoutingHandler tasks(TaskService service) {
        return Handlers.routing()
                .post("", callerRoute(new CreateTaskHandler(service)))
                .add(Methods.PATCH, "/{id}/status", callerRoute(new UpdateTaskStatusHandler(service)))
                .delete("/{id}", callerRoute(new DeleteTaskHandler(service)))
                .put("/{id}/notifications", callerRoute(new LinkNotificationHandler(service)))
                .get("/{id}/logs", callerRoute(new GetTaskLogsHandler(service)))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }
}
