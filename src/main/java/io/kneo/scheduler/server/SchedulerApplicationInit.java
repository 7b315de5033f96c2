package io.kneo.scheduler.server;

import io.kneo.scheduler.controller.JobController;
import io.kneo.scheduler.controller.PluginController;
import io.kneo.scheduler.controller.PluginTriggersController;
import io.kneo.scheduler.controller.SqlTriggersController;
import io.kneo.scheduler.repository.PluginRepository;
import io.kneo.scheduler.service.exceptions.PluginNotFoundException;
import io.kneo.scheduler.util.ProblemDetailsUtil;
import io.quarkus.runtime.StartupEvent;
import io.vertx.ext.web.Route;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class SchedulerApplicationInit {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchedulerApplicationInit.class);

    @Inject
    Router router;

    @Inject
    PluginTriggersController pluginTriggersController;

    @Inject
    SqlTriggersController sqlTriggersController;

    @Inject
    PluginController pluginController;

    @Inject
    JobController jobController;

    @Inject
    PluginRepository pluginRepository;

    public void onStart(@Observes StartupEvent ev) {
        router.route("/api/*").handler(BodyHandler.create());

        // literal trigger paths must be matched before /api/plugins/:name
        pluginTriggersController.setupRoutes(router);
        sqlTriggersController.setupRoutes(router);
        pluginController.setupRoutes(router);
        jobController.setupRoutes(router);

        router.route("/api/*").failureHandler(this::handleFailure);
        logRegisteredRoutes(router);

        pluginRepository.createTableIfAbsent()
                .subscribe().with(
                        ignored -> LOGGER.info("Plugin registry table is ready"),
                        failure -> LOGGER.error("Unable to prepare plugin registry table", failure)
                );
    }

    void handleFailure(RoutingContext rc) {
        Throwable failure = rc.failure();
        if (failure == null) {
            int status = rc.statusCode() > 0 ? rc.statusCode() : 500;
            ProblemDetailsUtil.respondProblem(rc, status, "Request failed", null);
            return;
        }
        if (failure instanceof IllegalArgumentException || failure instanceof PluginNotFoundException) {
            ProblemDetailsUtil.respondProblem(rc, 400, "Bad Request", failure.getMessage());
        } else if (failure instanceof ObjectAlreadyExistsException) {
            ProblemDetailsUtil.respondProblem(rc, 409, "Conflict", failure.getMessage());
        } else if (failure instanceof SchedulerException) {
            LOGGER.error("Scheduling engine failure on {}", rc.request().path(), failure);
            ProblemDetailsUtil.respondProblem(rc, 500, "Scheduler Error", failure.getMessage());
        } else {
            LOGGER.error("Unexpected failure on {}", rc.request().path(), failure);
            ProblemDetailsUtil.respondProblem(rc, 500, "Internal Server Error", failure.getMessage());
        }
    }

    private static void logRegisteredRoutes(Router router) {
        for (Route route : router.getRoutes()) {
            if (route.getPath() != null) {
                LOGGER.debug("Route {} {}", route.methods() != null ? route.methods() : "*", route.getPath());
            }
        }
    }
}
