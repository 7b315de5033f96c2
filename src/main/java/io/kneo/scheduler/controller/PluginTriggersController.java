package io.kneo.scheduler.controller;

import io.kneo.scheduler.dto.PluginCronTriggerDTO;
import io.kneo.scheduler.dto.PluginSimpleTriggerDTO;
import io.kneo.scheduler.service.PluginTriggerService;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class PluginTriggersController extends BaseController {
    private static final Logger LOGGER = LoggerFactory.getLogger(PluginTriggersController.class);

    @Inject
    PluginTriggerService service;

    public void setupRoutes(Router router) {
        router.route(HttpMethod.POST, "/api/plugins/simpleTriggers").handler(this::postSimple);
        router.route(HttpMethod.DELETE, "/api/plugins/simpleTriggers").handler(this::delete);
        router.route(HttpMethod.POST, "/api/plugins/cronTriggers").handler(this::postCron);
        router.route(HttpMethod.DELETE, "/api/plugins/cronTriggers").handler(this::delete);
    }

    private void postSimple(RoutingContext rc) {
        PluginSimpleTriggerDTO dto = readBody(rc, PluginSimpleTriggerDTO.class);
        if (dto == null) return;

        LOGGER.info("Entered postSimple(). PluginName = {}", dto.getPluginName());
        service.scheduleSimpleTrigger(dto)
                .subscribe().with(
                        ignored -> rc.response().setStatusCode(201).end(),
                        rc::fail
                );
    }

    private void postCron(RoutingContext rc) {
        PluginCronTriggerDTO dto = readBody(rc, PluginCronTriggerDTO.class);
        if (dto == null) return;

        LOGGER.info("Entered postCron(). PluginName = {}", dto.getPluginName());
        service.scheduleCronTrigger(dto)
                .subscribe().with(
                        ignored -> rc.response().setStatusCode(201).end(),
                        rc::fail
                );
    }

    private void delete(RoutingContext rc) {
        String pluginName = rc.request().getParam("pluginName");
        String triggerName = rc.request().getParam("triggerName");
        LOGGER.info("Entered delete(). pluginName = {}. triggerName = {}", pluginName, triggerName);
        if (pluginName == null || pluginName.isBlank()) {
            rc.fail(new IllegalArgumentException("pluginName is null or empty."));
            return;
        }
        service.removeTrigger(pluginName, triggerName)
                .subscribe().with(
                        ignored -> respondNoContent(rc),
                        rc::fail
                );
    }
}
