package io.kneo.scheduler.controller;

import io.kneo.scheduler.dto.PluginDTO;
import io.kneo.scheduler.dto.RegisterPluginDTO;
import io.kneo.scheduler.repository.PluginStore;
import io.kneo.scheduler.service.exceptions.PluginNotFoundException;
import io.kneo.scheduler.service.scheduler.SchedulerCore;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class PluginController extends BaseController {
    private static final Logger LOGGER = LoggerFactory.getLogger(PluginController.class);

    @Inject
    PluginStore pluginStore;

    @Inject
    SchedulerCore schedulerCore;

    public void setupRoutes(Router router) {
        router.route(HttpMethod.GET, "/api/plugins").handler(this::getAll);
        router.route(HttpMethod.GET, "/api/plugins/:name").handler(this::get);
        router.route(HttpMethod.POST, "/api/plugins").handler(this::register);
        router.route(HttpMethod.POST, "/api/plugins/:name/execute").handler(this::execute);
        router.route(HttpMethod.DELETE, "/api/plugins/:name").handler(this::remove);
    }

    private void getAll(RoutingContext rc) {
        pluginStore.getAll()
                .onItem().transform(plugins -> plugins.stream().map(PluginDTO::from).toList())
                .subscribe().with(
                        dtos -> respondJson(rc, 200, dtos),
                        rc::fail
                );
    }

    private void get(RoutingContext rc) {
        String name = rc.pathParam("name");
        pluginStore.findByName(name)
                .subscribe().with(
                        plugin -> {
                            if (plugin == null) {
                                rc.fail(new PluginNotFoundException(name));
                            } else {
                                respondJson(rc, 200, PluginDTO.from(plugin));
                            }
                        },
                        rc::fail
                );
    }

    private void register(RoutingContext rc) {
        RegisterPluginDTO dto = readBody(rc, RegisterPluginDTO.class);
        if (dto == null) return;

        LOGGER.info("Registering plugin {} from {}", dto.getName(), dto.getAssemblyPath());
        schedulerCore.registerPlugin(dto.getName(), dto.getAssemblyPath())
                .subscribe().with(
                        ignored -> respondNoContent(rc),
                        rc::fail
                );
    }

    private void execute(RoutingContext rc) {
        String name = rc.pathParam("name");
        LOGGER.info("Executing plugin {} on demand", name);
        schedulerCore.executePlugin(name)
                .subscribe().with(
                        ignored -> rc.response().setStatusCode(202).end(),
                        rc::fail
                );
    }

    private void remove(RoutingContext rc) {
        String name = rc.pathParam("name");
        LOGGER.info("Removing plugin {}", name);
        schedulerCore.removePlugin(name)
                .subscribe().with(
                        ignored -> respondNoContent(rc),
                        rc::fail
                );
    }
}
