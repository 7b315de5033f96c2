package io.kneo.scheduler.controller;

import io.kneo.scheduler.dto.SqlCronTriggerDTO;
import io.kneo.scheduler.dto.SqlSimpleTriggerDTO;
import io.kneo.scheduler.service.SqlTriggerService;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class SqlTriggersController extends BaseController {

    @Inject
    SqlTriggerService service;

    public void setupRoutes(Router router) {
        router.route(HttpMethod.POST, "/api/sql/simpleTriggers").handler(this::postSimple);
        router.route(HttpMethod.POST, "/api/sql/cronTriggers").handler(this::postCron);
    }

    private void postSimple(RoutingContext rc) {
        SqlSimpleTriggerDTO dto = readBody(rc, SqlSimpleTriggerDTO.class);
        if (dto == null) return;

        service.scheduleSimpleTrigger(dto)
                .subscribe().with(
                        ignored -> rc.response().setStatusCode(201).end(),
                        rc::fail
                );
    }

    private void postCron(RoutingContext rc) {
        SqlCronTriggerDTO dto = readBody(rc, SqlCronTriggerDTO.class);
        if (dto == null) return;

        service.scheduleCronTrigger(dto)
                .subscribe().with(
                        ignored -> rc.response().setStatusCode(201).end(),
                        rc::fail
                );
    }
}
