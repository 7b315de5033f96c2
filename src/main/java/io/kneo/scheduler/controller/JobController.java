package io.kneo.scheduler.controller;

import io.kneo.scheduler.service.scheduler.SchedulerCore;
import io.kneo.scheduler.util.BlockingUni;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class JobController extends BaseController {

    @Inject
    SchedulerCore schedulerCore;

    public void setupRoutes(Router router) {
        router.route(HttpMethod.GET, "/api/jobs/:jobGroup/:jobName/triggers").handler(this::getTriggers);
        router.route(HttpMethod.DELETE, "/api/jobs/groups/:group").handler(this::deleteJobGroup);
        router.route(HttpMethod.DELETE, "/api/jobs").handler(this::deleteJob);
        router.route(HttpMethod.DELETE, "/api/triggers/groups/:group").handler(this::deleteTriggerGroup);
        router.route(HttpMethod.DELETE, "/api/triggers").handler(this::deleteTrigger);
    }

    private void getTriggers(RoutingContext rc) {
        String jobGroup = rc.pathParam("jobGroup");
        String jobName = rc.pathParam("jobName");
        BlockingUni.call(() -> schedulerCore.getTriggerDetails(jobName, jobGroup))
                .subscribe().with(
                        details -> respondJson(rc, 200, details),
                        rc::fail
                );
    }

    private void deleteJobGroup(RoutingContext rc) {
        String group = rc.pathParam("group");
        noContent(rc, BlockingUni.run(() -> schedulerCore.removeJobGroup(group)));
    }

    private void deleteJob(RoutingContext rc) {
        String name = rc.request().getParam("name");
        String group = rc.request().getParam("group");
        noContent(rc, BlockingUni.run(() -> schedulerCore.removeJob(name, group)));
    }

    private void deleteTriggerGroup(RoutingContext rc) {
        String group = rc.pathParam("group");
        noContent(rc, BlockingUni.run(() -> schedulerCore.removeTriggerGroup(group)));
    }

    private void deleteTrigger(RoutingContext rc) {
        String name = rc.request().getParam("name");
        String group = rc.request().getParam("group");
        noContent(rc, BlockingUni.run(() -> schedulerCore.removeTrigger(name, group)));
    }

    private void noContent(RoutingContext rc, Uni<Void> action) {
        action.subscribe().with(
                ignored -> respondNoContent(rc),
                rc::fail
        );
    }
}
