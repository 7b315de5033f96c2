package io.kneo.scheduler.util;

import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.List;
import java.util.Map;

public class ProblemDetailsUtil {
    public static final String PROBLEM_JSON = "application/problem+json";

    public static void respondValidationError(RoutingContext rc, String detail, Map<String, List<String>> fieldErrors) {
        JsonObject problem = problem(rc, 400, "Constraint Violation", detail)
                .put("errors", fieldErrors);
        end(rc, 400, problem);
    }

    public static void respondProblem(RoutingContext rc, int status, String title, String detail) {
        end(rc, status, problem(rc, status, title, detail));
    }

    private static JsonObject problem(RoutingContext rc, int status, String title, String detail) {
        return new JsonObject()
                .put("type", "about:blank")
                .put("title", title)
                .put("status", status)
                .put("detail", detail)
                .put("instance", rc.request().path());
    }

    private static void end(RoutingContext rc, int status, JsonObject problem) {
        if (rc.response().ended()) {
            return;
        }
        rc.response()
                .setStatusCode(status)
                .putHeader("Content-Type", PROBLEM_JSON)
                .end(problem.encode());
    }
}
