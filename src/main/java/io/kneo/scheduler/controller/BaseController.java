package io.kneo.scheduler.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kneo.scheduler.util.ProblemDetailsUtil;
import io.vertx.ext.web.RoutingContext;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public abstract class BaseController {

    @Inject
    ObjectMapper mapper;

    @Inject
    Validator validator;

    /**
     * Parses and validates the request body. Returns null when the request has already been answered.
     */
    protected <T> T readBody(RoutingContext rc, Class<T> type) {
        String body = rc.body() != null ? rc.body().asString() : null;
        if (body == null || body.isBlank()) {
            rc.fail(new IllegalArgumentException("Request body is required"));
            return null;
        }
        T dto;
        try {
            dto = mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            rc.fail(new IllegalArgumentException("Malformed request body: " + e.getOriginalMessage(), e));
            return null;
        }
        Set<ConstraintViolation<T>> violations = validator.validate(dto);
        if (!violations.isEmpty()) {
            Map<String, List<String>> fieldErrors = violations.stream()
                    .collect(Collectors.groupingBy(
                            violation -> violation.getPropertyPath().toString(),
                            Collectors.mapping(ConstraintViolation::getMessage, Collectors.toList())));
            ProblemDetailsUtil.respondValidationError(rc, "Request validation failed", fieldErrors);
            return null;
        }
        return dto;
    }

    protected void respondJson(RoutingContext rc, int status, Object payload) {
        try {
            rc.response()
                    .setStatusCode(status)
                    .putHeader("Content-Type", "application/json")
                    .end(mapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            rc.fail(e);
        }
    }

    protected void respondNoContent(RoutingContext rc) {
        rc.response().setStatusCode(204).end();
    }
}
