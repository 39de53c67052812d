package com.pricegate.adapter.in.web;

import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared response writing for the HTTP handlers
 */
@Slf4j
public final class JsonResponses {

    private JsonResponses() {
    }

    public static void ok(RoutingContext context, Object body) {
        context.response()
                .setStatusCode(200)
                .putHeader("Content-Type", "application/json")
                .end(Json.encode(body));
    }

    /**
     * Malformed input is the caller's fault (400); anything else is ours (500)
     */
    public static void fail(RoutingContext context, Throwable error) {
        if (error instanceof IllegalArgumentException) {
            log.debug("Rejected request {}: {}", context.request().uri(), error.getMessage());
            error(context, 400, error.getMessage());
        } else {
            log.error("Request {} failed", context.request().uri(), error);
            error(context, 500, "Internal error: " + error.getMessage());
        }
    }

    public static void error(RoutingContext context, int statusCode, String message) {
        JsonObject response = new JsonObject()
                .put("status", "error")
                .put("message", message);

        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(response.encode());
    }

    public static String requiredParam(RoutingContext context, String name) {
        String value = context.request().getParam(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Query parameter '" + name + "' is required");
        }
        return value.trim();
    }

    public static String param(RoutingContext context, String name, String defaultValue) {
        String value = context.request().getParam(name);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
