package com.pm.logorganizer.util;

import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;

/**
 * Utility class for HTTP JSON response handling.
 */
public class HttpResponseHelper {

    public static void sendJson(HttpServerResponse resp, int statusCode, JsonObject body) {
        resp.setStatusCode(statusCode)
            .putHeader(HttpHeaders.CONTENT_TYPE, "application/json")
            .end(body.encode());
    }

    public static void sendSuccess(HttpServerResponse resp, JsonObject body) {
        sendJson(resp, 200, body);
    }

    public static void sendBadRequest(HttpServerResponse resp, String reason) {
        sendJson(resp, 400, new JsonObject().put("status", "bad_request").put("reason", reason));
    }

    public static void sendError(HttpServerResponse resp, String error) {
        sendJson(resp, 500, new JsonObject().put("status", "failed").put("error", error));
    }

    public static void sendError(HttpServerResponse resp, Throwable e) {
        sendError(resp, e.getMessage());
    }
}
