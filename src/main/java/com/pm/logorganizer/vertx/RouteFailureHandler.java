package com.pm.logorganizer.vertx;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.vertx.core.Handler;
import io.vertx.core.http.HttpClosedException;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.pm.logorganizer.util.HttpResponseHelper.sendJson;

/**
 * Last-resort handler for routes that failed without writing a response.
 */
public class RouteFailureHandler implements Handler<RoutingContext> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RouteFailureHandler.class);

    @Override
    public void handle(RoutingContext ctx) {
        HttpServerResponse response = ctx.response();
        String url = ctx.normalizedPath();
        Throwable t = ctx.failure();

        // client went away, nothing to answer
        if (t instanceof HttpClosedException) {
            LOGGER.warn("Ignoring exception - URL: [{}] - Error:", url, t);
            if (!response.ended() && !response.closed()) {
                response.end();
            }
            return;
        }

        int statusCode = ctx.statusCode() == -1 ? 500 : ctx.statusCode();
        if (statusCode >= 500) {
            LOGGER.error("URL: [{}] - Error response code: [{}] - Error:", url, statusCode, t);
        } else {
            LOGGER.warn("URL: [{}] - Error response code: [{}] - Error: {}", url, statusCode, t == null ? null : t.getMessage());
        }

        if (!response.ended() && !response.closed()) {
            String reason = HttpResponseStatus.valueOf(statusCode).reasonPhrase();
            sendJson(response, statusCode, new JsonObject()
                .put("status", statusCode >= 500 ? "failed" : "bad_request")
                .put("reason", reason));
        }
    }
}
