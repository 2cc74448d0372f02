package com.pm.logorganizer.vertx;

import com.pm.logorganizer.Const;
import com.pm.logorganizer.batch.BatchOrchestrator;
import com.pm.logorganizer.batch.BatchOutcome;
import com.pm.logorganizer.sqs.SqsEventDecoder;
import com.pm.logorganizer.sqs.SqsMessageOperations;
import com.pm.logorganizer.sqs.SqsRawMessage;
import com.pm.logorganizer.util.QueueUrls;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.pm.logorganizer.util.HttpResponseHelper.*;

/**
 * Hosts the batch pipeline.
 *
 * <h2>Inbound paths</h2>
 * <ul>
 *   <li><code>POST /logorganizer/batch</code> - processes a delivered batch in queue-trigger event
 *   shape and responds with the batch outcome</li>
 *   <li><code>batch.poll</code> event - receives one batch from the configured queue and processes it
 *   (only when <code>sqs_poll_enabled</code> is set)</li>
 * </ul>
 *
 * <p>Batches run on worker threads via {@link io.vertx.core.Vertx#executeBlocking(java.util.concurrent.Callable)}.
 * At most one poll-triggered batch runs at a time; ticks arriving while one is running are skipped.</p>
 */
public class LogOrganizerVerticle extends AbstractVerticle {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogOrganizerVerticle.class);

    private final BatchOrchestrator orchestrator;
    private final SqsClient sqsClient;
    private final int listenPort;
    private final boolean pollEnabled;
    private final String queueArn;
    private final String queueUrl;
    private final int maxMessagesPerPoll;
    private final int visibilityTimeout;

    private final AtomicBoolean pollInProgress = new AtomicBoolean(false);
    private HttpServer server;

    public LogOrganizerVerticle(JsonObject jsonConfig, BatchOrchestrator orchestrator, SqsClient sqsClient) {
        this.orchestrator = orchestrator;
        this.sqsClient = sqsClient;
        this.listenPort = jsonConfig.getInteger(Const.Config.ServicePortProp, Const.Port.ServicePort);
        this.pollEnabled = jsonConfig.getBoolean(Const.Config.SqsPollEnabledProp, false);
        this.queueArn = jsonConfig.getString(Const.Config.SqsQueueArnProp);
        this.queueUrl = this.pollEnabled ? QueueUrls.fromArn(this.queueArn) : null;
        this.maxMessagesPerPoll = jsonConfig.getInteger(Const.Config.SqsMaxMessagesPerPollProp, 10);
        this.visibilityTimeout = jsonConfig.getInteger(Const.Config.SqsVisibilityTimeoutProp, 240);

        LOGGER.info("LogOrganizerVerticle initialized with pollEnabled: {}, queueUrl: {}, maxMessagesPerPoll: {}, visibilityTimeout: {}",
            pollEnabled, queueUrl, maxMessagesPerPoll, visibilityTimeout);
    }

    @Override
    public void start(Promise<Void> startPromise) {
        if (pollEnabled) {
            vertx.eventBus().consumer(Const.Event.BatchPoll, msg -> this.handlePoll());
        }

        LOGGER.info("Attempting to start log organizer HTTP server on port: {}", listenPort);
        vertx.createHttpServer()
            .requestHandler(createRouter())
            .listen(listenPort, result -> {
                if (result.succeeded()) {
                    this.server = result.result();
                    LOGGER.info("Log organizer HTTP server started on port: {}", server.actualPort());
                    startPromise.complete();
                } else {
                    LOGGER.error("Failed to start log organizer HTTP server", result.cause());
                    startPromise.fail(result.cause());
                }
            });
    }

    public int actualPort() {
        return server == null ? -1 : server.actualPort();
    }

    private Router createRouter() {
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());
        router.route().failureHandler(new RouteFailureHandler());

        router.get(Endpoints.OPS_HEALTHCHECK.toString())
            .handler(ctx -> ctx.response().end("OK"));
        router.post(Endpoints.LOG_ORGANIZER_BATCH.toString())
            .handler(this::handleBatch);

        return router;
    }

    /**
     * Handler for POST /logorganizer/batch
     */
    private void handleBatch(RoutingContext routingContext) {
        HttpServerResponse resp = routingContext.response();

        final List<SqsRawMessage> messages;
        try {
            JsonObject event = routingContext.body().asJsonObject();
            messages = SqsEventDecoder.decode(event);
        } catch (DecodeException | IllegalArgumentException e) {
            LOGGER.error("Rejecting malformed batch event: {}", e.getMessage());
            sendBadRequest(resp, e.getMessage());
            return;
        }

        runBatch(messages).onComplete(ar -> {
            if (ar.succeeded()) {
                sendSuccess(resp, ar.result().toResponseJson());
            } else {
                sendError(resp, ar.cause());
            }
        });
    }

    private void handlePoll() {
        if (!pollInProgress.compareAndSet(false, true)) {
            LOGGER.warn("skipping {}: previous batch still running", Const.Event.BatchPoll);
            return;
        }

        vertx.executeBlocking(() -> SqsMessageOperations.receiveBatch(sqsClient, queueUrl, queueArn, maxMessagesPerPoll, visibilityTimeout))
            .compose(messages -> messages.isEmpty()
                ? Future.<BatchOutcome>succeededFuture(null)
                : runBatch(messages))
            .onComplete(ar -> pollInProgress.set(false));
    }

    private Future<BatchOutcome> runBatch(List<SqsRawMessage> messages) {
        return vertx.executeBlocking(() -> orchestrator.processBatch(messages), false)
            .onSuccess(outcome -> LOGGER.debug("batch outcome: {}", outcome.toJson().encode()))
            .onFailure(t -> LOGGER.error("Fatal error in batch processing: {}", t.getMessage(), t));
    }
}
