package io.taskrelay.webhook;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.taskrelay.server.executor.CallbackUrl;
import io.taskrelay.server.store.EventStoreException;
import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front of the {@link WebhookReceiver}.
 * <ul>
 *   <li>{@code POST /webhook/{protocol}/todolist/{todolistId}}: 200 with
 *       {@code {status, todolist_id, a2a_task_id, notification_type}} when acknowledged, 400 when
 *       rejected, 500 when the event store fails. A path with an empty todolist id is rejected
 *       with 400 like any other invalid id;</li>
 *   <li>{@code GET /health}: {@code {status: healthy}}.</li>
 * </ul>
 * Callers are not authenticated.
 */
public class WebhookServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookServer.class);

    private static final String APPLICATION_JSON = "application/json";
    private static final long BODY_LIMIT = 4L * 1024 * 1024;
    private static final long START_TIMEOUT_SECONDS = 30;
    private static final String MISSING_TODOLIST_ROUTE = "/webhook/:protocol/todolist/";

    private final Vertx vertx;
    private final WebhookReceiver receiver;
    private final String protocol;
    private @Nullable HttpServer server;

    public WebhookServer(Vertx vertx, WebhookReceiver receiver, String protocol) {
        this.vertx = Assert.checkNotNullParam("vertx", vertx);
        this.receiver = Assert.checkNotNullParam("receiver", receiver);
        this.protocol = Assert.checkNotBlankParam("protocol", protocol);
    }

    public Router router() {
        Router router = Router.router(vertx);
        router.post(CallbackUrl.ROUTE)
                .handler(BodyHandler.create().setBodyLimit(BODY_LIMIT))
                .blockingHandler(this::onNotification);
        router.post(MISSING_TODOLIST_ROUTE)
                .handler(BodyHandler.create().setBodyLimit(BODY_LIMIT))
                .blockingHandler(this::onNotification);
        router.get("/health").handler(this::onHealth);
        return router;
    }

    /**
     * Starts listening and waits until the server is bound.
     *
     * @param port the port, or 0 for an ephemeral one
     * @return the port actually bound
     */
    public synchronized int start(String host, int port) {
        if (server != null) {
            throw new IllegalStateException("Webhook server already started on port " + server.actualPort());
        }
        try {
            server = vertx.createHttpServer()
                    .requestHandler(router())
                    .listen(port, host)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting webhook server", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to start webhook server on " + host + ":" + port, e);
        }
        LOGGER.info("Webhook receiver listening on {}:{} for /webhook/{}/todolist/{{todolistId}}", host,
                server.actualPort(), protocol);
        return server.actualPort();
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        try {
            server.close().toCompletionStage().toCompletableFuture().get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Error stopping webhook server", e);
        } finally {
            server = null;
        }
    }

    private void onNotification(RoutingContext rc) {
        @Nullable String todolistId = rc.pathParam("todolistId");
        if (!protocol.equals(rc.pathParam("protocol"))) {
            respond(rc, 404, Map.of("status", "rejected", "error", "Unknown protocol: " + rc.pathParam("protocol")));
            return;
        }
        ReceiveResult result;
        try {
            result = receiver.receive(todolistId, rc.body().asString());
        } catch (EventStoreException e) {
            LOGGER.error("Failed to record notification for todolist {}", todolistId, e);
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("status", "error");
            error.put("todolist_id", String.valueOf(todolistId));
            error.put("error", "Event store failure");
            respond(rc, 500, error);
            return;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        if (result.isAck()) {
            body.put("status", "received");
            body.put("todolist_id", todolistId);
            body.put("a2a_task_id", result.remoteTaskId() == null ? "unknown" : result.remoteTaskId());
            body.put("notification_type", result.notificationType() == null
                    ? NotificationType.OTHER.asString()
                    : result.notificationType().asString());
            body.put("disposition", result.disposition().name().toLowerCase(Locale.ROOT));
            respond(rc, 200, body);
        } else {
            body.put("status", "rejected");
            if (todolistId != null) {
                body.put("todolist_id", todolistId);
            }
            body.put("error", result.reason());
            respond(rc, 400, body);
        }
    }

    private void onHealth(RoutingContext rc) {
        respond(rc, 200, Map.of("status", "healthy", "timestamp", Instant.now().toString()));
    }

    private static void respond(RoutingContext rc, int status, Map<String, ?> body) {
        String json;
        try {
            json = Utils.toJsonString(body);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialize response", e);
            rc.response().setStatusCode(500).end();
            return;
        }
        rc.response()
                .setStatusCode(status)
                .putHeader(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON)
                .end(json);
    }
}
