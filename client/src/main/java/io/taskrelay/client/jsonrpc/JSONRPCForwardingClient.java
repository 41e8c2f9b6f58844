package io.taskrelay.client.jsonrpc;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.taskrelay.client.BlockingOutcome;
import io.taskrelay.client.ForwardRequest;
import io.taskrelay.client.ForwardedEvent;
import io.taskrelay.client.ForwardingClient;
import io.taskrelay.client.SubmissionOutcome;
import io.taskrelay.client.http.AgentCardResolver;
import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpResponse;
import io.taskrelay.client.jsonrpc.sse.SSEEventListener;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.Endpoint;
import io.taskrelay.spec.FailureDetail;
import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.JSONRPCRequest;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.MessageReply;
import io.taskrelay.spec.MessageSendConfiguration;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.ProtocolRejectionException;
import io.taskrelay.spec.Role;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.StreamingEvents;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskRelayException;
import io.taskrelay.spec.TaskState;
import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ForwardingClient} speaking A2A JSON-RPC.
 * <p>
 * Blocking forwards use {@code message/stream} when the endpoint advertises streaming and a
 * single {@code message/send} with {@code blocking=true} otherwise. Non-blocking submissions
 * use {@code message/send} with {@code blocking=false} and a push-notification configuration
 * carrying the callback URL.
 */
public class JSONRPCForwardingClient implements ForwardingClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCForwardingClient.class);

    static final String PROXY_TASK_ID = "proxyTaskId";
    static final String TODOLIST_ID = "todolistId";

    private final JSONRPCForwardingClientConfig config;
    private final Map<String, HttpClient> httpClients = new ConcurrentHashMap<>();
    private final Map<String, AgentCard> agentCards = new ConcurrentHashMap<>();

    public JSONRPCForwardingClient() {
        this(new JSONRPCForwardingClientConfig());
    }

    public JSONRPCForwardingClient(JSONRPCForwardingClientConfig config) {
        Assert.checkNotNullParam("config", config);
        this.config = config;
    }

    @Override
    public BlockingOutcome send(ForwardRequest request, Endpoint endpoint) {
        Assert.checkNotNullParam("request", request);
        Assert.checkNotNullParam("endpoint", endpoint);
        boolean streaming = endpoint.supportsStreaming();
        QueueingEventStream stream = new QueueingEventStream(request.taskId(), config.getEventTimeout(),
                s -> {
                    if (streaming) {
                        startStreaming(s, request, endpoint);
                    } else {
                        startBlockingSend(s, request, endpoint);
                    }
                });
        return new BlockingOutcome(endpoint, streaming, stream);
    }

    private void startStreaming(QueueingEventStream stream, ForwardRequest request, Endpoint endpoint) {
        LOGGER.debug("Streaming task {} to {} ({})", request.taskId(), endpoint.displayName(), endpoint.url());
        String body;
        try {
            body = requestBody(JSONRPCRequest.SEND_STREAMING_MESSAGE_METHOD, request,
                    MessageSendConfiguration.blockingRequest());
        } catch (JsonProcessingException e) {
            stream.emit(ForwardedEvent.failed(FailureKind.INTERNAL, "Failed to prepare request: " + e.getMessage()));
            return;
        }

        EventTranslator translator = new EventTranslator();
        SSEEventListener listener = new SSEEventListener(
                event -> stream.emit(translator.translate(event)),
                error -> stream.emit(ForwardedEvent.failed(failureOf(error), translator.remoteTaskId())));

        CompletableFuture<HttpResponse> future = postBuilder(endpoint, body).asSSE().send();
        stream.onClose(() -> future.cancel(true));
        future.whenComplete((response, throwable) -> {
            if (throwable != null) {
                stream.emit(ForwardedEvent.failed(failureOf(throwable), null));
                return;
            }
            if (!response.success()) {
                stream.emit(ForwardedEvent.failed(statusRejection(response), null));
                return;
            }
            if (!isEventStream(response.contentType())) {
                // a JSON-RPC error, or a plain answer from an agent that does not stream after all
                response.body().whenComplete((text, error) -> {
                    if (error != null) {
                        stream.emit(ForwardedEvent.failed(failureOf(error), null));
                    } else {
                        stream.emit(parseBlockingResult(text, translator));
                    }
                });
                return;
            }
            HttpResponse.SseSubscription subscription = response.bodyAsSse(
                    listener::onMessage,
                    listener::onError,
                    () -> stream.emit(ForwardedEvent.failed(new FailureDetail(FailureKind.TRANSPORT,
                            "Event stream closed before a terminal event"), translator.remoteTaskId())));
            stream.onClose(subscription::cancel);
        });
    }

    private void startBlockingSend(QueueingEventStream stream, ForwardRequest request, Endpoint endpoint) {
        LOGGER.debug("Sending task {} to {} ({}) and waiting for the result", request.taskId(),
                endpoint.displayName(), endpoint.url());
        String body;
        try {
            body = requestBody(JSONRPCRequest.SEND_MESSAGE_METHOD, request, MessageSendConfiguration.blockingRequest());
        } catch (JsonProcessingException e) {
            stream.emit(ForwardedEvent.failed(FailureKind.INTERNAL, "Failed to prepare request: " + e.getMessage()));
            return;
        }
        EventTranslator translator = new EventTranslator();
        CompletableFuture<HttpResponse> future = postBuilder(endpoint, body).send();
        stream.onClose(() -> future.cancel(true));
        future.thenCompose(response -> {
            if (!response.success()) {
                return CompletableFuture.completedFuture(ForwardedEvent.failed(statusRejection(response), null));
            }
            return response.body().thenApply(text -> parseBlockingResult(text, translator));
        }).whenComplete((event, throwable) -> {
            if (throwable != null) {
                stream.emit(ForwardedEvent.failed(failureOf(throwable), null));
            } else {
                stream.emit(event);
            }
        });
    }

    private static ForwardedEvent parseBlockingResult(String body, EventTranslator translator) {
        try {
            return translator.translateBlockingResult(StreamingEvents.fromJson(JSONRPCResponses.result(body)));
        } catch (ProtocolRejectionException e) {
            return ForwardedEvent.failed(FailureDetail.from(e), translator.remoteTaskId());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return ForwardedEvent.failed(FailureKind.PROTOCOL_REJECTION, "Unreadable response from target agent: "
                    + e.getMessage());
        }
    }

    @Override
    public SubmissionOutcome sendAsync(ForwardRequest request, Endpoint endpoint, String callbackUrl) {
        Assert.checkNotNullParam("request", request);
        Assert.checkNotNullParam("endpoint", endpoint);
        Assert.checkNotBlankParam("callbackUrl", callbackUrl);
        LOGGER.debug("Submitting task {} to {} ({}) with callback {}", request.taskId(), endpoint.displayName(),
                endpoint.url(), callbackUrl);

        String responseBody;
        int status;
        long timeoutMillis = config.getSubmissionTimeout().toMillis();
        try {
            String body = requestBody(JSONRPCRequest.SEND_MESSAGE_METHOD, request,
                    MessageSendConfiguration.withCallback(callbackUrl));
            HttpResponse response = postBuilder(endpoint, body)
                    .timeout(config.getSubmissionTimeout())
                    .send()
                    .get(timeoutMillis, TimeUnit.MILLISECONDS);
            status = response.statusCode();
            responseBody = response.body().get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (JsonProcessingException e) {
            throw new TaskRelayException(FailureKind.INTERNAL, "Failed to prepare request: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SubmissionOutcome.transportError("Interrupted while submitting task " + request.taskId());
        } catch (ExecutionException e) {
            return SubmissionOutcome.transportError(describe(e.getCause()));
        } catch (TimeoutException e) {
            return SubmissionOutcome.transportError("Submission timed out after " + config.getSubmissionTimeout());
        }

        if (status < 200 || status >= 300) {
            return SubmissionOutcome.rejected(new FailureDetail(FailureKind.PROTOCOL_REJECTION,
                    "Target agent answered with HTTP status " + status));
        }
        try {
            StreamingEventKind event = StreamingEvents.fromJson(JSONRPCResponses.result(responseBody));
            if (event instanceof Task task) {
                TaskState state = task.status().state();
                if (state == TaskState.FAILED || state == TaskState.REJECTED || state == TaskState.CANCELED) {
                    String text = task.firstAgentMessageText();
                    return SubmissionOutcome.rejected(new FailureDetail(FailureKind.PROTOCOL_REJECTION,
                            text == null ? "Target agent reported state '" + state.asString() + "'" : text,
                            state.asString()));
                }
                return SubmissionOutcome.submitted(task.id(), state.asString(), task.firstAgentMessageText());
            }
            if (event instanceof MessageReply reply) {
                return SubmissionOutcome.submitted(reply.message().taskId(), null, reply.message().firstText());
            }
            return SubmissionOutcome.submitted(null, null, null);
        } catch (ProtocolRejectionException e) {
            return SubmissionOutcome.rejected(FailureDetail.from(e));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return SubmissionOutcome.rejected(new FailureDetail(FailureKind.PROTOCOL_REJECTION,
                    "Unreadable response from target agent: " + e.getMessage()));
        }
    }

    @Override
    public CompletableFuture<Boolean> cancelRemote(Endpoint endpoint, String remoteTaskId) {
        String body;
        try {
            body = Utils.toJsonString(JSONRPCRequest.of(JSONRPCRequest.CANCEL_TASK_METHOD, new TaskIdParams(remoteTaskId)));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        return postBuilder(endpoint, body)
                .timeout(config.getSubmissionTimeout())
                .send()
                .thenCompose(response -> response.body().thenApply(text -> {
                    if (!response.success()) {
                        LOGGER.info("Remote cancel of {} at {} refused with HTTP status {}", remoteTaskId,
                                endpoint.url(), response.statusCode());
                        return false;
                    }
                    try {
                        JSONRPCResponses.result(text);
                        return true;
                    } catch (ProtocolRejectionException | JsonProcessingException e) {
                        LOGGER.info("Remote cancel of {} at {} refused: {}", remoteTaskId, endpoint.url(), e.getMessage());
                        return false;
                    }
                }))
                .exceptionally(throwable -> {
                    LOGGER.info("Remote cancel of {} at {} failed: {}", remoteTaskId, endpoint.url(), describe(throwable));
                    return false;
                });
    }

    @Override
    public AgentCard fetchAgentCard(Endpoint endpoint) {
        AgentCard cached = agentCards.get(endpoint.url());
        if (cached != null) {
            return cached;
        }
        AgentCard card = new AgentCardResolver(httpClient(endpoint), agentPath(endpoint), config.getSubmissionTimeout())
                .getAgentCard();
        LOGGER.debug("Agent card for {}: streaming={}, pushNotifications={}", endpoint.url(),
                card.capabilities().streaming(), card.capabilities().pushNotifications());
        agentCards.put(endpoint.url(), card);
        return card;
    }

    public void clearAgentCardCache() {
        agentCards.clear();
    }

    private String requestBody(String method, ForwardRequest request, MessageSendConfiguration configuration)
            throws JsonProcessingException {
        Message message = new Message(Role.USER, List.of(Part.text(request.text())), UUID.randomUUID().toString(),
                null, null, Map.of(PROXY_TASK_ID, request.taskId(), TODOLIST_ID, request.todolistId()),
                Message.MESSAGE);
        return Utils.toJsonString(JSONRPCRequest.of(method, new MessageSendParams(message, configuration, null)));
    }

    private HttpClient.PostRequestBuilder postBuilder(Endpoint endpoint, String body) {
        return httpClient(endpoint).post(agentPath(endpoint))
                .addHeader("Content-Type", "application/json")
                .body(body);
    }

    private HttpClient httpClient(Endpoint endpoint) {
        return httpClients.computeIfAbsent(endpoint.url(), url -> config.getHttpClientBuilder().create(url));
    }

    private static String agentPath(Endpoint endpoint) {
        String path = URI.create(endpoint.url()).getRawPath();
        if (path == null) {
            return "";
        }
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private static boolean isEventStream(@Nullable String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("text/event-stream");
    }

    private static FailureDetail statusRejection(HttpResponse response) {
        return new FailureDetail(FailureKind.PROTOCOL_REJECTION,
                "Target agent answered with HTTP status " + response.statusCode());
    }

    static FailureDetail failureOf(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof TaskRelayException e) {
            return FailureDetail.from(e);
        }
        if (cause instanceof IOException) {
            return new FailureDetail(FailureKind.TRANSPORT, describe(cause));
        }
        return new FailureDetail(FailureKind.INTERNAL, describe(cause));
    }

    private static String describe(@Nullable Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause == null) {
            return "Unknown transport failure";
        }
        if (cause instanceof ConnectException) {
            return "Connection refused: " + Utils.defaultIfNull(cause.getMessage(), cause.getClass().getSimpleName());
        }
        if (cause instanceof HttpTimeoutException) {
            return "Timed out: " + cause.getMessage();
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    private static @Nullable Throwable unwrap(@Nullable Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
