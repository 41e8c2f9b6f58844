package io.taskrelay.server.executor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.taskrelay.client.BlockingOutcome;
import io.taskrelay.client.EventStream;
import io.taskrelay.client.ForwardRequest;
import io.taskrelay.client.ForwardedEvent;
import io.taskrelay.client.ForwardingClient;
import io.taskrelay.client.SubmissionOutcome;
import io.taskrelay.client.jsonrpc.JSONRPCForwardingClient;
import io.taskrelay.client.jsonrpc.JSONRPCForwardingClientConfig;
import io.taskrelay.server.agentexecution.AgentExecutor;
import io.taskrelay.server.agentexecution.RequestContext;
import io.taskrelay.server.config.ProxyConfig;
import io.taskrelay.server.events.EventQueue;
import io.taskrelay.server.resolver.EndpointResolver;
import io.taskrelay.server.resolver.ResolvedEndpoint;
import io.taskrelay.server.store.AppendResult;
import io.taskrelay.server.store.EventStore;
import io.taskrelay.server.store.EventStoreException;
import io.taskrelay.spec.AgentCapabilities;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.DeliveryMode;
import io.taskrelay.spec.Endpoint;
import io.taskrelay.spec.FailureDetail;
import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.ProxyEvent;
import io.taskrelay.spec.ProxyEventKind;
import io.taskrelay.spec.TaskRelayException;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AgentExecutor} that relays each task to a remote agent.
 * <p>
 * In blocking mode it drains the target's event stream and republishes every event to the
 * caller's queue as it arrives. In non-blocking mode it hands the target a callback URL, records
 * {@link ProxyEventKind#ACCEPTED} and returns; the webhook receiver records the outcome later.
 * <p>
 * {@code execute} never throws: every failure ends up as a terminal
 * {@link ProxyEventKind#FAILED} event, recorded in the {@link EventStore} and published to the
 * caller.
 */
@ApplicationScoped
public class ProxyAgentExecutor implements AgentExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProxyAgentExecutor.class);

    static final String FEEDBACK_HEADER = "[Feedback]";
    static final String AGENT_NAME = "agentName";
    static final String AGENT_PROFILE = "agentProfile";
    static final String CALLBACK_URL = "callbackUrl";

    private final ForwardingClient forwardingClient;
    private final EventStore eventStore;
    private final EndpointResolver endpointResolver;
    private final ProxyConfig config;

    // tasks whose execute() is still on the stack
    private final Map<String, ProxyTask> running = new ConcurrentHashMap<>();

    @Inject
    public ProxyAgentExecutor(ForwardingClient forwardingClient, EventStore eventStore, ProxyConfig config) {
        this(forwardingClient, eventStore, new EndpointResolver(config.defaultEndpoint()), config);
    }

    public ProxyAgentExecutor(ForwardingClient forwardingClient, EventStore eventStore,
                              EndpointResolver endpointResolver, ProxyConfig config) {
        this.forwardingClient = Assert.checkNotNullParam("forwardingClient", forwardingClient);
        this.eventStore = Assert.checkNotNullParam("eventStore", eventStore);
        this.endpointResolver = Assert.checkNotNullParam("endpointResolver", endpointResolver);
        this.config = Assert.checkNotNullParam("config", config);
    }

    /**
     * Creates an executor forwarding over JSON-RPC with the timeouts of the given configuration.
     */
    public static ProxyAgentExecutor create(ProxyConfig config, EventStore eventStore) {
        JSONRPCForwardingClientConfig clientConfig = JSONRPCForwardingClientConfig.builder()
                .eventTimeout(config.eventTimeout())
                .submissionTimeout(config.submissionTimeout())
                .build();
        return new ProxyAgentExecutor(new JSONRPCForwardingClient(clientConfig), eventStore, config);
    }

    @Override
    public void execute(RequestContext context, EventQueue eventQueue) {
        ProxyTask task = new ProxyTask(context.getTaskId(), context.getTodolistId(), context.getContextId());
        if (running.putIfAbsent(task.getTaskId(), task) != null) {
            LOGGER.warn("Task {} is already executing, refusing a second execution", task.getTaskId());
            eventQueue.enqueueEvent(ProxyEvent.failed(task.getTaskId(),
                    new FailureDetail(FailureKind.INTERNAL, "Task " + task.getTaskId() + " is already executing")));
            return;
        }
        LOGGER.info("Executing task {} (todolist {})", task.getTaskId(), task.getTodolistId());
        try {
            task.moveTo(TaskPhase.RESOLVING);
            ResolvedEndpoint resolved = endpointResolver.resolve(context);
            task.setEndpoint(resolved.endpoint());

            DeliveryMode mode = chooseMode(task, resolved);
            task.setMode(mode);
            task.moveTo(TaskPhase.DISPATCHING);

            ForwardRequest request = new ForwardRequest(task.getTaskId(), task.getTodolistId(),
                    task.getContextId(), messageOf(context));
            if (mode == DeliveryMode.NON_BLOCKING) {
                dispatchNonBlocking(task, request, resolved, eventQueue);
            } else {
                dispatchBlocking(task, request, eventQueue);
            }
        } catch (TaskRelayException e) {
            LOGGER.warn("Task {} failed: {} {}", task.getTaskId(), e.getFailureKind(), e.getMessage());
            fail(task, FailureDetail.from(e), eventQueue);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error executing task {}", task.getTaskId(), e);
            fail(task, new FailureDetail(FailureKind.INTERNAL, "Unexpected error: " + e), eventQueue);
        } finally {
            running.remove(task.getTaskId(), task);
            LOGGER.debug("Leaving execute for {}", task);
        }
    }

    /**
     * Cancels a blocking task whose {@code execute} is still running. The draining thread then
     * records and publishes the {@link FailureKind#CANCELLED} terminal. Non-blocking and unknown
     * tasks are left alone.
     */
    @Override
    public void cancel(RequestContext context, EventQueue eventQueue) {
        ProxyTask task = running.get(context.getTaskId());
        if (task == null) {
            LOGGER.info("Cancel requested for task {}, which is not executing here; nothing to do", context.getTaskId());
            return;
        }
        if (task.getMode() == DeliveryMode.NON_BLOCKING) {
            LOGGER.info("Cancel requested for non-blocking task {}; the target is not contacted", task.getTaskId());
            return;
        }
        EventStream stream = task.requestCancel();
        if (stream == null) {
            LOGGER.info("Cancel requested for task {} before its stream was opened", task.getTaskId());
            return;
        }
        LOGGER.info("Cancelling stream of task {}", task.getTaskId());
        String remoteTaskId = stream.remoteTaskId();
        stream.cancel();
        Endpoint endpoint = task.getEndpoint();
        if (remoteTaskId != null && endpoint != null) {
            forwardingClient.cancelRemote(endpoint, remoteTaskId)
                    .thenAccept(accepted -> LOGGER.debug("Remote cancel of {} for task {} accepted: {}",
                            remoteTaskId, task.getTaskId(), accepted));
        }
    }

    private DeliveryMode chooseMode(ProxyTask task, ResolvedEndpoint resolved) {
        String reasonNoWebhook = null;
        if (!config.webhookEnabled()) {
            reasonNoWebhook = "no public base URL is configured";
        } else if (!CallbackUrl.isValidTodolistId(task.getTodolistId())) {
            reasonNoWebhook = "todolist id " + task.getTodolistId() + " cannot be carried in a callback URL";
        }

        DeliveryMode requested = resolved.requestedMode();
        if (requested == DeliveryMode.BLOCKING) {
            return DeliveryMode.BLOCKING;
        }
        if (requested == DeliveryMode.NON_BLOCKING) {
            if (reasonNoWebhook != null) {
                LOGGER.warn("Non-blocking delivery requested for task {} but {}, using blocking mode",
                        task.getTaskId(), reasonNoWebhook);
                return DeliveryMode.BLOCKING;
            }
            return DeliveryMode.NON_BLOCKING;
        }
        if (reasonNoWebhook != null) {
            return DeliveryMode.BLOCKING;
        }

        Endpoint endpoint = resolved.endpoint();
        Boolean push = endpoint.pushNotifications();
        if (push == null) {
            try {
                AgentCard card = forwardingClient.fetchAgentCard(endpoint);
                endpoint = endpoint.withCapabilities(merge(endpoint.capabilities(), card.capabilities()));
                task.setEndpoint(endpoint);
                push = endpoint.pushNotifications();
            } catch (RuntimeException e) {
                LOGGER.warn("Could not read agent card of {} for task {}, using blocking mode: {}",
                        endpoint.url(), task.getTaskId(), e.getMessage());
                return DeliveryMode.BLOCKING;
            }
        }
        DeliveryMode mode = Boolean.TRUE.equals(push) ? DeliveryMode.NON_BLOCKING : DeliveryMode.BLOCKING;
        LOGGER.debug("Automatic delivery mode for task {}: {}", task.getTaskId(), mode);
        return mode;
    }

    private static AgentCapabilities merge(AgentCapabilities known, AgentCapabilities advertised) {
        return new AgentCapabilities(
                known.streaming() != null ? known.streaming() : advertised.streaming(),
                known.pushNotifications() != null ? known.pushNotifications() : advertised.pushNotifications());
    }

    private void dispatchBlocking(ProxyTask task, ForwardRequest request, EventQueue eventQueue) {
        Endpoint endpoint = endpointOf(task);
        BlockingOutcome outcome = forwardingClient.send(request, endpoint);
        LOGGER.info("Forwarding task {} to {} in blocking mode ({})", task.getTaskId(), endpoint.displayName(),
                outcome.streaming() ? "message/stream" : "message/send");
        try (EventStream stream = outcome.events()) {
            if (!task.attach(stream)) {
                stream.cancel();
            }
            task.moveTo(TaskPhase.STREAMING);
            while (stream.hasNext()) {
                ForwardedEvent event = stream.next();
                if (!event.isTerminal()) {
                    eventQueue.enqueueEvent(progressEvent(task, event));
                    continue;
                }
                if (event.kind() == ForwardedEvent.Kind.COMPLETED) {
                    task.moveTo(TaskPhase.COMPLETED);
                    finish(task, completedEvent(task, event), eventQueue);
                } else {
                    FailureDetail failure = failureOf(event);
                    task.moveTo(failure.kind() == FailureKind.CANCELLED ? TaskPhase.CANCELLED : TaskPhase.FAILED);
                    finish(task, failedEvent(task, failure, event.remoteTaskId()), eventQueue);
                }
                LOGGER.info("Task {} finished: {}", task.getTaskId(), task.getPhase());
            }
        } finally {
            task.detach();
        }
    }

    private void dispatchNonBlocking(ProxyTask task, ForwardRequest request, ResolvedEndpoint resolved,
                                     EventQueue eventQueue) {
        Endpoint endpoint = endpointOf(task);
        String callbackUrl = CallbackUrl.of(config.publicBaseUrl(), config.protocol(), task.getTodolistId());
        LOGGER.info("Forwarding task {} to {} in non-blocking mode, callback {}", task.getTaskId(),
                endpoint.displayName(), callbackUrl);

        SubmissionOutcome outcome = forwardingClient.sendAsync(request, endpoint, callbackUrl);
        if (!outcome.isSubmitted()) {
            FailureDetail failure = outcome.failure() != null
                    ? outcome.failure()
                    : new FailureDetail(FailureKind.INTERNAL, "Submission failed: " + outcome.status());
            LOGGER.warn("Submission of task {} to {} failed: {} {}", task.getTaskId(), endpoint.url(),
                    outcome.status(), failure.message());
            fail(task, failure, eventQueue);
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        putIfNotNull(payload, ProxyEvent.REMOTE_TASK_ID, outcome.remoteTaskId());
        putIfNotNull(payload, ProxyEvent.REMOTE_STATE, outcome.remoteState());
        putIfNotNull(payload, ProxyEvent.MESSAGE, outcome.agentMessage());
        payload.put(ProxyEvent.ENDPOINT, endpoint.url());
        payload.put(AGENT_NAME, endpoint.displayName());
        putIfNotNull(payload, AGENT_PROFILE, resolved.profile());
        payload.put(CALLBACK_URL, callbackUrl);
        ProxyEvent accepted = ProxyEvent.accepted(task.getTaskId(), payload);

        // the target already owns the task; a store failure must not fail it here
        try {
            AppendResult result = eventStore.append(task.getTodolistId(), accepted);
            if (!result.isWritten()) {
                LOGGER.warn("ACCEPTED for todolist {} not recorded: {}", task.getTodolistId(), result.status());
            }
        } catch (EventStoreException e) {
            LOGGER.error("Failed to record ACCEPTED for todolist {}", task.getTodolistId(), e);
        }
        eventQueue.enqueueEvent(accepted);
        task.moveTo(TaskPhase.AWAITING_CALLBACK);
        LOGGER.info("Task {} accepted by {} as {}, awaiting callback", task.getTaskId(), endpoint.url(),
                outcome.remoteTaskId());
    }

    private void fail(ProxyTask task, FailureDetail failure, EventQueue eventQueue) {
        if (task.getPhase().isTerminal()) {
            LOGGER.debug("Task {} already {}, not publishing {}", task.getTaskId(), task.getPhase(), failure.kind());
            return;
        }
        task.moveTo(failure.kind() == FailureKind.CANCELLED ? TaskPhase.CANCELLED : TaskPhase.FAILED);
        finish(task, ProxyEvent.failed(task.getTaskId(), failure), eventQueue);
    }

    /**
     * Records a terminal event, then publishes it. A store failure is logged; the caller still
     * gets the event.
     */
    private void finish(ProxyTask task, ProxyEvent terminal, EventQueue eventQueue) {
        try {
            AppendResult result = eventStore.append(task.getTodolistId(), terminal);
            if (!result.isWritten()) {
                LOGGER.warn("{} for todolist {} not recorded: {}", terminal.kind(), task.getTodolistId(),
                        result.status());
            }
        } catch (EventStoreException e) {
            LOGGER.error("Failed to record {} for todolist {}", terminal.kind(), task.getTodolistId(), e);
        }
        eventQueue.enqueueEvent(terminal);
    }

    private ProxyEvent progressEvent(ProxyTask task, ForwardedEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        putIfNotNull(payload, ProxyEvent.MESSAGE, event.text());
        putIfNotNull(payload, ProxyEvent.REMOTE_TASK_ID, event.remoteTaskId());
        putIfNotNull(payload, ProxyEvent.REMOTE_STATE, event.remoteState());
        return new ProxyEvent(task.getTaskId(), ProxyEventKind.PROGRESS, event.sequenceHint(), payload, null);
    }

    private ProxyEvent completedEvent(ProxyTask task, ForwardedEvent event) {
        Map<String, Object> extra = new LinkedHashMap<>();
        putIfNotNull(extra, ProxyEvent.REMOTE_TASK_ID, event.remoteTaskId());
        Endpoint endpoint = task.getEndpoint();
        if (endpoint != null) {
            extra.put(ProxyEvent.ENDPOINT, endpoint.url());
            extra.put(AGENT_NAME, endpoint.displayName());
        }
        String text = event.text();
        return ProxyEvent.completed(task.getTaskId(), text == null ? "Task completed" : text, extra);
    }

    private static ProxyEvent failedEvent(ProxyTask task, FailureDetail failure, @Nullable String remoteTaskId) {
        ProxyEvent failed = ProxyEvent.failed(task.getTaskId(), failure);
        if (remoteTaskId == null) {
            return failed;
        }
        Map<String, Object> payload = new LinkedHashMap<>(failed.payload());
        payload.put(ProxyEvent.REMOTE_TASK_ID, remoteTaskId);
        return new ProxyEvent(failed.taskId(), failed.kind(), null, payload, failed.timestamp());
    }

    private static FailureDetail failureOf(ForwardedEvent event) {
        FailureDetail failure = event.failure();
        if (failure != null) {
            return failure;
        }
        return new FailureDetail(FailureKind.INTERNAL, event.text() == null ? "Task failed" : event.text(),
                event.remoteState());
    }

    private static Endpoint endpointOf(ProxyTask task) {
        Endpoint endpoint = task.getEndpoint();
        if (endpoint == null) {
            throw new IllegalStateException("Task " + task.getTaskId() + " has no endpoint");
        }
        return endpoint;
    }

    /**
     * The request text, followed by the newest caller feedback (by {@code time}) under a
     * {@value #FEEDBACK_HEADER} header.
     */
    static String messageOf(RequestContext context) {
        String message = context.getUserInput();
        List<Map<String, Object>> feedback = context.getFeedback();
        Map<String, Object> latest = null;
        String latestTime = null;
        for (Map<String, Object> entry : feedback) {
            Object time = entry.get("time");
            String value = time == null ? "" : time.toString();
            if (latest == null || value.compareTo(latestTime) > 0) {
                latest = entry;
                latestTime = value;
            }
        }
        if (latest == null) {
            return message;
        }
        Object content = latest.get("content");
        if (content == null || content.toString().isBlank()) {
            return message;
        }
        return message + "\n\n" + FEEDBACK_HEADER + "\n" + content;
    }

    private static void putIfNotNull(Map<String, Object> map, String key, @Nullable Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
