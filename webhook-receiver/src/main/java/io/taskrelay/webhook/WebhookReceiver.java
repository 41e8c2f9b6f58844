package io.taskrelay.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.server.executor.CallbackUrl;
import io.taskrelay.server.store.AppendResult;
import io.taskrelay.server.store.EventStore;
import io.taskrelay.spec.CallbackClassificationException;
import io.taskrelay.spec.ProxyEvent;
import io.taskrelay.spec.ProxyEventKind;
import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the outcome of non-blocking tasks delivered by push notification.
 * <p>
 * Holds no state of its own: the todolist id in the callback path is the only correlation key,
 * and the {@link EventStore} guard makes repeated or concurrent deliveries of the same outcome
 * harmless. A delivery may arrive before the executor has recorded
 * {@link ProxyEventKind#ACCEPTED}; it is recorded all the same.
 * <p>
 * Only an invalid todolist id or a body that is empty or not JSON is rejected. Any other body
 * the classifier cannot map is recorded as a {@link io.taskrelay.spec.FailureKind#CLASSIFICATION}
 * failure and acknowledged.
 */
public class WebhookReceiver {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookReceiver.class);

    private final EventStore eventStore;
    private final NotificationClassifier classifier;

    public WebhookReceiver(EventStore eventStore) {
        this(eventStore, new NotificationClassifier());
    }

    public WebhookReceiver(EventStore eventStore, NotificationClassifier classifier) {
        this.eventStore = Assert.checkNotNullParam("eventStore", eventStore);
        this.classifier = Assert.checkNotNullParam("classifier", classifier);
    }

    /**
     * @param todolistId the correlation key from the callback path
     * @param payload the raw request body
     * @throws io.taskrelay.server.store.EventStoreException if the store fails; the delivery
     * should then be answered with a server error so the target can retry
     */
    public ReceiveResult receive(@Nullable String todolistId, @Nullable String payload) {
        if (!CallbackUrl.isValidTodolistId(todolistId)) {
            LOGGER.warn("Rejecting notification with invalid todolist id: {}", todolistId);
            return ReceiveResult.rejected(todolistId, "Invalid todolist id");
        }
        if (payload == null || payload.isBlank()) {
            LOGGER.warn("Rejecting empty notification for todolist {}", todolistId);
            return ReceiveResult.rejected(todolistId, "Empty body");
        }
        JsonNode body;
        try {
            body = Utils.OBJECT_MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Rejecting notification with invalid JSON for todolist {}: {}", todolistId, e.getOriginalMessage());
            return ReceiveResult.rejected(todolistId, "Invalid JSON");
        }
        return receive(todolistId, body);
    }

    public ReceiveResult receive(String todolistId, JsonNode body) {
        if (!CallbackUrl.isValidTodolistId(todolistId)) {
            LOGGER.warn("Rejecting notification with invalid todolist id: {}", todolistId);
            return ReceiveResult.rejected(todolistId, "Invalid todolist id");
        }
        Classification classification;
        try {
            classification = classifier.classify(body);
        } catch (CallbackClassificationException e) {
            LOGGER.warn("Notification for todolist {} could not be classified: {}", todolistId, e.getMessage());
            classification = classifier.unclassifiable(body, String.valueOf(e.getMessage()));
        }
        LOGGER.info("Notification for todolist {}: a2a task {}, state {}, type {}", todolistId,
                classification.remoteTaskId(), classification.remoteState(), classification.type().asString());

        if (!classification.isTerminal()) {
            return ReceiveResult.ack(todolistId, classification.remoteTaskId(), classification.type(),
                    ReceiveResult.Disposition.IGNORED);
        }

        ProxyEvent event = classification.toEvent(proxyTaskId(todolistId, classification.remoteTaskId()));
        AppendResult result = eventStore.append(todolistId, event);
        ReceiveResult.Disposition disposition;
        switch (result.status()) {
            case APPENDED:
                disposition = ReceiveResult.Disposition.RECORDED;
                LOGGER.info("Recorded {} for todolist {}", event, todolistId);
                break;
            case UNKNOWN_TASK:
                disposition = ReceiveResult.Disposition.UNKNOWN;
                LOGGER.info("Todolist {} is no longer known, notification dropped", todolistId);
                break;
            default:
                disposition = ReceiveResult.Disposition.DUPLICATE;
                LOGGER.info("Todolist {} already finished, duplicate notification dropped", todolistId);
                break;
        }
        return ReceiveResult.ack(todolistId, classification.remoteTaskId(), classification.type(), disposition);
    }

    /**
     * The proxy-side task id recorded with ACCEPTED, or the todolist id when no ACCEPTED exists.
     */
    private String proxyTaskId(String todolistId, @Nullable String remoteTaskId) {
        for (ProxyEvent recorded : eventStore.events(todolistId)) {
            if (recorded.kind() == ProxyEventKind.ACCEPTED) {
                Object acceptedRemoteId = recorded.payload().get(ProxyEvent.REMOTE_TASK_ID);
                if (remoteTaskId != null && acceptedRemoteId != null && !remoteTaskId.equals(acceptedRemoteId)) {
                    LOGGER.warn("Notification for todolist {} names a2a task {}, but {} was accepted", todolistId,
                            remoteTaskId, acceptedRemoteId);
                }
                return recorded.taskId();
            }
        }
        return todolistId;
    }
}
