package io.taskrelay.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.spec.CallbackClassificationException;
import io.taskrelay.spec.FailureDetail;
import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.StreamingEvents;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskArtifactUpdateEvent;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TaskStatus;
import io.taskrelay.spec.TaskStatusUpdateEvent;
import org.jspecify.annotations.Nullable;

/**
 * Maps a push-notification body onto a {@link Classification}.
 * <p>
 * The body is normally a full task; status and artifact update events are accepted too.
 * <ul>
 *   <li>{@code completed}: the result is the last agent message of the history, else the status
 *       message, else the artifacts, else {@code "Task completed"};</li>
 *   <li>{@code failed}, {@code rejected}, {@code canceled}: a protocol rejection carrying the
 *       target's message;</li>
 *   <li>{@code input-required}, {@code auth-required}: a protocol rejection, since nobody can
 *       answer the target in webhook mode;</li>
 *   <li>{@code submitted}, {@code working} and artifact updates: not terminal;</li>
 *   <li>any other state: a {@link FailureKind#CLASSIFICATION} failure.</li>
 * </ul>
 * Bodies that are valid JSON but not a task or task update are turned into a
 * {@link FailureKind#CLASSIFICATION} failure by {@link #unclassifiable(JsonNode, String)}.
 */
public class NotificationClassifier {

    static final String INTERACTIVE_INPUT_UNSUPPORTED = "Interactive input is not supported in webhook mode";

    /**
     * @throws CallbackClassificationException if the body is not a task or task update event
     */
    public Classification classify(JsonNode body) {
        StreamingEventKind notification;
        try {
            notification = StreamingEvents.fromJson(body);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CallbackClassificationException("Unreadable notification: " + e.getMessage(), e);
        }
        String rawState = body.path("status").path("state").asText("unknown");

        if (notification instanceof Task task) {
            String result = firstNonNull(task.lastAgentMessageText(), statusText(task.status()), task.artifactsText());
            return classify(task.status().state(), rawState, task.id(), result);
        }
        if (notification instanceof TaskStatusUpdateEvent update) {
            return classify(update.status().state(), rawState, update.taskId(), statusText(update.status()));
        }
        if (notification instanceof TaskArtifactUpdateEvent update) {
            return new Classification(NotificationType.WORKING, "working", update.taskId(), null, null);
        }
        throw new CallbackClassificationException("Unsupported notification kind: " + notification.kind());
    }

    /**
     * Classification of a body {@link #classify(JsonNode)} could not map. The remote task id and
     * state are taken from the body where it has them.
     */
    public Classification unclassifiable(JsonNode body, String reason) {
        JsonNode status = body.path("status");
        String rawState = status.isTextual() ? status.asText() : status.path("state").asText("unknown");
        String remoteTaskId = textOf(body.path("id"));
        if (remoteTaskId == null) {
            remoteTaskId = textOf(body.path("taskId"));
        }
        return new Classification(NotificationType.OTHER, rawState, remoteTaskId, null,
                new FailureDetail(FailureKind.CLASSIFICATION, reason, rawState));
    }

    private static @Nullable String textOf(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }

    private static Classification classify(TaskState state, String rawState, @Nullable String remoteTaskId,
                                            @Nullable String text) {
        NotificationType type = NotificationType.of(state);
        switch (type) {
            case COMPLETED:
                return new Classification(type, rawState, remoteTaskId, text, null);
            case FAILED:
            case CANCELED:
                return new Classification(type, rawState, remoteTaskId, null, new FailureDetail(
                        FailureKind.PROTOCOL_REJECTION,
                        text == null ? "A2A task " + state.asString() : text,
                        rawState));
            case INPUT_REQUIRED:
                return new Classification(type, rawState, remoteTaskId, null, new FailureDetail(
                        FailureKind.PROTOCOL_REJECTION,
                        text == null ? INTERACTIVE_INPUT_UNSUPPORTED : INTERACTIVE_INPUT_UNSUPPORTED + ": " + text,
                        rawState));
            case WORKING:
                return new Classification(type, rawState, remoteTaskId, null, null);
            default:
                return new Classification(type, rawState, remoteTaskId, null, new FailureDetail(
                        FailureKind.CLASSIFICATION, "Unrecognised task state: " + rawState, rawState));
        }
    }

    private static @Nullable String statusText(TaskStatus status) {
        return status.message() == null ? null : status.message().firstText();
    }

    private static @Nullable String firstNonNull(@Nullable String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
