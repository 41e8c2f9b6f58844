package io.taskrelay.webhook;

import java.util.LinkedHashMap;
import java.util.Map;

import io.taskrelay.spec.FailureDetail;
import io.taskrelay.spec.ProxyEvent;
import org.jspecify.annotations.Nullable;

/**
 * What a push notification says about the remote task.
 *
 * @param type the notification type
 * @param remoteState the raw state string the target reported
 * @param remoteTaskId the target-side task id
 * @param result the result text, for {@link NotificationType#COMPLETED}
 * @param failure why the task failed, for terminal types other than completed
 */
public record Classification(NotificationType type, String remoteState, @Nullable String remoteTaskId,
                             @Nullable String result, @Nullable FailureDetail failure) {

    /**
     * @return whether the notification ends the task; non-terminal notifications are acknowledged
     * without being recorded
     */
    public boolean isTerminal() {
        return type != NotificationType.WORKING;
    }

    /**
     * @throws IllegalStateException for non-terminal notifications
     */
    public ProxyEvent toEvent(String taskId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (remoteTaskId != null) {
            payload.put(ProxyEvent.REMOTE_TASK_ID, remoteTaskId);
        }
        payload.put(ProxyEvent.CLASSIFICATION, type.asString());
        if (type == NotificationType.COMPLETED) {
            payload.put(ProxyEvent.REMOTE_STATE, remoteState);
            return ProxyEvent.completed(taskId, result == null ? "Task completed" : result, payload);
        }
        if (failure == null) {
            throw new IllegalStateException("No terminal event for a " + type + " notification");
        }
        ProxyEvent failed = ProxyEvent.failed(taskId, failure);
        payload.putAll(failed.payload());
        return new ProxyEvent(taskId, failed.kind(), null, payload, failed.timestamp());
    }
}
