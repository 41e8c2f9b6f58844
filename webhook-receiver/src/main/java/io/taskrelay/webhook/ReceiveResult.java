package io.taskrelay.webhook;

import org.jspecify.annotations.Nullable;

/**
 * Answer to one webhook delivery.
 *
 * @param status whether the delivery was acknowledged
 * @param todolistId the correlation key from the callback path
 * @param remoteTaskId the target-side task id from the body, if it could be read
 * @param notificationType the classification of the body, if it could be read
 * @param disposition what happened to the store
 * @param reason why the delivery was rejected
 */
public record ReceiveResult(Status status, @Nullable String todolistId, @Nullable String remoteTaskId,
                            @Nullable NotificationType notificationType, Disposition disposition,
                            @Nullable String reason) {

    public enum Status {
        ACK,
        REJECTED
    }

    public enum Disposition {
        /** The terminal event was written. */
        RECORDED,
        /** A terminal event already existed; nothing was written. */
        DUPLICATE,
        /** The notification is not terminal; nothing was written. */
        IGNORED,
        /** The task was evicted; nothing was written. */
        UNKNOWN,
        /** The delivery was rejected before reaching the store. */
        NONE
    }

    public static ReceiveResult ack(String todolistId, @Nullable String remoteTaskId, NotificationType type,
                                    Disposition disposition) {
        return new ReceiveResult(Status.ACK, todolistId, remoteTaskId, type, disposition, null);
    }

    public static ReceiveResult rejected(@Nullable String todolistId, String reason) {
        return new ReceiveResult(Status.REJECTED, todolistId, null, null, Disposition.NONE, reason);
    }

    public boolean isAck() {
        return status == Status.ACK;
    }
}
