package io.taskrelay.server.store;

import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.TaskRelayException;
import org.jspecify.annotations.Nullable;

/**
 * Failure of the storage behind an {@link EventStore}.
 * <p>
 * The executor turns it into a {@link FailureKind#INTERNAL} failure; the webhook receiver
 * answers the delivery with an error so that the target may retry.
 */
public class EventStoreException extends TaskRelayException {

    private final @Nullable String todolistId;

    public EventStoreException(String msg) {
        this(null, msg);
    }

    public EventStoreException(@Nullable String todolistId, String msg) {
        super(FailureKind.INTERNAL, msg);
        this.todolistId = todolistId;
    }

    public EventStoreException(@Nullable String todolistId, String msg, Throwable cause) {
        super(FailureKind.INTERNAL, msg, cause);
        this.todolistId = todolistId;
    }

    /**
     * @return the key the failed operation was about, or null if not tied to one
     */
    public @Nullable String getTodolistId() {
        return todolistId;
    }
}
