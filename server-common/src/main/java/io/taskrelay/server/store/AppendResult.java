package io.taskrelay.server.store;

import io.taskrelay.spec.ProxyEvent;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link EventStore#append}.
 *
 * @param status what happened to the event
 * @param position index of the event in the key's log when written, otherwise the log size
 * @param existing the previously recorded event that caused a rejection
 */
public record AppendResult(Status status, int position, @Nullable ProxyEvent existing) {

    public enum Status {
        APPENDED,
        /** An identical kind of event (second ACCEPTED, same terminal kind) was already recorded. */
        DUPLICATE,
        /** A terminal event of another kind was recorded first. */
        ALREADY_TERMINAL,
        /** The key was evicted. */
        UNKNOWN_TASK
    }

    public static AppendResult appended(int position) {
        return new AppendResult(Status.APPENDED, position, null);
    }

    public boolean isWritten() {
        return status == Status.APPENDED;
    }
}
