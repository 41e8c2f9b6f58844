package io.taskrelay.server.executor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a proxied task inside the executor.
 * <pre>
 * CREATED -&gt; RESOLVING -&gt; DISPATCHING -&gt; STREAMING | AWAITING_CALLBACK -&gt; COMPLETED | FAILED | CANCELLED
 * </pre>
 * Any non-terminal phase may move straight to {@link #FAILED} or {@link #CANCELLED}.
 * {@link #AWAITING_CALLBACK} is where the executor lets go; the webhook receiver finishes the
 * task from there, so the executor never leaves it.
 */
public enum TaskPhase {
    CREATED,
    RESOLVING,
    DISPATCHING,
    STREAMING,
    AWAITING_CALLBACK,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    boolean canMoveTo(TaskPhase next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return successors().contains(next);
    }

    private Set<TaskPhase> successors() {
        switch (this) {
            case CREATED:
                return EnumSet.of(RESOLVING);
            case RESOLVING:
                return EnumSet.of(DISPATCHING);
            case DISPATCHING:
                return EnumSet.of(STREAMING, AWAITING_CALLBACK);
            case STREAMING:
                return EnumSet.of(COMPLETED);
            default:
                return EnumSet.noneOf(TaskPhase.class);
        }
    }
}
