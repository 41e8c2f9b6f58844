package io.taskrelay.server.executor;

import io.taskrelay.client.EventStream;
import io.taskrelay.spec.DeliveryMode;
import io.taskrelay.spec.Endpoint;
import org.jspecify.annotations.Nullable;

/**
 * Executor-side state of one task while {@code execute} runs.
 * <p>
 * Owned by the executing thread; {@link #requestCancel()} is the only method other threads call.
 */
public class ProxyTask {

    private final String taskId;
    private final String todolistId;
    private final @Nullable String contextId;

    private volatile TaskPhase phase = TaskPhase.CREATED;
    private volatile @Nullable DeliveryMode mode;
    private volatile @Nullable Endpoint endpoint;

    private @Nullable EventStream stream;
    private boolean cancelRequested;

    public ProxyTask(String taskId, String todolistId, @Nullable String contextId) {
        this.taskId = taskId;
        this.todolistId = todolistId;
        this.contextId = contextId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTodolistId() {
        return todolistId;
    }

    public @Nullable String getContextId() {
        return contextId;
    }

    public TaskPhase getPhase() {
        return phase;
    }

    public @Nullable DeliveryMode getMode() {
        return mode;
    }

    void setMode(DeliveryMode mode) {
        this.mode = mode;
    }

    public @Nullable Endpoint getEndpoint() {
        return endpoint;
    }

    void setEndpoint(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    void moveTo(TaskPhase next) {
        TaskPhase current = phase;
        if (!current.canMoveTo(next)) {
            throw new IllegalStateException("Task " + taskId + " cannot move from " + current + " to " + next);
        }
        phase = next;
    }

    /**
     * Makes the stream reachable for {@link #requestCancel()}.
     *
     * @return {@code false} if a cancel was requested before the stream existed; the caller
     * must then cancel the stream itself
     */
    synchronized boolean attach(EventStream stream) {
        this.stream = stream;
        return !cancelRequested;
    }

    synchronized void detach() {
        this.stream = null;
    }

    /**
     * @return the open stream to cancel, or null if none is attached yet
     */
    synchronized @Nullable EventStream requestCancel() {
        cancelRequested = true;
        return stream;
    }

    @Override
    public String toString() {
        return "ProxyTask{" + taskId + ", todolist=" + todolistId + ", " + phase
                + (mode == null ? "" : ", " + mode) + "}";
    }
}
