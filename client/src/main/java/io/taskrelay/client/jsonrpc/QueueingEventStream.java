package io.taskrelay.client.jsonrpc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.taskrelay.client.EventStream;
import io.taskrelay.client.ForwardedEvent;
import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.ForwardingTimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStream} fed by transport callbacks through {@link #emit(ForwardedEvent)} and
 * drained by the caller through {@link #next()}.
 * <p>
 * The transport is started by the first {@link #next()}. At most one terminal event is ever
 * queued; anything emitted after it is dropped.
 */
class QueueingEventStream implements EventStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueueingEventStream.class);

    private final String taskId;
    private final Duration eventTimeout;
    private final Consumer<QueueingEventStream> starter;

    private final LinkedBlockingQueue<ForwardedEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean terminalQueued = new AtomicBoolean();
    private final List<Runnable> closeActions = new ArrayList<>();
    private boolean transportClosed;
    private volatile boolean cancelled;
    private volatile boolean finished;
    private volatile @Nullable String remoteTaskId;

    QueueingEventStream(String taskId, Duration eventTimeout, Consumer<QueueingEventStream> starter) {
        this.taskId = taskId;
        this.eventTimeout = eventTimeout;
        this.starter = starter;
    }

    void emit(ForwardedEvent event) {
        if (event.remoteTaskId() != null && remoteTaskId == null) {
            remoteTaskId = event.remoteTaskId();
        }
        if (terminalQueued.get()) {
            LOGGER.debug("Dropping event after terminal for task {}: {}", taskId, event.kind());
            return;
        }
        if (event.isTerminal() && !terminalQueued.compareAndSet(false, true)) {
            return;
        }
        queue.offer(event);
    }

    /**
     * Registers an action that releases transport resources. Runs immediately if the transport
     * was already closed.
     */
    void onClose(Runnable action) {
        boolean runNow;
        synchronized (closeActions) {
            runNow = transportClosed;
            if (!runNow) {
                closeActions.add(action);
            }
        }
        if (runNow) {
            action.run();
        }
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public ForwardedEvent next() {
        if (finished) {
            throw new NoSuchElementException("Event stream for task " + taskId + " is exhausted");
        }
        if (started.compareAndSet(false, true) && !cancelled) {
            starter.accept(this);
        }
        if (cancelled) {
            return finish(cancelledEvent());
        }
        ForwardedEvent event;
        try {
            event = queue.poll(eventTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return finish(cancelledEvent());
        }
        if (cancelled) {
            return finish(cancelledEvent());
        }
        if (event == null) {
            LOGGER.warn("No event from target agent for task {} within {}", taskId, eventTimeout);
            closeTransport();
            return finish(ForwardedEvent.failed(FailureKind.TIMEOUT,
                    new ForwardingTimeoutException(eventTimeout).getMessage()));
        }
        if (event.isTerminal()) {
            closeTransport();
            return finish(event);
        }
        return event;
    }

    @Override
    public void cancel() {
        if (finished) {
            return;
        }
        LOGGER.debug("Cancelling event stream for task {}", taskId);
        cancelled = true;
        closeTransport();
        // wakes up a consumer blocked in poll
        queue.offer(cancelledEvent());
    }

    @Override
    public @Nullable String remoteTaskId() {
        return remoteTaskId;
    }

    @Override
    public void close() {
        finished = true;
        closeTransport();
    }

    private ForwardedEvent finish(ForwardedEvent terminal) {
        finished = true;
        queue.clear();
        return terminal;
    }

    private ForwardedEvent cancelledEvent() {
        return ForwardedEvent.failed(FailureKind.CANCELLED, "Forwarding of task " + taskId + " was cancelled");
    }

    private void closeTransport() {
        List<Runnable> actions;
        synchronized (closeActions) {
            if (transportClosed) {
                return;
            }
            transportClosed = true;
            actions = new ArrayList<>(closeActions);
            closeActions.clear();
        }
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                LOGGER.debug("Error closing transport for task {}", taskId, e);
            }
        }
    }
}
