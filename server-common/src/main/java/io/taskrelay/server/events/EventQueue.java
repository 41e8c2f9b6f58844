package io.taskrelay.server.events;

import io.taskrelay.spec.ProxyEvent;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The caller's view of a task: every {@link ProxyEvent} the executor publishes, in order.
 * <p>
 * The executor enqueues; whoever hosts the executor consumes. Once closed, further events are
 * dropped with a warning.
 */
public abstract class EventQueue implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventQueue.class);

    /**
     * Default maximum queue size for event queues.
     */
    public static final int DEFAULT_QUEUE_SIZE = 1000;

    private final int queueSize;
    private volatile boolean closed = false;

    protected EventQueue() {
        this(DEFAULT_QUEUE_SIZE);
    }

    /**
     * @param queueSize the maximum number of events that can be queued
     * @throws IllegalArgumentException if queueSize is less than or equal to 0
     */
    protected EventQueue(int queueSize) {
        if (queueSize <= 0) {
            throw new IllegalArgumentException("Queue size must be greater than 0");
        }
        this.queueSize = queueSize;
        LOGGER.trace("Creating {} with queue size: {}", this, queueSize);
    }

    public int getQueueSize() {
        return queueSize;
    }

    /**
     * Enqueues an event. Blocks while the queue is full.
     *
     * @param event the event to enqueue
     */
    public void enqueueEvent(ProxyEvent event) {
        if (closed) {
            LOGGER.warn("Queue is closed. Event will not be enqueued. {} {}", this, event);
            return;
        }
        doEnqueue(event);
        LOGGER.debug("Enqueued event {} {}", event, this);
    }

    protected abstract void doEnqueue(ProxyEvent event);

    /**
     * Dequeues the next event.
     *
     * @param waitMilliSeconds the maximum time to wait in milliseconds
     * @return the event, or null if the wait timed out
     * @throws EventQueueClosedException if the queue is closed and empty
     */
    public abstract @Nullable ProxyEvent dequeueEvent(int waitMilliSeconds) throws EventQueueClosedException;

    /**
     * @return the number of events currently in the queue
     */
    public abstract int size();

    /**
     * Closes this queue. Events already queued can still be dequeued.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            LOGGER.debug("Closing {}", this);
            closed = true;
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
