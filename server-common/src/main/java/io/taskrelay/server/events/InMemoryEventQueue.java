package io.taskrelay.server.events;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

import io.taskrelay.spec.ProxyEvent;
import org.jspecify.annotations.Nullable;

/**
 * Bounded, in-process {@link EventQueue}.
 */
public class InMemoryEventQueue extends EventQueue {

    private final BlockingQueue<ProxyEvent> queue;

    public InMemoryEventQueue() {
        this(DEFAULT_QUEUE_SIZE);
    }

    public InMemoryEventQueue(int queueSize) {
        super(queueSize);
        this.queue = new LinkedBlockingDeque<>(queueSize);
    }

    @Override
    protected void doEnqueue(ProxyEvent event) {
        try {
            queue.put(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while enqueueing event for task " + event.taskId(), e);
        }
    }

    @Override
    public @Nullable ProxyEvent dequeueEvent(int waitMilliSeconds) throws EventQueueClosedException {
        if (isClosed() && queue.isEmpty()) {
            throw new EventQueueClosedException();
        }
        try {
            if (waitMilliSeconds <= 0) {
                return queue.poll();
            }
            return queue.poll(waitMilliSeconds, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    /**
     * Removes and returns every event currently queued, without waiting.
     */
    public List<ProxyEvent> drain() {
        List<ProxyEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    @Override
    public int size() {
        return queue.size();
    }
}
