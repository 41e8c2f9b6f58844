package io.taskrelay.server.events;

/**
 * Thrown when dequeueing from a queue that is closed and has no events left.
 */
public class EventQueueClosedException extends Exception {

    public EventQueueClosedException() {
        super("Queue is closed");
    }
}
