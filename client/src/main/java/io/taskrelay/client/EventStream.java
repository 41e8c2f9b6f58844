package io.taskrelay.client;

import java.util.NoSuchElementException;

import org.jspecify.annotations.Nullable;

/**
 * The events of one blocking forward: zero or more progress events followed by exactly one
 * terminal event.
 * <p>
 * The stream is lazy (nothing is sent before the first {@link #next()}), finite and cannot be
 * restarted. It is meant to be drained by a single thread; {@link #cancel()} may be called from
 * any thread.
 */
public interface EventStream extends AutoCloseable {

    /**
     * @return {@code false} once the terminal event has been returned
     */
    boolean hasNext();

    /**
     * Waits for the next event, at most the configured per-event timeout. On expiry the transport
     * is closed and a {@link io.taskrelay.spec.FailureKind#TIMEOUT} failure is returned.
     *
     * @throws NoSuchElementException if the terminal event was already returned
     */
    ForwardedEvent next();

    /**
     * Closes the transport. The next call to {@link #next()} returns a
     * {@link io.taskrelay.spec.FailureKind#CANCELLED} terminal unless one was already returned.
     */
    void cancel();

    /**
     * @return the target-side task id, once the target has reported it
     */
    @Nullable String remoteTaskId();

    @Override
    void close();
}
