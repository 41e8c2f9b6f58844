package io.taskrelay.server.store;

import java.util.List;
import java.util.Optional;

import io.taskrelay.spec.ProxyEvent;

/**
 * Durable record of proxy events, keyed by the correlation (todolist) id.
 * <p>
 * The store is the only state shared between the executor and the webhook receiver, and the
 * only place where duplicate deliveries are detected. For every key it guarantees:
 * <ul>
 *   <li>at most one {@link io.taskrelay.spec.ProxyEventKind#ACCEPTED} event;</li>
 *   <li>at most one terminal event, whichever arrived first; later terminals are dropped,
 *       never overwritten;</li>
 *   <li>no progress after the terminal event;</li>
 *   <li>after {@link #evict(String)}, nothing is written again.</li>
 * </ul>
 * These checks and the write happen atomically, so concurrent writers for the same key are safe.
 * <p>
 * Implementations backed by external storage report storage failures as
 * {@link EventStoreException}.
 */
public interface EventStore {

    /**
     * Records an event unless the guards above reject it.
     *
     * @param todolistId the correlation key
     * @param event the event to record
     * @return whether the event was written, and if not, why
     * @throws EventStoreException if the storage backend fails
     */
    AppendResult append(String todolistId, ProxyEvent event);

    /**
     * @return the recorded events in append order, empty for unknown or evicted keys
     */
    List<ProxyEvent> events(String todolistId);

    /**
     * @return the terminal event, if one was recorded
     */
    Optional<ProxyEvent> terminal(String todolistId);

    /**
     * Drops every event of a key and refuses any later write for it.
     */
    void evict(String todolistId);
}
