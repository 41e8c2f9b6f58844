package io.taskrelay.server.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.taskrelay.spec.ProxyEvent;
import io.taskrelay.spec.ProxyEventKind;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link EventStore}. Events are lost on restart.
 * <p>
 * Each key maps to an immutable {@link Log}; every append replaces it inside
 * {@link ConcurrentMap#compute}, which makes the guard check and the write a single atomic step
 * per key. Evicted keys keep an empty tombstone log so that late deliveries are reported as
 * {@link AppendResult.Status#UNKNOWN_TASK}.
 * <p>
 * Never throws {@link EventStoreException}: nothing here can fail short of running out of heap.
 */
@ApplicationScoped
public class InMemoryEventStore implements EventStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, Log> logs = new ConcurrentHashMap<>();

    @Override
    public AppendResult append(String todolistId, ProxyEvent event) {
        Assert.checkNotBlankParam("todolistId", todolistId);
        Assert.checkNotNullParam("event", event);

        AppendResult[] result = new AppendResult[1];
        logs.compute(todolistId, (key, current) -> {
            Log log = current == null ? Log.EMPTY : current;
            result[0] = check(log, event);
            return result[0].isWritten() ? log.with(event) : current;
        });

        AppendResult appendResult = result[0];
        if (appendResult.isWritten()) {
            LOGGER.debug("Recorded {} for todolist {} at position {}", event.kind(), todolistId, appendResult.position());
        } else {
            LOGGER.info("Dropped {} for todolist {}: {}", event.kind(), todolistId, appendResult.status());
        }
        return appendResult;
    }

    private static AppendResult check(Log log, ProxyEvent event) {
        if (log.evicted) {
            return new AppendResult(AppendResult.Status.UNKNOWN_TASK, 0, null);
        }
        int size = log.events.size();
        if (event.kind() == ProxyEventKind.ACCEPTED) {
            // a callback may be recorded before the submission is; ACCEPTED is still taken then
            ProxyEvent accepted = log.find(ProxyEventKind.ACCEPTED);
            return accepted == null
                    ? AppendResult.appended(size)
                    : new AppendResult(AppendResult.Status.DUPLICATE, size, accepted);
        }
        ProxyEvent terminal = log.terminal();
        if (terminal == null) {
            return AppendResult.appended(size);
        }
        AppendResult.Status status = terminal.kind() == event.kind()
                ? AppendResult.Status.DUPLICATE
                : AppendResult.Status.ALREADY_TERMINAL;
        return new AppendResult(status, size, terminal);
    }

    @Override
    public List<ProxyEvent> events(String todolistId) {
        Log log = logs.get(todolistId);
        return log == null ? List.of() : log.events;
    }

    @Override
    public Optional<ProxyEvent> terminal(String todolistId) {
        Log log = logs.get(todolistId);
        return log == null ? Optional.empty() : Optional.ofNullable(log.terminal());
    }

    @Override
    public void evict(String todolistId) {
        logs.put(todolistId, Log.TOMBSTONE);
        LOGGER.debug("Evicted todolist {}", todolistId);
    }

    private static final class Log {
        static final Log EMPTY = new Log(List.of(), false);
        static final Log TOMBSTONE = new Log(List.of(), true);

        final List<ProxyEvent> events;
        final boolean evicted;

        private Log(List<ProxyEvent> events, boolean evicted) {
            this.events = events;
            this.evicted = evicted;
        }

        Log with(ProxyEvent event) {
            List<ProxyEvent> copy = new ArrayList<>(events.size() + 1);
            copy.addAll(events);
            copy.add(event);
            return new Log(Collections.unmodifiableList(copy), false);
        }

        @Nullable ProxyEvent find(ProxyEventKind kind) {
            for (ProxyEvent event : events) {
                if (event.kind() == kind) {
                    return event;
                }
            }
            return null;
        }

        @Nullable ProxyEvent terminal() {
            for (ProxyEvent event : events) {
                if (event.isTerminal()) {
                    return event;
                }
            }
            return null;
        }
    }
}
