package io.taskrelay.server.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import io.taskrelay.spec.FailureDetail;
import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.ProxyEvent;
import io.taskrelay.spec.ProxyEventKind;
import io.taskrelay.spec.SequenceHint;
import org.junit.jupiter.api.Test;

public class InMemoryEventStoreTest {

    private static final String TODOLIST = "todo-1";

    private final InMemoryEventStore store = new InMemoryEventStore();

    private static ProxyEvent accepted() {
        return ProxyEvent.accepted("t-1", Map.of(ProxyEvent.REMOTE_TASK_ID, "remote-1"));
    }

    private static ProxyEvent completed(String artifact) {
        return ProxyEvent.completed("t-1", artifact, Map.of());
    }

    private static ProxyEvent failed() {
        return ProxyEvent.failed("t-1", new FailureDetail(FailureKind.PROTOCOL_REJECTION, "nope", "failed"));
    }

    @Test
    public void testAppendKeepsOrder() {
        assertEquals(0, store.append(TODOLIST, accepted()).position());
        assertEquals(1, store.append(TODOLIST, ProxyEvent.progress("t-1", SequenceHint.of(1, 2), "a")).position());
        assertEquals(2, store.append(TODOLIST, completed("done")).position());

        List<ProxyEvent> events = store.events(TODOLIST);
        assertEquals(List.of(ProxyEventKind.ACCEPTED, ProxyEventKind.PROGRESS, ProxyEventKind.COMPLETED),
                events.stream().map(ProxyEvent::kind).toList());
    }

    @Test
    public void testSecondAcceptedIsDuplicate() {
        ProxyEvent first = accepted();
        store.append(TODOLIST, first);

        AppendResult result = store.append(TODOLIST, accepted());

        assertEquals(AppendResult.Status.DUPLICATE, result.status());
        assertSame(first, result.existing());
        assertEquals(1, store.events(TODOLIST).size());
    }

    @Test
    public void testFirstTerminalWins() {
        ProxyEvent first = completed("first");
        assertTrue(store.append(TODOLIST, first).isWritten());

        AppendResult sameKind = store.append(TODOLIST, completed("second"));
        AppendResult otherKind = store.append(TODOLIST, failed());

        assertEquals(AppendResult.Status.DUPLICATE, sameKind.status());
        assertEquals(AppendResult.Status.ALREADY_TERMINAL, otherKind.status());
        assertSame(first, store.terminal(TODOLIST).orElseThrow());
        assertEquals("first", store.terminal(TODOLIST).orElseThrow().artifact());
        assertEquals(1, store.events(TODOLIST).size());
    }

    @Test
    public void testNoProgressAfterTerminal() {
        store.append(TODOLIST, failed());

        AppendResult result = store.append(TODOLIST, ProxyEvent.progress("t-1", null, "late"));

        assertEquals(AppendResult.Status.ALREADY_TERMINAL, result.status());
        assertEquals(1, store.events(TODOLIST).size());
    }

    @Test
    public void testTerminalWithoutPriorAcceptedIsRecorded() {
        assertTrue(store.append(TODOLIST, completed("early callback")).isWritten());

        assertEquals(ProxyEventKind.COMPLETED, store.terminal(TODOLIST).orElseThrow().kind());
    }

    @Test
    public void testAcceptedAfterTerminalIsStillRecorded() {
        store.append(TODOLIST, completed("early callback"));

        assertTrue(store.append(TODOLIST, accepted()).isWritten());
        assertEquals(2, store.events(TODOLIST).size());
    }

    @Test
    public void testEvictedTaskIsUnknown() {
        store.append(TODOLIST, accepted());
        store.evict(TODOLIST);

        AppendResult result = store.append(TODOLIST, completed("late"));

        assertEquals(AppendResult.Status.UNKNOWN_TASK, result.status());
        assertTrue(store.events(TODOLIST).isEmpty());
        assertTrue(store.terminal(TODOLIST).isEmpty());
    }

    @Test
    public void testUnknownKeyHasNoEvents() {
        assertTrue(store.events("never-seen").isEmpty());
    }

    @Test
    public void testConcurrentTerminalsRecordExactlyOne() throws Exception {
        int writers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<AppendResult>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                ProxyEvent event = i % 2 == 0 ? completed("result " + i) : failed();
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.append(TODOLIST, event);
                }));
            }
            start.countDown();

            int written = 0;
            for (Future<AppendResult> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isWritten()) {
                    written++;
                }
            }
            assertEquals(1, written);
            assertEquals(1, store.events(TODOLIST).size());
        } finally {
            pool.shutdownNow();
        }
    }
}
