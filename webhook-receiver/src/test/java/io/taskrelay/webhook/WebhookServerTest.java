package io.taskrelay.webhook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpResponse;
import io.taskrelay.server.store.AppendResult;
import io.taskrelay.server.store.EventStore;
import io.taskrelay.server.store.EventStoreException;
import io.taskrelay.server.store.InMemoryEventStore;
import io.taskrelay.spec.ProxyEvent;
import io.taskrelay.spec.ProxyEventKind;
import io.taskrelay.util.Utils;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class WebhookServerTest {

    private static final String COMPLETED = """
            {"kind": "task", "id": "remote-1", "contextId": "c-1", "status": {"state": "completed",
              "message": {"role": "agent", "parts": [{"kind": "text", "text": "trip booked"}]}}}""";

    private Vertx vertx;
    private InMemoryEventStore store;
    private WebhookServer server;
    private HttpClient client;

    @BeforeEach
    public void setUp() {
        vertx = Vertx.vertx();
        store = new InMemoryEventStore();
        client = start(store);
    }

    @AfterEach
    public void tearDown() throws Exception {
        server.stop();
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private HttpClient start(EventStore eventStore) {
        if (server != null) {
            server.stop();
        }
        server = new WebhookServer(vertx, new WebhookReceiver(eventStore), "a2a");
        int port = server.start("127.0.0.1", 0);
        return HttpClient.createHttpClient("http://127.0.0.1:" + port);
    }

    private HttpResponse post(String path, String body) throws Exception {
        return client.post(path)
                .addHeader("Content-Type", "application/json")
                .send(body)
                .get(10, TimeUnit.SECONDS);
    }

    private static JsonNode json(HttpResponse response) throws Exception {
        return Utils.OBJECT_MAPPER.readTree(response.body().get(10, TimeUnit.SECONDS));
    }

    @Test
    public void testSameCompletionDeliveredTwiceIsRecordedOnce() throws Exception {
        store.append("todo-1", ProxyEvent.accepted("t-1", Map.of(ProxyEvent.REMOTE_TASK_ID, "remote-1")));

        HttpResponse first = post("/webhook/a2a/todolist/todo-1", COMPLETED);
        HttpResponse second = post("/webhook/a2a/todolist/todo-1", COMPLETED);

        assertEquals(200, first.statusCode());
        assertEquals(200, second.statusCode());
        JsonNode body = json(first);
        assertEquals("received", body.get("status").asText());
        assertEquals("todo-1", body.get("todolist_id").asText());
        assertEquals("remote-1", body.get("a2a_task_id").asText());
        assertEquals("completed", body.get("notification_type").asText());
        assertEquals("recorded", body.get("disposition").asText());
        assertEquals("duplicate", json(second).get("disposition").asText());

        List<ProxyEvent> events = store.events("todo-1");
        assertEquals(1, events.stream().filter(e -> e.kind() == ProxyEventKind.COMPLETED).count());
        assertEquals("trip booked", store.terminal("todo-1").orElseThrow().artifact());
    }

    @Test
    public void testInvalidTodolistIdIsBadRequest() throws Exception {
        HttpResponse response = post("/webhook/a2a/todolist/-bad", COMPLETED);

        assertEquals(400, response.statusCode());
        assertEquals("rejected", json(response).get("status").asText());
        assertTrue(store.events("-bad").isEmpty());
    }

    @Test
    public void testInvalidJsonIsBadRequest() throws Exception {
        HttpResponse response = post("/webhook/a2a/todolist/todo-1", "{oops");

        assertEquals(400, response.statusCode());
        assertEquals("Invalid JSON", json(response).get("error").asText());
    }

    @Test
    public void testEmptyTodolistIdIsBadRequest() throws Exception {
        HttpResponse response = post("/webhook/a2a/todolist/", COMPLETED);

        assertEquals(400, response.statusCode());
        assertEquals("rejected", json(response).get("status").asText());
    }

    @Test
    public void testUnmappableBodyIsAcknowledged() throws Exception {
        HttpResponse response = post("/webhook/a2a/todolist/todo-3", "{\"kind\": \"task\", \"status\": \"done\"}");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("received", body.get("status").asText());
        assertEquals("other", body.get("notification_type").asText());
        assertEquals("recorded", body.get("disposition").asText());
        assertEquals(ProxyEventKind.FAILED, store.terminal("todo-3").orElseThrow().kind());
    }

    @Test
    public void testDispositionIsLocaleIndependent() throws Exception {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            post("/webhook/a2a/todolist/todo-4", COMPLETED);
            HttpResponse response = post("/webhook/a2a/todolist/todo-4", COMPLETED);

            assertEquals("duplicate", json(response).get("disposition").asText());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    public void testUnknownProtocolIsNotFound() throws Exception {
        HttpResponse response = post("/webhook/mcp/todolist/todo-1", COMPLETED);

        assertEquals(404, response.statusCode());
        assertTrue(store.events("todo-1").isEmpty());
    }

    @Test
    public void testStoreFailureIsServerError() throws Exception {
        client = start(new FailingEventStore());

        HttpResponse response = post("/webhook/a2a/todolist/todo-1", COMPLETED);

        assertEquals(500, response.statusCode());
        assertEquals("error", json(response).get("status").asText());
    }

    @Test
    public void testHealth() throws Exception {
        HttpResponse response = client.get("/health").send().get(10, TimeUnit.SECONDS);

        assertEquals(200, response.statusCode());
        assertEquals("healthy", json(response).get("status").asText());
        assertTrue(json(response).has("timestamp"));
    }

    private static class FailingEventStore implements EventStore {

        @Override
        public AppendResult append(String todolistId, ProxyEvent event) {
            throw new EventStoreException(todolistId, "disk full");
        }

        @Override
        public List<ProxyEvent> events(String todolistId) {
            return List.of();
        }

        @Override
        public Optional<ProxyEvent> terminal(String todolistId) {
            return Optional.empty();
        }

        @Override
        public void evict(String todolistId) {
        }
    }
}
