package io.taskrelay.webhook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpResponse;
import io.taskrelay.server.agentexecution.RequestContext;
import io.taskrelay.server.config.ProxyConfig;
import io.taskrelay.server.events.InMemoryEventQueue;
import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.ProxyEvent;
import io.taskrelay.spec.ProxyEventKind;
import org.junit.jupiter.api.Test;

/**
 * Executor and receiver sharing one store, the way the application wires them.
 */
public class WebhookReceiverApplicationTest {

    private static final ProxyConfig CONFIG = new ProxyConfig(null, null, "a2a",
            Duration.ofSeconds(5), Duration.ofSeconds(5), "127.0.0.1", 0);

    @Test
    public void testCallbackIsVisibleToTheExecutorStore() throws Exception {
        try (WebhookReceiverApplication application = new WebhookReceiverApplication(CONFIG)) {
            int port = application.start();
            assertTrue(port > 0);
            assertEquals(port, application.port());

            HttpResponse response = HttpClient.createHttpClient("http://127.0.0.1:" + port)
                    .post("/webhook/a2a/todolist/todo-9")
                    .send("""
                            {"id": "remote-9", "status": {"state": "canceled"}}""")
                    .get(10, TimeUnit.SECONDS);

            assertEquals(200, response.statusCode());
            ProxyEvent terminal = application.eventStore().terminal("todo-9").orElseThrow();
            assertEquals(ProxyEventKind.FAILED, terminal.kind());
            assertEquals(FailureKind.PROTOCOL_REJECTION, terminal.failureDetail().kind());
        }
    }

    @Test
    public void testExecutorRecordsIntoSharedStore() {
        try (WebhookReceiverApplication application = new WebhookReceiverApplication(CONFIG)) {
            InMemoryEventQueue queue = new InMemoryEventQueue();

            application.executor().execute(RequestContext.builder()
                    .taskId("t-1")
                    .userInput("hello")
                    .metadata(RequestContext.TODOLIST_ID, "todo-1")
                    .metadata(RequestContext.AGENTS, List.of(Map.of("endpoint", "not a url")))
                    .build(), queue);

            ProxyEvent terminal = application.eventStore().terminal("todo-1").orElseThrow();
            assertEquals(FailureKind.RESOLUTION, terminal.failureDetail().kind());
        }
    }
}
