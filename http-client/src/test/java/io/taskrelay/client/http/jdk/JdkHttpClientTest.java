package io.taskrelay.client.http.jdk;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpResponse;
import io.taskrelay.client.http.sse.DataEvent;
import io.taskrelay.client.http.sse.Event;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JdkHttpClientTest {

    private WireMockServer server;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    public void testBaseUrlNormalization() {
        Duration timeout = Duration.ofSeconds(1);

        Assertions.assertEquals("http://localhost:8080", new JdkHttpClient("http://localhost:8080", timeout).getBaseUrl());
        Assertions.assertEquals("http://localhost", new JdkHttpClient("http://localhost", timeout).getBaseUrl());
        Assertions.assertEquals("https://localhost:443", new JdkHttpClient("https://localhost:443", timeout).getBaseUrl());
        Assertions.assertEquals("https://localhost:80", new JdkHttpClient("https://localhost:80/test", timeout).getBaseUrl());
    }

    @Test
    public void testInvalidUrl() {
        assertThrows(IllegalArgumentException.class, () -> new JdkHttpClient("not a url", Duration.ofSeconds(1)));
    }

    @Test
    public void testErrorStatusCompletesNormally() throws Exception {
        server.stubFor(post(urlEqualTo("/agent")).willReturn(aResponse().withStatus(503).withBody("busy")));

        HttpResponse response = HttpClient.createHttpClient(server.baseUrl())
                .post("/agent")
                .body("{}")
                .send()
                .get(5, TimeUnit.SECONDS);

        assertFalse(response.success());
        assertEquals(503, response.statusCode());
        assertEquals("busy", response.body().get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testConnectionRefusedFailsWithIOException() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        ExecutionException e = assertThrows(ExecutionException.class, () -> HttpClient
                .createHttpClient("http://localhost:" + port)
                .post("/")
                .body("{}")
                .send()
                .get(5, TimeUnit.SECONDS));

        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    public void testServerSentEvents() throws Exception {
        server.stubFor(post(urlPathEqualTo("/stream"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "text/event-stream")
                        .withBody(": keep-alive\n\n"
                                + "id: 1\ndata: {\"n\":1}\n\n"
                                + "event: update\ndata: first line\ndata: second line\n\n"
                                + "data: {\"n\":3}\n\n")));

        HttpResponse response = HttpClient.createHttpClient(server.baseUrl())
                .post("/stream")
                .asSSE()
                .body("{}")
                .send()
                .get(5, TimeUnit.SECONDS);

        List<Event> events = new CopyOnWriteArrayList<>();
        AtomicReference<Throwable> error = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        response.bodyAsSse(events::add, t -> {
            error.set(t);
            done.countDown();
        }, done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(null, error.get());

        List<DataEvent> data = events.stream()
                .filter(Event::isData)
                .map(DataEvent.class::cast)
                .toList();
        assertEquals(3, data.size());
        assertEquals("{\"n\":1}", data.get(0).getData());
        assertEquals("1", data.get(0).getId());
        assertEquals("update", data.get(1).getName());
        assertEquals("first line\nsecond line", data.get(1).getData());
        assertEquals("message", data.get(2).getName());
        assertEquals(4, events.size());

        server.verify(postRequestedFor(urlEqualTo("/stream")).withHeader("Accept", equalTo("text/event-stream")));
    }

    @Test
    public void testNonStreamingResponseToStreamRequest() throws Exception {
        server.stubFor(post(urlPathEqualTo("/stream"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"jsonrpc\":\"2.0\"}")));

        HttpResponse response = HttpClient.createHttpClient(server.baseUrl())
                .post("/stream")
                .asSSE()
                .body("{}")
                .send()
                .get(5, TimeUnit.SECONDS);

        AtomicReference<Throwable> error = new AtomicReference<>();
        response.bodyAsSse(e -> { }, error::set, () -> { });

        assertInstanceOf(IOException.class, error.get());
        assertEquals("{\"jsonrpc\":\"2.0\"}", response.body().get(5, TimeUnit.SECONDS));
    }
}
