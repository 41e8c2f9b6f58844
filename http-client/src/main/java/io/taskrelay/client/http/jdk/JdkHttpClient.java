package io.taskrelay.client.http.jdk;

import static java.net.HttpURLConnection.HTTP_MULT_CHOICE;
import static java.net.HttpURLConnection.HTTP_OK;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.function.Consumer;

import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpResponse;
import io.taskrelay.client.http.jdk.sse.SSEHandler;
import io.taskrelay.client.http.sse.Event;
import org.jspecify.annotations.Nullable;

class JdkHttpClient implements HttpClient {

    private static final String EVENT_STREAM = "text/event-stream";

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl, Duration connectTimeout) {
        this.httpClient = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build();

        URI targetUrl = buildUri(baseUrl);
        this.baseUrl = targetUrl.getScheme() + "://" + targetUrl.getRawAuthority();
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private static URI buildUri(String uri) {
        try {
            URI parsed = URI.create(uri);
            if (parsed.getScheme() == null || parsed.getRawAuthority() == null) {
                throw new IllegalArgumentException("URI [" + uri + "] is not valid");
            }
            return parsed;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid", e);
        }
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new HashMap<>();
        private @Nullable Duration timeout;

        JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(@Nullable Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @Override
        public T timeout(Duration timeout) {
            this.timeout = timeout;
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path));
            if (timeout != null) {
                builder.timeout(timeout);
            }
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder;
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder().GET().build();
            return httpClient
                    .sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenApply(JdkHttpResponse::new);
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        private String body = "";

        JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PostRequestBuilder body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            final HttpRequest request = super.createRequestBuilder()
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();

            final BodyHandler<?> bodyHandler;

            final String acceptHeader = this.headers.get("Accept");
            if (EVENT_STREAM.equalsIgnoreCase(acceptHeader)) {
                bodyHandler = BodyHandlers.ofPublisher();
            } else {
                bodyHandler = BodyHandlers.ofString(StandardCharsets.UTF_8);
            }

            return httpClient.sendAsync(request, bodyHandler).thenApply(JdkHttpResponse::new);
        }
    }

    private record JdkHttpResponse(java.net.http.HttpResponse<?> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public boolean success() {
            return response.statusCode() >= HTTP_OK && response.statusCode() < HTTP_MULT_CHOICE;
        }

        @Override
        public @Nullable String contentType() {
            return response.headers().firstValue("Content-Type").orElse(null);
        }

        @Override
        public CompletableFuture<String> body() {
            if (response.body() instanceof String s) {
                return CompletableFuture.completedFuture(s);
            }
            if (response.body() instanceof Flow.Publisher<?>) {
                // a stream was requested but the server answered with a plain body
                @SuppressWarnings("unchecked")
                Flow.Publisher<List<ByteBuffer>> publisher = (Flow.Publisher<List<ByteBuffer>>) response.body();
                java.net.http.HttpResponse.BodySubscriber<String> subscriber =
                        BodySubscribers.ofString(StandardCharsets.UTF_8);
                publisher.subscribe(subscriber);
                return subscriber.getBody().toCompletableFuture();
            }
            return CompletableFuture.failedFuture(new IllegalStateException("Unsupported body type"));
        }

        @Override
        public SseSubscription bodyAsSse(Consumer<Event> eventConsumer, Consumer<Throwable> errorConsumer,
                                         Runnable completeHandler) {
            if (!success()) {
                errorConsumer.accept(new IOException("Request failed: status[" + response.statusCode() + "]"));
                return () -> { };
            }
            Optional<String> contentTypeOpt = response.headers().firstValue("Content-Type");
            if (contentTypeOpt.isEmpty() || !contentTypeOpt.get().toLowerCase(Locale.ROOT).startsWith(EVENT_STREAM)
                    || !(response.body() instanceof Flow.Publisher<?>)) {
                errorConsumer.accept(new IOException("Response is not an event-stream response: Content-Type["
                        + contentTypeOpt.orElse("unknown") + "]"));
                return () -> { };
            }

            @SuppressWarnings("unchecked")
            Flow.Publisher<List<ByteBuffer>> publisher = (Flow.Publisher<List<ByteBuffer>>) response.body();

            SSEHandler sseHandler = new SSEHandler(eventConsumer, errorConsumer, completeHandler);
            publisher.subscribe(BodySubscribers.fromLineSubscriber(sseHandler));
            return sseHandler::cancel;
        }
    }
}
