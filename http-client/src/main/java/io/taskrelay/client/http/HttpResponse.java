package io.taskrelay.client.http;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import io.taskrelay.client.http.sse.Event;
import org.jspecify.annotations.Nullable;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * @return the {@code Content-Type} header, or {@code null} if the response has none
     */
    @Nullable String contentType();

    CompletableFuture<String> body();

    /**
     * Consumes the body as a server-sent event stream.
     * <p>
     * Events are pushed to {@code eventConsumer} in arrival order. Exactly one of
     * {@code errorConsumer} or {@code completeHandler} is invoked when the stream ends, unless it
     * was cancelled through the returned handle.
     *
     * @return a handle that closes the underlying connection
     */
    SseSubscription bodyAsSse(Consumer<Event> eventConsumer, Consumer<Throwable> errorConsumer,
                              Runnable completeHandler);

    @FunctionalInterface
    interface SseSubscription {
        void cancel();
    }
}
