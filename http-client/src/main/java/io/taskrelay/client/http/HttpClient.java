package io.taskrelay.client.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * Minimal asynchronous HTTP client used to talk to target agents.
 * <p>
 * A client is bound to the scheme and authority of the URL it was created for; request paths are
 * resolved against it. Failures to connect complete the returned future exceptionally with the
 * underlying {@link java.io.IOException}; any HTTP status, including 4xx and 5xx, completes it
 * normally.
 */
public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(@Nullable Map<String, String> headers);

        /**
         * Bounds the time until response headers are received. Streaming bodies are not covered.
         */
        T timeout(Duration timeout);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {
        PostRequestBuilder body(@Nullable String body);

        default PostRequestBuilder asSSE() {
            return addHeader("Accept", "text/event-stream");
        }

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }
}
