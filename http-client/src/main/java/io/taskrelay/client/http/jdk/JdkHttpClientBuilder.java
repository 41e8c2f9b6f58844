package io.taskrelay.client.http.jdk;

import java.time.Duration;

import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpClientBuilder;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration connectTimeout;

    public JdkHttpClientBuilder() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    public JdkHttpClientBuilder(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url, connectTimeout);
    }
}
