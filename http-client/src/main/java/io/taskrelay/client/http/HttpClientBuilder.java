package io.taskrelay.client.http;

import io.taskrelay.client.http.jdk.JdkHttpClientBuilder;

/**
 * Creates the {@link HttpClient} used for one target agent URL. The forwarding client keeps one
 * client per URL, so implementations may hold connection pools.
 */
public interface HttpClientBuilder {

    /** Builds clients on the JDK {@link java.net.http.HttpClient}. */
    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    /**
     * @param url an absolute {@code http} or {@code https} URL; only its scheme and authority are kept
     */
    HttpClient create(String url);
}
