package io.taskrelay.client.jsonrpc;

import java.time.Duration;

import io.taskrelay.client.http.HttpClientBuilder;
import io.taskrelay.util.Assert;

public class JSONRPCForwardingClientConfig {

    public static final Duration DEFAULT_EVENT_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_SUBMISSION_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClientBuilder httpClientBuilder;
    private final Duration eventTimeout;
    private final Duration submissionTimeout;

    public JSONRPCForwardingClientConfig(HttpClientBuilder httpClientBuilder, Duration eventTimeout,
                                         Duration submissionTimeout) {
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        Assert.checkNotNullParam("eventTimeout", eventTimeout);
        Assert.checkNotNullParam("submissionTimeout", submissionTimeout);
        if (eventTimeout.isNegative() || eventTimeout.isZero()) {
            throw new IllegalArgumentException("eventTimeout must be positive");
        }
        if (submissionTimeout.isNegative() || submissionTimeout.isZero()) {
            throw new IllegalArgumentException("submissionTimeout must be positive");
        }
        this.httpClientBuilder = httpClientBuilder;
        this.eventTimeout = eventTimeout;
        this.submissionTimeout = submissionTimeout;
    }

    public JSONRPCForwardingClientConfig() {
        this(HttpClientBuilder.DEFAULT_FACTORY, DEFAULT_EVENT_TIMEOUT, DEFAULT_SUBMISSION_TIMEOUT);
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    /**
     * How long a blocking forward waits for each event of the target.
     */
    public Duration getEventTimeout() {
        return eventTimeout;
    }

    /**
     * How long a non-blocking submission, a remote cancel or an agent card lookup may take.
     */
    public Duration getSubmissionTimeout() {
        return submissionTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;
        private Duration eventTimeout = DEFAULT_EVENT_TIMEOUT;
        private Duration submissionTimeout = DEFAULT_SUBMISSION_TIMEOUT;

        private Builder() {
        }

        public Builder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
            Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
            this.httpClientBuilder = httpClientBuilder;
            return this;
        }

        public Builder eventTimeout(Duration eventTimeout) {
            this.eventTimeout = eventTimeout;
            return this;
        }

        public Builder submissionTimeout(Duration submissionTimeout) {
            this.submissionTimeout = submissionTimeout;
            return this;
        }

        public JSONRPCForwardingClientConfig build() {
            return new JSONRPCForwardingClientConfig(httpClientBuilder, eventTimeout, submissionTimeout);
        }
    }
}
