package io.taskrelay.server.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Settings of the proxy.
 *
 * @param defaultEndpoint target used when a task names no usable agent
 * @param publicBaseUrl externally reachable base URL of the webhook receiver; without it
 *                      non-blocking delivery is unavailable
 * @param protocol protocol segment of callback paths
 * @param eventTimeout longest wait for a single event in blocking mode
 * @param submissionTimeout longest wait for a non-blocking submission to be acknowledged
 * @param webhookHost interface the webhook receiver binds to
 * @param webhookPort port the webhook receiver listens on
 */
public record ProxyConfig(@Nullable String defaultEndpoint, @Nullable String publicBaseUrl, String protocol,
                          Duration eventTimeout, Duration submissionTimeout, String webhookHost, int webhookPort) {

    public static final String DEFAULT_ENDPOINT = "taskrelay.agent.default-endpoint";
    public static final String PUBLIC_BASE_URL = "taskrelay.webhook.public-base-url";
    public static final String PROTOCOL = "taskrelay.webhook.protocol";
    public static final String EVENT_TIMEOUT = "taskrelay.blocking.event-timeout";
    public static final String SUBMISSION_TIMEOUT = "taskrelay.submission.timeout";
    public static final String WEBHOOK_HOST = "taskrelay.webhook.host";
    public static final String WEBHOOK_PORT = "taskrelay.webhook.port";

    public ProxyConfig {
        defaultEndpoint = Utils.trimToNull(defaultEndpoint);
        publicBaseUrl = stripTrailingSlash(Utils.trimToNull(publicBaseUrl));
        Assert.checkNotBlankParam("protocol", protocol);
        Assert.checkNotNullParam("eventTimeout", eventTimeout);
        Assert.checkNotNullParam("submissionTimeout", submissionTimeout);
        Assert.checkNotBlankParam("webhookHost", webhookHost);
        if (eventTimeout.isNegative() || eventTimeout.isZero()) {
            throw new IllegalArgumentException(EVENT_TIMEOUT + " must be positive");
        }
        if (submissionTimeout.isNegative() || submissionTimeout.isZero()) {
            throw new IllegalArgumentException(SUBMISSION_TIMEOUT + " must be positive");
        }
        if (webhookPort < 0 || webhookPort > 65535) {
            throw new IllegalArgumentException(WEBHOOK_PORT + " out of range: " + webhookPort);
        }
    }

    /**
     * Reads the configuration from the environment, system properties and shipped defaults.
     */
    public static ProxyConfig load() {
        return from(new EnvironmentConfigProvider());
    }

    public static ProxyConfig from(ConfigProvider provider) {
        return new ProxyConfig(
                provider.getOptionalValue(DEFAULT_ENDPOINT).orElse(null),
                provider.getOptionalValue(PUBLIC_BASE_URL).orElse(null),
                provider.getValue(PROTOCOL),
                parseDuration(EVENT_TIMEOUT, provider.getValue(EVENT_TIMEOUT)),
                parseDuration(SUBMISSION_TIMEOUT, provider.getValue(SUBMISSION_TIMEOUT)),
                provider.getValue(WEBHOOK_HOST),
                parsePort(provider.getValue(WEBHOOK_PORT)));
    }

    public boolean webhookEnabled() {
        return publicBaseUrl != null;
    }

    public ProxyConfig withPublicBaseUrl(@Nullable String publicBaseUrl) {
        return new ProxyConfig(defaultEndpoint, publicBaseUrl, protocol, eventTimeout, submissionTimeout,
                webhookHost, webhookPort);
    }

    public ProxyConfig withDefaultEndpoint(@Nullable String defaultEndpoint) {
        return new ProxyConfig(defaultEndpoint, publicBaseUrl, protocol, eventTimeout, submissionTimeout,
                webhookHost, webhookPort);
    }

    public ProxyConfig withEventTimeout(Duration eventTimeout) {
        return new ProxyConfig(defaultEndpoint, publicBaseUrl, protocol, eventTimeout, submissionTimeout,
                webhookHost, webhookPort);
    }

    /**
     * Accepts an ISO-8601 duration ({@code PT2M}) or a plain number of seconds ({@code 120}).
     */
    static Duration parseDuration(String name, String value) {
        String trimmed = value.trim();
        try {
            if (trimmed.toUpperCase(Locale.ROOT).startsWith("P")) {
                return Duration.parse(trimmed);
            }
            return Duration.ofSeconds(Long.parseLong(trimmed));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration for " + name + ": " + value, e);
        }
    }

    private static int parsePort(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port for " + WEBHOOK_PORT + ": " + value, e);
        }
    }

    private static @Nullable String stripTrailingSlash(@Nullable String url) {
        if (url == null) {
            return null;
        }
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result.isEmpty() ? null : result;
    }
}
