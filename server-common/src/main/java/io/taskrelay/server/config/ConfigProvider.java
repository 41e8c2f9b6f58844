package io.taskrelay.server.config;

import java.util.Optional;

/**
 * Source of configuration values, looked up by their dotted property name
 * (for example {@code taskrelay.webhook.public-base-url}).
 */
public interface ConfigProvider {

    /**
     * @param name the property name
     * @return the value
     * @throws IllegalArgumentException if no value is configured
     */
    String getValue(String name);

    /**
     * @param name the property name
     * @return the value, or empty when it is not set or blank
     */
    Optional<String> getOptionalValue(String name);
}
