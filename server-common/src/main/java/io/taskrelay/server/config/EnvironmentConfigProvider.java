package io.taskrelay.server.config;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import jakarta.enterprise.context.ApplicationScoped;

import org.jspecify.annotations.Nullable;

/**
 * Layers environment variables and system properties over the shipped defaults.
 * <p>
 * Lookup order for a property such as {@code taskrelay.webhook.public-base-url}:
 * <ol>
 *   <li>the environment variable {@code TASKRELAY_WEBHOOK_PUBLIC_BASE_URL}</li>
 *   <li>a legacy environment variable, where one exists ({@code WEBHOOK_PUBLIC_BASE_URL})</li>
 *   <li>the system property of the same name</li>
 *   <li>{@link DefaultValuesConfigProvider}</li>
 * </ol>
 */
@ApplicationScoped
public class EnvironmentConfigProvider implements ConfigProvider {

    private static final Map<String, String> LEGACY_VARIABLES = Map.of(
            ProxyConfig.PUBLIC_BASE_URL, "WEBHOOK_PUBLIC_BASE_URL",
            ProxyConfig.WEBHOOK_HOST, "WEBHOOK_RECEIVER_HOST",
            ProxyConfig.WEBHOOK_PORT, "WEBHOOK_RECEIVER_PORT");

    private final Map<String, String> environment;
    private final Properties systemProperties;
    private final ConfigProvider defaults;

    public EnvironmentConfigProvider() {
        this(System.getenv(), System.getProperties(), new DefaultValuesConfigProvider());
    }

    public EnvironmentConfigProvider(Map<String, String> environment, Properties systemProperties,
                                     ConfigProvider defaults) {
        this.environment = environment;
        this.systemProperties = systemProperties;
        this.defaults = defaults;
    }

    @Override
    public String getValue(String name) {
        return lookup(name).orElseGet(() -> defaults.getValue(name));
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        Optional<String> value = lookup(name);
        return value.isPresent() ? value : defaults.getOptionalValue(name);
    }

    private Optional<String> lookup(String name) {
        @Nullable String value = environment.get(toEnvironmentName(name));
        if (isBlank(value) && LEGACY_VARIABLES.containsKey(name)) {
            value = environment.get(LEGACY_VARIABLES.get(name));
        }
        if (isBlank(value)) {
            value = systemProperties.getProperty(name);
        }
        return isBlank(value) ? Optional.empty() : Optional.of(value.trim());
    }

    static String toEnvironmentName(String name) {
        return name.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }
}
