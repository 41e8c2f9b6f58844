package io.taskrelay.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import jakarta.enterprise.context.ApplicationScoped;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the defaults shipped in every {@value #DEFAULTS_RESOURCE} on the classpath.
 * <p>
 * When several resources define the same property, the first one found wins and the clash is
 * logged.
 */
@ApplicationScoped
public class DefaultValuesConfigProvider implements ConfigProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValuesConfigProvider.class);

    public static final String DEFAULTS_RESOURCE = "META-INF/taskrelay-defaults.properties";

    private final Map<String, String> defaults;

    public DefaultValuesConfigProvider() {
        this(DefaultValuesConfigProvider.class.getClassLoader());
    }

    DefaultValuesConfigProvider(ClassLoader classLoader) {
        this.defaults = load(classLoader);
    }

    @Override
    public String getValue(String name) {
        String value = defaults.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No configuration value found for: " + name);
        }
        return value;
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        String value = defaults.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static Map<String, String> load(ClassLoader classLoader) {
        Map<String, String> values = new HashMap<>();
        try {
            Enumeration<URL> resources = classLoader.getResources(DEFAULTS_RESOURCE);
            while (resources.hasMoreElements()) {
                URL url = resources.nextElement();
                Properties properties = new Properties();
                try (InputStream in = url.openStream()) {
                    properties.load(in);
                }
                for (String name : properties.stringPropertyNames()) {
                    String previous = values.putIfAbsent(name, properties.getProperty(name));
                    if (previous != null) {
                        LOGGER.warn("Duplicate default for {} in {}, keeping the first one", name, url);
                    }
                }
                LOGGER.debug("Loaded {} default values from {}", properties.size(), url);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
        return values;
    }
}
