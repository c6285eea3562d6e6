package io.snowkit.ringbuffer.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.Optional;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hierarchical configuration backed by {@link ResourceBundle}.
 *
 * <p>Supports a fallback chain:
 * <ol>
 *   <li>snowkit_{name}.properties (buffer or work queue specific)</li>
 *   <li>snowkit.properties (global defaults)</li>
 * </ol>
 *
 * <p>{@code forBuffer("audit")} resolves {@code snowkit_audit.properties} before
 * falling back to {@code snowkit.properties}. Names are made of letters, digits,
 * {@code _} and {@code -}; anything else is rejected because it cannot name a
 * properties file next to {@code snowkit.properties}.
 *
 * <p><strong>Example property files:</strong>
 * <pre>
 * # snowkit.properties
 * ringbuffer.default-capacity=1024
 * workqueue.shutdown-timeout-ms=1000
 *
 * # snowkit_audit.properties
 * ringbuffer.default-capacity=64
 * </pre>
 *
 * <p>System properties take precedence over all property files:
 * <pre>
 * java -Dringbuffer.default-capacity=4096 -jar app.jar
 * </pre>
 */
public class HierarchicalConfig {

    static final String BUNDLE = "snowkit";

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_-]+");
    private static final ResourceBundle.Control PROPERTIES_ONLY =
        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    // Most specific first
    private final List<ResourceBundle> chain;
    private final String context;

    private HierarchicalConfig(List<ResourceBundle> chain, String context) {
        this.chain = chain;
        this.context = context;
    }

    /**
     * @return global configuration (snowkit.properties)
     */
    public static HierarchicalConfig global() {
        return new HierarchicalConfig(List.of(load(BUNDLE)), "global");
    }

    /**
     * Configuration for a named ring buffer, falling back to global.
     *
     * @param bufferName buffer name (e.g., "audit", "frames")
     * @return buffer-specific configuration
     */
    public static HierarchicalConfig forBuffer(String bufferName) {
        return named("buffer", "bufferName", bufferName);
    }

    /**
     * Configuration for a named work queue, falling back to global.
     *
     * @param queueName work queue name
     * @return work-queue-specific configuration
     */
    public static HierarchicalConfig forWorkQueue(String queueName) {
        return named("workqueue", "queueName", queueName);
    }

    private static HierarchicalConfig named(String kind, String argument, String name) {
        Objects.requireNonNull(name, argument + " cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException(argument + " cannot be blank");
        }
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException(
                argument + " may only contain letters, digits, '_' and '-': " + name
            );
        }

        List<ResourceBundle> chain = new ArrayList<>(2);
        find(BUNDLE + "_" + name).ifPresent(chain::add);
        chain.add(load(BUNDLE));
        return new HierarchicalConfig(Collections.unmodifiableList(chain), kind + ":" + name);
    }

    private static ResourceBundle load(String baseName) {
        return ResourceBundle.getBundle(baseName, Locale.ROOT, PROPERTIES_ONLY);
    }

    private static Optional<ResourceBundle> find(String baseName) {
        try {
            return Optional.of(load(baseName));
        } catch (MissingResourceException e) {
            return Optional.empty();
        }
    }

    /**
     * Get string value. Checks system properties first, then the bundle chain.
     *
     * @param key property key
     * @return property value
     * @throws ConfigurationException if key not found
     */
    public String getString(String key) {
        String value = getString(key, null);
        if (value == null) {
            throw new ConfigurationException(
                "Missing config key '" + key + "' in context: " + context
            );
        }
        return value;
    }

    /**
     * Get string value with default.
     *
     * @param key          property key
     * @param defaultValue returned when the key is absent
     * @return property value or default
     */
    public String getString(String key, String defaultValue) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }

        for (ResourceBundle bundle : chain) {
            if (bundle.containsKey(key)) {
                return bundle.getString(key);
            }
        }
        return defaultValue;
    }

    /**
     * @throws ConfigurationException if key not found or not an int
     */
    public int getInt(String key) {
        String value = getString(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid int value for key '" + key + "': " + value, e
            );
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * @return true if the key is set as a system property or in the bundle chain
     */
    public boolean contains(String key) {
        if (System.getProperty(key) != null) {
            return true;
        }
        return chain.stream().anyMatch(bundle -> bundle.containsKey(key));
    }

    /**
     * @return every key visible at this level, including inherited ones
     */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        chain.forEach(bundle -> keys.addAll(bundle.keySet()));
        return keys;
    }

    /**
     * @return context description (e.g., "global", "buffer:audit")
     */
    public String context() {
        return context;
    }

    @Override
    public String toString() {
        return "HierarchicalConfig[context=" + context + "]";
    }
}
