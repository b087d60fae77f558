package org.entitybrowser.indexing.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Typed configuration for index construction.
 *
 * <p>Loads {@code indexing.properties}, then overlays environment variables. {@code INDEX_PROGRESS_INTERVAL} and
 * {@code INDEX_YIELD_INTERVAL}, when set, override the corresponding properties. Invalid values fail fast with
 * {@link IllegalStateException}.</p>
 *
 * @param progressInterval report build progress every this many records (and on the last one)
 * @param yieldInterval records indexed per chunk before an incremental build hands control back to its executor
 */
public record IndexingConfig(int progressInterval, int yieldInterval) {
    public static final int DEFAULT_PROGRESS_INTERVAL = 250;
    public static final int DEFAULT_YIELD_INTERVAL = 1000;

    public IndexingConfig {
        if (progressInterval <= 0) {
            throw new IllegalStateException("index.progress.interval must be positive: " + progressInterval);
        }
        if (yieldInterval <= 0) {
            throw new IllegalStateException("index.yield.interval must be positive: " + yieldInterval);
        }
    }

    public static IndexingConfig defaults() {
        return new IndexingConfig(DEFAULT_PROGRESS_INTERVAL, DEFAULT_YIELD_INTERVAL);
    }

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link IndexingConfig}
     */
    public static IndexingConfig load() {
        Properties properties = loadProperties("indexing.properties");
        overlayEnvironment(properties);
        normalizeIntervals(properties);
        return from(properties);
    }

    static IndexingConfig from(Properties p) {
        return new IndexingConfig(
            readInt(p, "index.progress.interval", DEFAULT_PROGRESS_INTERVAL),
            readInt(p, "index.yield.interval", DEFAULT_YIELD_INTERVAL)
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = IndexingConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static void normalizeIntervals(Properties properties) {
        copyIfSet(properties, "INDEX_PROGRESS_INTERVAL", "index.progress.interval");
        copyIfSet(properties, "INDEX_YIELD_INTERVAL", "index.yield.interval");
    }

    private static void copyIfSet(Properties properties, String envKey, String propertyKey) {
        String value = trimToNull(properties.getProperty(envKey));
        if (value != null) {
            properties.setProperty(propertyKey, value);
        }
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
