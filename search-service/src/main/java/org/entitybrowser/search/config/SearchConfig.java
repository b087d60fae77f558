package org.entitybrowser.search.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. If {@code DATASET_PATH} is set, it
 * overrides {@code dataset.path}. Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    int maxResults,
    int defaultLimit,
    String datasetPath
) {
    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        normalizeDatasetPath(properties);
        return from(properties);
    }

    static SearchConfig from(Properties p) {
        return new SearchConfig(
            requireInt(p, "server.port"),
            requireInt(p, "search.max.results"),
            requireInt(p, "search.default.limit"),
            requireString(p, "dataset.path")
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
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

    private static void normalizeDatasetPath(Properties properties) {
        String datasetPath = trimToNull(properties.getProperty("DATASET_PATH"));
        if (datasetPath != null) {
            properties.setProperty("dataset.path", datasetPath);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
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
