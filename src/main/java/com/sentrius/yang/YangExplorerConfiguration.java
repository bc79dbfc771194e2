package com.sentrius.yang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Parser and server settings. Built-in defaults are overridden by
 * {@code yang-explorer.properties} (classpath, then working directory) and then
 * by system properties.
 */
public class YangExplorerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(YangExplorerConfiguration.class);

    public static final String CONFIG_FILE = "yang-explorer.properties";

    public static final String PRIMARY_PARSER_ENABLED = "yang.parser.primary.enabled";
    public static final String DEFAULT_FILENAME = "yang.parser.default.filename";
    public static final String BATCH_PARALLELISM = "yang.batch.parallelism";
    public static final String HTTP_PORT = "yang.http.port";
    public static final String HTTP_MAX_BODY_BYTES = "yang.http.max.body.bytes";

    private static final String DEFAULT_DEFAULT_FILENAME = "temp.yang";
    private static final int DEFAULT_BATCH_PARALLELISM = 1;
    private static final int DEFAULT_HTTP_PORT = 3000;
    private static final long DEFAULT_HTTP_MAX_BODY_BYTES = 50L * 1024 * 1024;

    private final Properties properties;

    public YangExplorerConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromClasspath();
        loadConfigurationFromFile(Paths.get(CONFIG_FILE));
        loadConfigurationFromSystemProperties();
    }

    public YangExplorerConfiguration(Properties overrides) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    public boolean isPrimaryParserEnabled() {
        return getBooleanProperty(PRIMARY_PARSER_ENABLED, true);
    }

    public String getDefaultFilename() {
        return properties.getProperty(DEFAULT_FILENAME, DEFAULT_DEFAULT_FILENAME);
    }

    public int getBatchParallelism() {
        int value = getIntProperty(BATCH_PARALLELISM, DEFAULT_BATCH_PARALLELISM);
        return Math.max(value, 1);
    }

    public int getHttpPort() {
        return getIntProperty(HTTP_PORT, DEFAULT_HTTP_PORT);
    }

    public long getHttpMaxBodyBytes() {
        return getLongProperty(HTTP_MAX_BODY_BYTES, DEFAULT_HTTP_MAX_BODY_BYTES);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(PRIMARY_PARSER_ENABLED, "true");
        properties.setProperty(DEFAULT_FILENAME, DEFAULT_DEFAULT_FILENAME);
        properties.setProperty(BATCH_PARALLELISM, String.valueOf(DEFAULT_BATCH_PARALLELISM));
        properties.setProperty(HTTP_PORT, String.valueOf(DEFAULT_HTTP_PORT));
        properties.setProperty(HTTP_MAX_BODY_BYTES, String.valueOf(DEFAULT_HTTP_MAX_BODY_BYTES));
    }

    private void loadConfigurationFromClasspath() {
        try (InputStream input = YangExplorerConfiguration.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.debug("Loaded configuration from classpath:{}", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath:{}: {}", CONFIG_FILE, e.getMessage());
        }
    }

    private void loadConfigurationFromFile(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            return;
        }
        try (InputStream input = Files.newInputStream(configPath)) {
            properties.load(input);
            logger.info("Loaded configuration from {}", configPath.toAbsolutePath());
        } catch (IOException e) {
            logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("yang.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
    }

    @Override
    public String toString() {
        return "YangExplorerConfiguration{primaryParser=" + isPrimaryParserEnabled() +
               ", defaultFilename='" + getDefaultFilename() + "', batchParallelism=" + getBatchParallelism() +
               ", httpPort=" + getHttpPort() + "}";
    }
}
