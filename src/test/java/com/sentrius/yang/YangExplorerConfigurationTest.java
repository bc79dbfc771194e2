package com.sentrius.yang;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class YangExplorerConfigurationTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(YangExplorerConfiguration.BATCH_PARALLELISM);
    }

    @Test
    void testDefaults() {
        YangExplorerConfiguration configuration = new YangExplorerConfiguration(new Properties());

        assertTrue(configuration.isPrimaryParserEnabled());
        assertEquals("temp.yang", configuration.getDefaultFilename());
        assertEquals(1, configuration.getBatchParallelism());
        assertEquals(3000, configuration.getHttpPort());
        assertEquals(50L * 1024 * 1024, configuration.getHttpMaxBodyBytes());
    }

    @Test
    void testOverrides() {
        Properties overrides = new Properties();
        overrides.setProperty(YangExplorerConfiguration.PRIMARY_PARSER_ENABLED, "false");
        overrides.setProperty(YangExplorerConfiguration.DEFAULT_FILENAME, "inline.yang");
        overrides.setProperty(YangExplorerConfiguration.HTTP_PORT, "8080");

        YangExplorerConfiguration configuration = new YangExplorerConfiguration(overrides);

        assertFalse(configuration.isPrimaryParserEnabled());
        assertEquals("inline.yang", configuration.getDefaultFilename());
        assertEquals(8080, configuration.getHttpPort());
    }

    @Test
    void testInvalidNumbersFallBackToDefaults() {
        Properties overrides = new Properties();
        overrides.setProperty(YangExplorerConfiguration.HTTP_PORT, "not-a-port");
        overrides.setProperty(YangExplorerConfiguration.HTTP_MAX_BODY_BYTES, "lots");

        YangExplorerConfiguration configuration = new YangExplorerConfiguration(overrides);

        assertEquals(3000, configuration.getHttpPort());
        assertEquals(50L * 1024 * 1024, configuration.getHttpMaxBodyBytes());
    }

    @Test
    void testParallelismAtLeastOne() {
        YangExplorerConfiguration configuration = new YangExplorerConfiguration(new Properties());
        configuration.setProperty(YangExplorerConfiguration.BATCH_PARALLELISM, "0");
        assertEquals(1, configuration.getBatchParallelism());

        configuration.setProperty(YangExplorerConfiguration.BATCH_PARALLELISM, "4");
        assertEquals(4, configuration.getBatchParallelism());
    }

    @Test
    void testSystemPropertiesWin() {
        System.setProperty(YangExplorerConfiguration.BATCH_PARALLELISM, "3");

        YangExplorerConfiguration configuration = new YangExplorerConfiguration();

        assertEquals(3, configuration.getBatchParallelism());
        assertEquals("3", configuration.getProperty(YangExplorerConfiguration.BATCH_PARALLELISM));
    }
}
