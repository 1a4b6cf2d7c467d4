package com.github.anirbanmu.herald.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStream;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConfigLoaderTest {

    @Test
    void loadFullConfigFromClasspath() throws Exception {
        HeraldConfig config;
        try (InputStream in = getClass().getResourceAsStream("/herald.toml")) {
            assertNotNull(in);
            config = ConfigLoader.load(in);
        }

        assertEquals(URI.create("https://discord.example.test/api/v10"), config.rest().baseUrl());
        assertEquals(Duration.ofSeconds(10), config.rest().requestTimeout());
        assertEquals("herald-tests", config.rest().userAgent());
        assertFalse(config.dispatch().ignoreUnknown());
        assertEquals(Level.DEBUG, config.logging().level());
    }

    @Test
    void emptyConfigUsesDefaults() {
        assertEquals(HeraldConfig.defaults(), ConfigLoader.load(""));
    }

    @Test
    void missingKeysFallBackPerSection() {
        String toml = """
            [rest]
            request_timeout = "PT1S"

            [log]
            level = "warn"
            """;

        HeraldConfig config = ConfigLoader.load(toml);

        assertEquals(HeraldConfig.DEFAULT_BASE_URL, config.rest().baseUrl());
        assertEquals(Duration.ofSeconds(1), config.rest().requestTimeout());
        assertEquals(HeraldConfig.DEFAULT_USER_AGENT, config.rest().userAgent());
        assertTrue(config.dispatch().ignoreUnknown());
        assertEquals(Level.WARNING, config.logging().level());
    }

    @Test
    void badDurationNamesKey() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [rest]
            request_timeout = "2 seconds"
            """));
        assertTrue(e.getMessage().contains("rest.request_timeout"), e.getMessage());
    }

    @Test
    void nonPositiveDurationRejected() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [rest]
            request_timeout = "PT0S"
            """));
        assertTrue(e.getMessage().contains("must be positive"), e.getMessage());
    }

    @Test
    void nonHttpUrlRejected() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [rest]
            base_url = "ftp://discord.com/api"
            """));
        assertTrue(e.getMessage().contains("rest.base_url"), e.getMessage());
    }

    @Test
    void unknownLevelRejected() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [log]
            level = "loud"
            """));
        assertTrue(e.getMessage().contains("log.level"), e.getMessage());
    }

    @Test
    void ignoreUnknownMustBeBoolean() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [dispatch]
            ignore_unknown = "yes"
            """));
        assertTrue(e.getMessage().contains("dispatch.ignore_unknown"), e.getMessage());
    }

    @Test
    void sectionMustBeTable() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load("rest = 5"));
        assertTrue(e.getMessage().contains("'rest'"), e.getMessage());
    }

    @Test
    void syntaxErrorReported() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load("[rest\nbase_url = "));
        assertTrue(e.getMessage().startsWith("Failed to parse TOML configuration"), e.getMessage());
    }
}
