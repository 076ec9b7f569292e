package com.radioviz.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Settings path lookup, defaults and loading.
 */
class SettingsTest {

    private static final Logger LOGGER = Logger.getLogger("SettingsTest");

    private static final String JSON = """
        {
            "visualizer": {
                "bar_count": 32,
                "min_bar_height": 0.05,
                "label": "bars",
                "enabled": true,
                "nested": {"depth": 3}
            },
            "station": {"name": null}
        }
        """;

    @Nested
    @DisplayName("Dotted path getters")
    class Getters {

        private final Settings settings = Settings.fromJson(JSON);

        @Test
        void readsNestedValues() {
            assertEquals(32, settings.getInt("visualizer.bar_count", 0));
            assertEquals(32L, settings.getLong("visualizer.bar_count", 0L));
            assertEquals(0.05, settings.getDouble("visualizer.min_bar_height", 0.0), 1e-12);
            assertEquals("bars", settings.getString("visualizer.label", "none"));
            assertTrue(settings.getBoolean("visualizer.enabled", false));
            assertEquals(3, settings.getInt("visualizer.nested.depth", 0));
        }

        @Test
        void missingPathsReturnDefaults() {
            assertEquals(50, settings.getInt("visualizer.missing", 50));
            assertEquals(0.1, settings.getDouble("nothing.here", 0.1));
            assertEquals("fallback", settings.getString("station.name", "fallback"));
            assertFalse(settings.getBoolean("visualizer.bar_count", false));
        }

        @Test
        void wrongTypesReturnDefaults() {
            assertEquals(7, settings.getInt("visualizer.label", 7));
            assertEquals(1.5, settings.getDouble("visualizer.enabled", 1.5));
            assertEquals(9, settings.getInt("visualizer.bar_count.deeper", 9));
        }

        @Test
        void containsReflectsPresence() {
            assertTrue(settings.contains("visualizer.bar_count"));
            assertTrue(settings.contains("visualizer.nested"));
            assertFalse(settings.contains("station.name"));
            assertFalse(settings.contains("rotation"));
        }

        @Test
        void sectionScopesLookups() {
            Settings section = settings.getSection("visualizer");
            assertEquals(32, section.getInt("bar_count", 0));

            Settings missing = settings.getSection("rotation");
            assertEquals(2, missing.getInt("repetitions", 2));
        }
    }

    @Test
    @DisplayName("Malformed JSON raises ConfigurationLoadException")
    void malformedJson() {
        assertThrows(ConfigurationLoadException.class, () -> Settings.fromJson("{\"visualizer\": "));
        assertThrows(ConfigurationLoadException.class, () -> Settings.fromJson("[1, 2, 3]"));
    }

    @Test
    @DisplayName("Bundled defaults are found on the classpath")
    void loadsBundledDefaults() {
        Settings settings = Settings.loadDefaults(LOGGER);

        assertEquals(50, settings.getInt("visualizer.bar_count", 0));
        assertEquals(88.9, settings.getDouble("station.frequency", 0.0), 1e-9);
        assertEquals(2, settings.getInt("rotation.repetitions", 0));
    }

    @Test
    @DisplayName("Missing file yields empty settings")
    void missingFile(@TempDir Path dir) {
        Settings settings = Settings.load(dir.resolve("absent.json"), LOGGER);

        assertFalse(settings.contains("visualizer"));
        assertEquals(50, settings.getInt("visualizer.bar_count", 50));
    }

    @Test
    @DisplayName("Settings load from a file")
    void loadsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"visualizer\": {\"bar_count\": 8}}");

        Settings settings = Settings.load(file, LOGGER);

        assertEquals(8, settings.getInt("visualizer.bar_count", 0));
    }

    @Test
    @DisplayName("Malformed file raises ConfigurationLoadException with a cause")
    void malformedFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        ConfigurationLoadException e = assertThrows(ConfigurationLoadException.class,
            () -> Settings.load(file, LOGGER));
        assertNotNull(e.getCause());
    }
}
