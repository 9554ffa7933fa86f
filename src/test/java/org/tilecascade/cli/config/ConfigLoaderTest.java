package org.tilecascade.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.tilecascade.junit.extensions.logging.AllowLog;
import org.tilecascade.junit.extensions.logging.LogLevel;
import org.tilecascade.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties over the configuration file over reference.conf.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.INFO, loggerPattern = ".*ConfigLoader")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("tilecascade.round.seed");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("tilecascade.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    @DisplayName("Should fall back to reference.conf without a configuration file")
    void load_shouldUseReferenceDefaults() {
        Config config = ConfigLoader.load(null);

        assertEquals(42L, config.getLong("tilecascade.round.seed"));
        assertEquals(1.0, config.getDouble("tilecascade.round.time-scale"));
        assertTrue(config.hasPath("logging.default-level"));
    }

    @Test
    @DisplayName("Configuration file should override reference.conf")
    void load_fileShouldOverrideDefaults() throws IOException {
        Config config = ConfigLoader.load(writeConfig("tilecascade.round { seed = 7, moves = 25 }"));

        assertEquals(7L, config.getLong("tilecascade.round.seed"));
        assertEquals(25, config.getInt("tilecascade.round.moves"));
        assertEquals(1.0, config.getDouble("tilecascade.round.time-scale"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        System.setProperty("tilecascade.round.seed", "99");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(writeConfig("tilecascade.round.seed = 7"));

        assertEquals(99L, config.getLong("tilecascade.round.seed"));
    }

    @Test
    @DisplayName("Missing explicit configuration file should be reported")
    void load_missingExplicitFileThrows() {
        File missing = tempDir.resolve("nope.conf").toFile();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(missing));
        assertTrue(ex.getMessage().contains("nope.conf"));
    }
}
