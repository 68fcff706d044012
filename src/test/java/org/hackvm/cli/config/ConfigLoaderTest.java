package org.hackvm.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.hackvm.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Configuration File
 * 3. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        // Invalidate the cache before each test to ensure a clean slate
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("translator.stack-base");
        System.clearProperty("translator.halt-label");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = dir.resolve("test.conf");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when no file is given")
    void load_shouldUseReferenceDefaults() {
        // Act
        Config config = ConfigLoader.load(null);

        // Assert
        assertEquals(256, config.getInt("translator.stack-base"));
        assertTrue(config.getBoolean("translator.echo-comments"));
        assertEquals("END", config.getString("translator.halt-label"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("File configuration should override reference defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = writeConfig("translator { stack-base = 512 }\n");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(512, config.getInt("translator.stack-base"));
        assertEquals(".asm", config.getString("translator.output-extension")); // Default unchanged
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() throws IOException {
        // Arrange
        File file = writeConfig("translator { stack-base = 512, halt-label = FILE }\n");
        System.setProperty("translator.stack-base", "1024");
        // Invalidate cache after setting system property to ensure it's picked up
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(1024, config.getInt("translator.stack-base"));
        assertEquals("FILE", config.getString("translator.halt-label"));
    }

    @Test
    @DisplayName("Substitutions in the file should be resolved")
    void load_shouldResolveSubstitutions() throws IOException {
        File file = writeConfig("base = 300\ntranslator { stack-base = ${base} }\n");

        Config config = ConfigLoader.load(file);

        assertEquals(300, config.getInt("translator.stack-base"));
    }

    @Test
    @DisplayName("Missing explicit file should fail")
    void load_missingExplicitFileShouldFail() {
        File missing = dir.resolve("absent.conf").toFile();

        ConfigException.IO e = assertThrows(ConfigException.IO.class, () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("absent.conf"));
        assertNotNull(e.origin());
        assertTrue(e.origin().description().contains("absent.conf"));
    }

    @Test
    @DisplayName("Malformed file should fail to parse")
    void load_malformedFileShouldFail() throws IOException {
        File file = writeConfig("translator { stack-base = \n");

        assertThrows(ConfigException.class, () -> ConfigLoader.load(file));
    }
}
