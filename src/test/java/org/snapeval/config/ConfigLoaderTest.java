package org.snapeval.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.snapeval.junit.extensions.logging.LogWatchExtension;
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
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies the configuration precedence: system properties, then the configuration file,
 * then reference.conf.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("snapeval.evaluation.eval-timeout");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    @DisplayName("Defaults come from reference.conf when no file exists")
    void load_usesReferenceDefaults() {
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        assertTrue(config.getBoolean("snapeval.evaluation.enabled"));
        assertEquals(Duration.ofSeconds(30), config.getDuration("snapeval.evaluation.eval-timeout"));
        assertEquals(Duration.ofSeconds(60), config.getDuration("snapeval.evaluation.ready-timeout"));
        assertEquals(1, config.getInt("snapeval.session.worker-threads"));
    }

    @Test
    @DisplayName("Configuration file overrides defaults")
    void load_fileOverridesDefaults() throws IOException {
        File file = writeConfig("snapeval.evaluation { enabled = false, eval-timeout = 2s }");

        Config config = ConfigLoader.load(file);

        assertFalse(config.getBoolean("snapeval.evaluation.enabled"));
        assertEquals(Duration.ofSeconds(2), config.getDuration("snapeval.evaluation.eval-timeout"));
        assertEquals(Duration.ofSeconds(60), config.getDuration("snapeval.evaluation.ready-timeout"));
    }

    @Test
    @DisplayName("System property overrides the configuration file")
    void load_systemPropertyOverridesFile() throws IOException {
        File file = writeConfig("snapeval.evaluation.eval-timeout = 2s");
        System.setProperty("snapeval.evaluation.eval-timeout", "7s");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertEquals(Duration.ofSeconds(7), config.getDuration("snapeval.evaluation.eval-timeout"));
    }

    @Test
    @DisplayName("A directory with the file name is ignored")
    void load_ignoresDirectory() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("snapeval.conf.d"));

        Config config = ConfigLoader.load(directory.toFile());

        assertTrue(config.getBoolean("snapeval.evaluation.enabled"));
    }
}
