package org.chasm.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.chasm.junit.extensions.logging.LogWatchExtension;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties, then environment variables, then the file, then reference.conf.
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
        System.clearProperty("chasm.output.format");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when no file is given")
    void load_shouldUseReferenceDefaults() {
        Config config = ConfigLoader.load(null);

        assertThat(config.getString("chasm.output.file")).isEqualTo("out.c8c");
        assertThat(config.getString("chasm.output.format")).isEqualTo("BINARY");
        assertThat(config.getInt("chasm.compiler.verbosity")).isEqualTo(2);
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    @DisplayName("Configuration file should override reference defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        Config config = ConfigLoader.load(writeConfig("chasm.output { format = HEX, file = \"game.hex\" }"));

        assertThat(config.getString("chasm.output.format")).isEqualTo("HEX");
        assertThat(config.getString("chasm.output.file")).isEqualTo("game.hex");
        assertThat(config.getInt("chasm.compiler.verbosity")).isEqualTo(2);
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        System.setProperty("chasm.output.format", "JSON");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(writeConfig("chasm.output.format = HEX"));

        assertThat(config.getString("chasm.output.format")).isEqualTo("JSON");
    }

    @Test
    @DisplayName("Substitutions should resolve across sources")
    void load_shouldResolveSubstitutions() throws IOException {
        Config config = ConfigLoader.load(writeConfig("base = \"build\"\nchasm.output.file = ${base}\"/rom.c8c\""));

        assertThat(config.getString("chasm.output.file")).isEqualTo("build/rom.c8c");
    }

    @Test
    @DisplayName("Malformed file should be reported as ConfigException")
    void load_shouldRejectMalformedFile() throws IOException {
        File broken = writeConfig("chasm.output { format = ");

        assertThatThrownBy(() -> ConfigLoader.load(broken)).isInstanceOf(ConfigException.class);
    }
}
