package org.quilkit.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.quilkit.compiler.diagnostics.ValidationErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the HOCON configuration layer: defaults from {@code reference.conf}, overrides from a
 * configuration file and the logging levels applied to Logback.
 */
public class CompilerSettingsTest {

    private static final String TEST_LOGGER = "org.quilkit.compiler.config.test";

    @AfterEach
    void resetLogging() {
        LoggingConfigurator.reset();
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(TEST_LOGGER).setLevel(null);
    }

    private static Config withDefaults(String hocon) {
        return ConfigFactory.parseString(hocon).withFallback(ConfigFactory.parseResources("reference.conf")).resolve();
    }

    @Test
    @Tag("unit")
    void testReferenceDefaults() {
        // Act
        CompilerSettings settings = CompilerSettings.fromConfig(ConfigFactory.parseResources("reference.conf").resolve());

        // Assert
        assertThat(settings.verbosity()).isEqualTo(2);
        assertThat(settings.indentWidth()).isEqualTo(4);
        assertThat(settings.serializerIndent()).isEqualTo("    ");
        assertThat(settings.pragmaBarrier()).isTrue();
        assertThat(settings.enabledChecks()).containsExactlyInAnyOrder(ValidationErrorKind.values());
    }

    @Test
    @Tag("unit")
    void testOverridesAndLenientCheckNames() {
        // Act
        CompilerSettings settings = CompilerSettings.fromConfig(withDefaults(String.join("\n",
                "quilkit.frontend.indent-width = 2",
                "quilkit.analysis.pragma-barrier = false",
                "quilkit.validation.checks = [duplicate-label, \" arity_mismatch \"]")));

        // Assert
        assertThat(settings.indentWidth()).isEqualTo(2);
        assertThat(settings.pragmaBarrier()).isFalse();
        assertThat(settings.enabledChecks()).containsExactlyInAnyOrder(
                ValidationErrorKind.DUPLICATE_LABEL, ValidationErrorKind.ARITY_MISMATCH);
    }

    @Test
    @Tag("unit")
    void testEmptyCheckListDisablesValidation() {
        // Act
        CompilerSettings settings = CompilerSettings.fromConfig(withDefaults("quilkit.validation.checks = []"));

        // Assert
        assertThat(settings.enabledChecks()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> CompilerSettings.fromConfig(withDefaults("quilkit.validation.checks = [NO_SUCH_CHECK]")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompilerSettings.fromConfig(withDefaults("quilkit.frontend.indent-width = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("indent-width");
    }

    @Test
    @Tag("unit")
    void testLoadMergesConfigurationFile(@TempDir Path tempDir) throws IOException {
        // Arrange
        Path file = tempDir.resolve("quilkit.conf");
        Files.writeString(file, "quilkit.compiler.verbosity = 4\n");

        // Act
        CompilerSettings fromFile = CompilerSettings.fromConfig(ConfigLoader.load(file.toFile()));
        CompilerSettings missing = CompilerSettings.fromConfig(ConfigLoader.load(new File(tempDir.toFile(), "absent.conf")));

        // Assert
        assertThat(fromFile.verbosity()).isEqualTo(4);
        assertThat(missing.verbosity()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testLoggingLevelsAreAppliedOnce() {
        // Arrange
        LoggingConfigurator.reset();
        Config first = ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = DEBUG }");
        Config second = ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = ERROR }");
        Logger logger = (Logger) LoggerFactory.getLogger(TEST_LOGGER);

        // Act
        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);

        // Assert
        assertThat(logger.getLevel()).isEqualTo(Level.DEBUG);
    }
}
