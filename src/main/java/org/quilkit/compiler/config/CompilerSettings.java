package org.quilkit.compiler.config;

import com.typesafe.config.Config;
import org.quilkit.compiler.diagnostics.ValidationErrorKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Typed view of the {@code quilkit} configuration section.
 *
 * @param verbosity Compiler log verbosity (see {@link org.quilkit.compiler.diagnostics.CompilerLogger}).
 * @param indentWidth Number of leading spaces that mark an indented line in the lexer.
 * @param serializerIndent Text placed before every block body line by the serializer.
 * @param pragmaBarrier Whether {@code PRAGMA} acts as a full barrier in dependency graphs.
 * @param enabledChecks The validation checks that report errors.
 */
public record CompilerSettings(
        int verbosity,
        int indentWidth,
        String serializerIndent,
        boolean pragmaBarrier,
        Set<ValidationErrorKind> enabledChecks
) {

    private static volatile CompilerSettings defaults;

    public CompilerSettings {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indent-width must be positive: " + indentWidth);
        }
        enabledChecks = enabledChecks.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(enabledChecks));
    }

    /**
     * Reads the settings from a resolved configuration that contains the {@code quilkit} section.
     *
     * @param config The configuration, usually from {@link ConfigLoader#load()}.
     * @return The typed settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     * @throws IllegalArgumentException if a check name is unknown.
     */
    public static CompilerSettings fromConfig(Config config) {
        Config root = config.getConfig("quilkit");
        List<String> checkNames = root.getStringList("validation.checks");
        Set<ValidationErrorKind> checks = EnumSet.noneOf(ValidationErrorKind.class);
        for (String name : checkNames) {
            checks.add(ValidationErrorKind.valueOf(name.trim().toUpperCase().replace('-', '_')));
        }
        return new CompilerSettings(
                root.getInt("compiler.verbosity"),
                root.getInt("frontend.indent-width"),
                root.getString("serializer.indent"),
                root.getBoolean("analysis.pragma-barrier"),
                checks);
    }

    /**
     * Returns the settings loaded once through {@link ConfigLoader#load()}.
     *
     * @return The shared default settings.
     */
    public static CompilerSettings defaults() {
        CompilerSettings result = defaults;
        if (result == null) {
            synchronized (CompilerSettings.class) {
                result = defaults;
                if (result == null) {
                    Config config = ConfigLoader.load();
                    LoggingConfigurator.configure(config);
                    result = fromConfig(config);
                    defaults = result;
                }
            }
        }
        return result;
    }
}
