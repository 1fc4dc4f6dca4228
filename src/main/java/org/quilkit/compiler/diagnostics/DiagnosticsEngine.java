package org.quilkit.compiler.diagnostics;

import org.quilkit.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An engine for collecting validation errors.
 * <p>
 * This decouples error reporting from the individual checks. Reports for kinds that are
 * not enabled are dropped, so callers never need to test the configuration themselves.
 */
public class DiagnosticsEngine {

    private final List<ValidationError> errors = new ArrayList<>();
    private final Set<ValidationErrorKind> enabled;

    /**
     * Creates an engine that accepts every kind of error.
     */
    public DiagnosticsEngine() {
        this(EnumSet.allOf(ValidationErrorKind.class));
    }

    /**
     * @param enabled The kinds that should be recorded.
     */
    public DiagnosticsEngine(Set<ValidationErrorKind> enabled) {
        this.enabled = enabled.isEmpty() ? EnumSet.noneOf(ValidationErrorKind.class) : EnumSet.copyOf(enabled);
    }

    /**
     * Reports an error.
     *
     * @param kind      The code of the error.
     * @param message   The error message.
     * @param locations The positions involved; {@code null} entries are skipped.
     */
    public void report(ValidationErrorKind kind, String message, List<SourceInfo> locations) {
        if (!enabled.contains(kind)) {
            return;
        }
        List<SourceInfo> known = new ArrayList<>();
        for (SourceInfo location : locations) {
            if (location != null) {
                known.add(location);
            }
        }
        errors.add(new ValidationError(kind, message, known));
    }

    /**
     * Reports an error at a single position.
     *
     * @param kind     The code of the error.
     * @param message  The error message.
     * @param location The position, may be {@code null}.
     */
    public void report(ValidationErrorKind kind, String message, SourceInfo location) {
        report(kind, message, Collections.singletonList(location));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected errors, in the order they were reported.
     *
     * @return An unmodifiable list of errors.
     */
    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Returns all collected errors as a single, formatted string.
     *
     * @return A formatted string summary of all errors.
     */
    public String summary() {
        return errors.stream()
                .map(ValidationError::toString)
                .collect(Collectors.joining("\n"));
    }
}
