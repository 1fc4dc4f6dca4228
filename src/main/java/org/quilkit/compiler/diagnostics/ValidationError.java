package org.quilkit.compiler.diagnostics;

import org.quilkit.compiler.api.SourceInfo;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A single, non-fatal issue found while validating a program.
 *
 * @param kind The code of the issue.
 * @param message A human-readable description.
 * @param locations Every source position involved; empty for instructions built in code.
 */
public record ValidationError(
        ValidationErrorKind kind,
        String message,
        List<SourceInfo> locations
) {

    public ValidationError {
        locations = List.copyOf(locations);
    }

    @Override
    public String toString() {
        if (locations.isEmpty()) {
            return String.format("[%s] %s", kind, message);
        }
        String where = locations.stream().map(SourceInfo::toString).collect(Collectors.joining(", "));
        return String.format("[%s] %s: %s", kind, where, message);
    }
}
