package org.quilkit.compiler.expression;

import java.util.Locale;
import java.util.Optional;

/**
 * The built-in single-argument functions. Names are matched case-insensitively.
 */
public enum ExpressionFunction {
    SIN("sin"),
    COS("cos"),
    SQRT("sqrt"),
    EXP("exp"),
    CIS("cis");

    private final String spelling;

    ExpressionFunction(String spelling) {
        this.spelling = spelling;
    }

    /**
     * @return The canonical (lower-case) spelling.
     */
    public String spelling() {
        return spelling;
    }

    /**
     * @param name A function name as written in source.
     * @return The function, or empty if the name is not built in.
     */
    public static Optional<ExpressionFunction> fromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (ExpressionFunction function : values()) {
            if (function.spelling.equals(lower)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
