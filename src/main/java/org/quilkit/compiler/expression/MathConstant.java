package org.quilkit.compiler.expression;

import org.apache.commons.math3.complex.Complex;

import java.util.Locale;
import java.util.Optional;

/**
 * Named constants that fold to numbers during simplification.
 */
public enum MathConstant {
    PI("pi", new Complex(Math.PI)),
    I("i", Complex.I);

    private final String spelling;
    private final Complex value;

    MathConstant(String spelling, Complex value) {
        this.spelling = spelling;
        this.value = value;
    }

    public String spelling() {
        return spelling;
    }

    public Complex value() {
        return value;
    }

    /**
     * @param name A word as written in source, matched case-insensitively.
     * @return The constant, or empty if the word does not name one.
     */
    public static Optional<MathConstant> fromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (MathConstant constant : values()) {
            if (constant.spelling.equals(lower)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
