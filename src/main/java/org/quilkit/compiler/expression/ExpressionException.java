package org.quilkit.compiler.expression;

/**
 * Thrown when an expression cannot be evaluated to a number.
 */
public class ExpressionException extends Exception {

    /**
     * Why evaluation failed.
     */
    public enum Kind {
        /** A division by zero, or zero raised to a negative power. */
        DIVISION_BY_ZERO,
        /** A {@code %variable} had no binding. */
        UNBOUND_VARIABLE,
        /** A memory address had no value, or its index did not resolve to a slot. */
        UNBOUND_ADDRESS
    }

    private final Kind kind;

    public ExpressionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
