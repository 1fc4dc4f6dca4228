package org.quilkit.compiler.expression;

/**
 * Unary sign operators.
 */
public enum PrefixOperator {
    PLUS("+"),
    MINUS("-");

    private final String symbol;

    PrefixOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
