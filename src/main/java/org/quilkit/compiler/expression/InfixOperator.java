package org.quilkit.compiler.expression;

/**
 * Binary operators of the expression language, with their print precedence.
 */
public enum InfixOperator {
    PLUS("+", ExpressionPrinter.ADDITIVE),
    MINUS("-", ExpressionPrinter.ADDITIVE),
    STAR("*", ExpressionPrinter.MULTIPLICATIVE),
    SLASH("/", ExpressionPrinter.MULTIPLICATIVE),
    CARET("^", ExpressionPrinter.POWER);

    private final String symbol;
    private final int precedence;

    InfixOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * @return {@code true} for '^', the only right-associative operator.
     */
    public boolean isRightAssociative() {
        return this == CARET;
    }
}
