package org.quilkit.compiler.expression;

import org.apache.commons.math3.complex.Complex;

/**
 * Prints expressions in Quil syntax with the fewest parentheses that keep the tree intact.
 */
public final class ExpressionPrinter {

    static final int ADDITIVE = 1;
    static final int MULTIPLICATIVE = 2;
    static final int POWER = 3;
    static final int UNARY = 4;
    static final int PRIMARY = 5;

    private ExpressionPrinter() {
    }

    /**
     * @param expression The expression to print.
     * @return Quil source text that parses back to an equal tree.
     */
    public static String print(Expression expression) {
        StringBuilder out = new StringBuilder();
        append(expression, out);
        return out.toString();
    }

    /**
     * Formats a real number in its shortest exact form: integral values without a fraction,
     * everything else as {@link Double#toString(double)}.
     * @param value The value.
     * @return The literal text.
     */
    public static String formatReal(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * @param value The value.
     * @return The literal text, {@code re+im*i} when both parts are non-zero.
     */
    public static String formatComplex(Complex value) {
        double re = value.getReal();
        double im = value.getImaginary();
        if (im == 0) {
            return formatReal(re);
        }
        String imaginary = formatImaginary(im);
        if (re == 0) {
            return imaginary;
        }
        return formatReal(re) + (im > 0 ? "+" : "") + imaginary;
    }

    static boolean sameCanonicalForm(Expression self, Object other) {
        if (self == other) {
            return true;
        }
        return other instanceof Expression that && self.canonicalText().equals(that.canonicalText());
    }

    private static String formatImaginary(double im) {
        if (im == 1) {
            return "i";
        }
        if (im == -1) {
            return "-i";
        }
        return formatReal(im) + "*i";
    }

    private static int precedence(Expression expression) {
        if (expression instanceof Expression.Number n) {
            return numberPrecedence(n.value());
        }
        if (expression instanceof Expression.Prefix) {
            return UNARY;
        }
        if (expression instanceof Expression.Infix i) {
            return i.operator().precedence();
        }
        return PRIMARY;
    }

    private static int numberPrecedence(Complex value) {
        double re = value.getReal();
        double im = value.getImaginary();
        if (im == 0) {
            return re < 0 ? UNARY : PRIMARY;
        }
        if (re != 0) {
            return ADDITIVE;
        }
        if (im == 1) {
            return PRIMARY;
        }
        return im == -1 ? UNARY : MULTIPLICATIVE;
    }

    private static void append(Expression expression, StringBuilder out) {
        if (expression instanceof Expression.Number n) {
            out.append(formatComplex(n.value()));
        } else if (expression instanceof Expression.Constant c) {
            out.append(c.constant().spelling());
        } else if (expression instanceof Expression.Variable v) {
            out.append('%').append(v.name());
        } else if (expression instanceof Expression.Address a) {
            out.append(a.region()).append('[');
            append(a.index(), out);
            out.append(']');
        } else if (expression instanceof Expression.Prefix p) {
            out.append(p.operator().symbol());
            appendOperand(p.operand(), precedence(p.operand()) < UNARY, out);
        } else if (expression instanceof Expression.Infix i) {
            appendInfix(i, out);
        } else if (expression instanceof Expression.FunctionCall f) {
            out.append(f.function().spelling()).append('(');
            append(f.argument(), out);
            out.append(')');
        } else {
            throw new IllegalStateException("Unknown expression type: " + expression.getClass().getSimpleName());
        }
    }

    private static void appendInfix(Expression.Infix infix, StringBuilder out) {
        InfixOperator operator = infix.operator();
        int own = operator.precedence();
        int left = precedence(infix.left());
        int right = precedence(infix.right());

        boolean wrapLeft = left < own || (operator.isRightAssociative() && left == own);
        boolean wrapRight = right < own || (!operator.isRightAssociative() && right == own);

        appendOperand(infix.left(), wrapLeft, out);
        if (own == ADDITIVE) {
            out.append(' ').append(operator.symbol()).append(' ');
        } else {
            out.append(operator.symbol());
        }
        appendOperand(infix.right(), wrapRight, out);
    }

    private static void appendOperand(Expression operand, boolean parenthesize, StringBuilder out) {
        if (parenthesize) {
            out.append('(');
            append(operand, out);
            out.append(')');
        } else {
            append(operand, out);
        }
    }
}
