package org.quilkit.compiler.expression;

import org.apache.commons.math3.complex.Complex;

/**
 * Constant folding and identity elimination.
 */
final class ExpressionSimplifier {

    private ExpressionSimplifier() {
    }

    static Expression simplify(Expression expression) {
        return ExpressionRewriter.rewrite(expression, ExpressionSimplifier::fold);
    }

    /**
     * Folds one node whose children are already simplified.
     */
    private static Expression fold(Expression node) {
        if (node instanceof Expression.Constant c) {
            return new Expression.Number(c.constant().value());
        }
        if (node instanceof Expression.Prefix p) {
            return foldPrefix(p);
        }
        if (node instanceof Expression.Infix i) {
            return foldInfix(i);
        }
        if (node instanceof Expression.FunctionCall f && f.argument() instanceof Expression.Number n) {
            return folded(ComplexArithmetic.apply(f.function(), n.value()), node);
        }
        return node;
    }

    /**
     * A value with no finite literal form stays unfolded.
     */
    private static Expression folded(Complex value, Expression original) {
        if (value.isNaN() || value.isInfinite()) {
            return original;
        }
        return new Expression.Number(value);
    }

    private static Expression foldPrefix(Expression.Prefix prefix) {
        Expression operand = prefix.operand();
        if (prefix.operator() == PrefixOperator.PLUS) {
            return operand;
        }
        if (operand instanceof Expression.Number n) {
            return new Expression.Number(ComplexArithmetic.negate(n.value()));
        }
        if (operand instanceof Expression.Prefix inner && inner.operator() == PrefixOperator.MINUS) {
            return inner.operand();
        }
        return prefix;
    }

    private static Expression foldInfix(Expression.Infix infix) {
        Expression left = infix.left();
        Expression right = infix.right();
        InfixOperator operator = infix.operator();

        if (left instanceof Expression.Number l && right instanceof Expression.Number r) {
            if (ComplexArithmetic.isDefined(operator, l.value(), r.value())) {
                return folded(ComplexArithmetic.apply(operator, l.value(), r.value()), infix);
            }
            return infix;
        }

        switch (operator) {
            case PLUS:
                if (isZero(right)) return left;
                if (isZero(left)) return right;
                break;
            case MINUS:
                if (isZero(right)) return left;
                break;
            case STAR:
                if (isOne(right)) return left;
                if (isOne(left)) return right;
                break;
            case SLASH:
                if (isOne(right)) return left;
                break;
            case CARET:
                if (isOne(right)) return left;
                if (isZero(right)) return new Expression.Number(Complex.ONE);
                break;
            default:
                break;
        }
        return infix;
    }

    private static boolean isZero(Expression expression) {
        return expression instanceof Expression.Number n && ComplexArithmetic.isZero(n.value());
    }

    private static boolean isOne(Expression expression) {
        return expression instanceof Expression.Number n && ComplexArithmetic.isOne(n.value());
    }
}
