package org.quilkit.compiler.expression;

import org.apache.commons.math3.complex.Complex;

import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Structural walks over expression trees: bottom-up rewriting and pre-order visiting.
 */
final class ExpressionRewriter {

    private ExpressionRewriter() {
    }

    /**
     * Rebuilds the tree bottom-up, applying {@code rewrite} to every node after its children.
     */
    static Expression rewrite(Expression expression, Function<Expression, Expression> rewrite) {
        Expression rebuilt;
        if (expression instanceof Expression.Address a) {
            rebuilt = new Expression.Address(a.region(), rewrite(a.index(), rewrite));
        } else if (expression instanceof Expression.Prefix p) {
            rebuilt = new Expression.Prefix(p.operator(), rewrite(p.operand(), rewrite));
        } else if (expression instanceof Expression.Infix i) {
            rebuilt = new Expression.Infix(rewrite(i.left(), rewrite), i.operator(), rewrite(i.right(), rewrite));
        } else if (expression instanceof Expression.FunctionCall f) {
            rebuilt = new Expression.FunctionCall(f.function(), rewrite(f.argument(), rewrite));
        } else {
            rebuilt = expression;
        }
        return rewrite.apply(rebuilt);
    }

    static void visitNodes(Expression expression, Consumer<Expression> visitor) {
        visitor.accept(expression);
        if (expression instanceof Expression.Address a) {
            visitNodes(a.index(), visitor);
        } else if (expression instanceof Expression.Prefix p) {
            visitNodes(p.operand(), visitor);
        } else if (expression instanceof Expression.Infix i) {
            visitNodes(i.left(), visitor);
            visitNodes(i.right(), visitor);
        } else if (expression instanceof Expression.FunctionCall f) {
            visitNodes(f.argument(), visitor);
        }
    }

    static Expression substituteVariables(Expression expression, Map<String, Complex> bindings) {
        return rewrite(expression, node -> {
            if (node instanceof Expression.Variable v && bindings.containsKey(v.name())) {
                return new Expression.Number(bindings.get(v.name()));
            }
            return node;
        });
    }

    static Expression substituteAddresses(Expression expression, Map<String, double[]> memory) {
        return rewrite(expression, node -> {
            if (node instanceof Expression.Address a) {
                double[] values = memory.get(a.region());
                Long slot = constantIndex(a.index());
                if (values != null && slot != null && slot < values.length) {
                    return new Expression.Number(values[slot.intValue()]);
                }
            }
            return node;
        });
    }

    /**
     * Resolves an address index that simplifies to a non-negative integer.
     * @return The slot, or {@code null} if the index is symbolic or not a valid slot number.
     */
    static Long constantIndex(Expression index) {
        Expression simplified = index.simplify();
        if (simplified instanceof Expression.Number n && ComplexArithmetic.isReal(n.value())) {
            double real = n.value().getReal();
            if (real >= 0 && real == Math.rint(real) && real <= Long.MAX_VALUE) {
                return (long) real;
            }
        }
        return null;
    }
}
