package org.quilkit.compiler.expression;

import org.apache.commons.math3.complex.Complex;

import java.util.Map;

/**
 * Evaluates an expression tree to a single complex value.
 */
final class ExpressionEvaluator {

    private final Map<String, Complex> bindings;
    private final Map<String, double[]> memory;

    ExpressionEvaluator(Map<String, Complex> bindings, Map<String, double[]> memory) {
        this.bindings = bindings;
        this.memory = memory;
    }

    Complex evaluate(Expression expression) throws ExpressionException {
        if (expression instanceof Expression.Number n) {
            return n.value();
        }
        if (expression instanceof Expression.Constant c) {
            return c.constant().value();
        }
        if (expression instanceof Expression.Variable v) {
            Complex value = bindings.get(v.name());
            if (value == null) {
                throw new ExpressionException(ExpressionException.Kind.UNBOUND_VARIABLE,
                        "No value bound for %" + v.name());
            }
            return value;
        }
        if (expression instanceof Expression.Address a) {
            return readMemory(a);
        }
        if (expression instanceof Expression.Prefix p) {
            Complex operand = evaluate(p.operand());
            return p.operator() == PrefixOperator.MINUS ? ComplexArithmetic.negate(operand) : operand;
        }
        if (expression instanceof Expression.Infix i) {
            Complex left = evaluate(i.left());
            Complex right = evaluate(i.right());
            if (!ComplexArithmetic.isDefined(i.operator(), left, right)) {
                throw new ExpressionException(ExpressionException.Kind.DIVISION_BY_ZERO,
                        "Division by zero in " + i);
            }
            return ComplexArithmetic.apply(i.operator(), left, right);
        }
        if (expression instanceof Expression.FunctionCall f) {
            return ComplexArithmetic.apply(f.function(), evaluate(f.argument()));
        }
        throw new IllegalStateException("Unknown expression type: " + expression.getClass().getSimpleName());
    }

    private Complex readMemory(Expression.Address address) throws ExpressionException {
        double[] values = memory.get(address.region());
        if (values == null) {
            throw new ExpressionException(ExpressionException.Kind.UNBOUND_ADDRESS,
                    "No memory values for region " + address.region());
        }
        Complex index = evaluate(address.index());
        double slot = index.getReal();
        if (!ComplexArithmetic.isReal(index) || slot < 0 || slot != Math.rint(slot) || slot >= values.length) {
            throw new ExpressionException(ExpressionException.Kind.UNBOUND_ADDRESS,
                    "Index " + ExpressionPrinter.formatComplex(index) + " is not a slot of " + address.region());
        }
        return new Complex(values[(int) slot]);
    }
}
