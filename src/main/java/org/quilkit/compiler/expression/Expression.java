package org.quilkit.compiler.expression;

import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * An immutable, complex-valued arithmetic expression as used in gate parameters, pulse
 * durations, waveform arguments and matrix entries.
 * <p>
 * Two expressions are equal when their simplified forms print to the same canonical text,
 * so {@code 2*pi/2} equals {@code pi}. Every transformation returns a new tree.
 */
public sealed interface Expression permits
        Expression.Number,
        Expression.Constant,
        Expression.Variable,
        Expression.Address,
        Expression.Prefix,
        Expression.Infix,
        Expression.FunctionCall {

    /**
     * A literal complex number.
     * @param value The value.
     */
    record Number(Complex value) implements Expression {
        public Number {
            Objects.requireNonNull(value, "value");
        }

        public Number(double real) {
            this(new Complex(real));
        }

        @Override
        public boolean equals(Object other) {
            return ExpressionPrinter.sameCanonicalForm(this, other);
        }

        @Override
        public int hashCode() {
            return canonicalText().hashCode();
        }

        @Override
        public String toString() {
            return ExpressionPrinter.print(this);
        }
    }

    /**
     * A named mathematical constant ({@code pi} or {@code i}).
     * @param constant The constant.
     */
    record Constant(MathConstant constant) implements Expression {
        public Constant {
            Objects.requireNonNull(constant, "constant");
        }

        @Override
        public boolean equals(Object other) {
            return ExpressionPrinter.sameCanonicalForm(this, other);
        }

        @Override
        public int hashCode() {
            return canonicalText().hashCode();
        }

        @Override
        public String toString() {
            return ExpressionPrinter.print(this);
        }
    }

    /**
     * A parameter variable, written {@code %name}.
     * @param name The name without the leading '%'.
     */
    record Variable(String name) implements Expression {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean equals(Object other) {
            return ExpressionPrinter.sameCanonicalForm(this, other);
        }

        @Override
        public int hashCode() {
            return canonicalText().hashCode();
        }

        @Override
        public String toString() {
            return ExpressionPrinter.print(this);
        }
    }

    /**
     * A classical memory read, written {@code region[index]}.
     * @param region The memory region name.
     * @param index The slot index; usually an integer literal.
     */
    record Address(String region, Expression index) implements Expression {
        public Address {
            Objects.requireNonNull(region, "region");
            Objects.requireNonNull(index, "index");
        }

        public Address(String region, long index) {
            this(region, new Number(index));
        }

        /**
         * @return The slot number if the index simplifies to a non-negative integer, otherwise empty.
         */
        public OptionalLong slot() {
            Long slot = ExpressionRewriter.constantIndex(index);
            return slot == null ? OptionalLong.empty() : OptionalLong.of(slot);
        }

        @Override
        public boolean equals(Object other) {
            return ExpressionPrinter.sameCanonicalForm(this, other);
        }

        @Override
        public int hashCode() {
            return canonicalText().hashCode();
        }

        @Override
        public String toString() {
            return ExpressionPrinter.print(this);
        }
    }

    /**
     * A signed operand.
     * @param operator The sign.
     * @param operand The operand.
     */
    record Prefix(PrefixOperator operator, Expression operand) implements Expression {
        public Prefix {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public boolean equals(Object other) {
            return ExpressionPrinter.sameCanonicalForm(this, other);
        }

        @Override
        public int hashCode() {
            return canonicalText().hashCode();
        }

        @Override
        public String toString() {
            return ExpressionPrinter.print(this);
        }
    }

    /**
     * A binary operation.
     * @param left The left operand.
     * @param operator The operator.
     * @param right The right operand.
     */
    record Infix(Expression left, InfixOperator operator, Expression right) implements Expression {
        public Infix {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public boolean equals(Object other) {
            return ExpressionPrinter.sameCanonicalForm(this, other);
        }

        @Override
        public int hashCode() {
            return canonicalText().hashCode();
        }

        @Override
        public String toString() {
            return ExpressionPrinter.print(this);
        }
    }

    /**
     * A call of a built-in function.
     * @param function The function.
     * @param argument The single argument.
     */
    record FunctionCall(ExpressionFunction function, Expression argument) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(argument, "argument");
        }

        @Override
        public boolean equals(Object other) {
            return ExpressionPrinter.sameCanonicalForm(this, other);
        }

        @Override
        public int hashCode() {
            return canonicalText().hashCode();
        }

        @Override
        public String toString() {
            return ExpressionPrinter.print(this);
        }
    }

    /**
     * Folds constants and trivial identities. Division by a literal zero is left in place.
     * @return The simplified expression.
     */
    default Expression simplify() {
        return ExpressionSimplifier.simplify(this);
    }

    /**
     * Replaces bound {@code %variables} by their values. Unbound variables are kept.
     * @param bindings Variable name (without '%') to value.
     * @return The rewritten expression.
     */
    default Expression substitute(Map<String, Complex> bindings) {
        return ExpressionRewriter.substituteVariables(this, bindings);
    }

    /**
     * Replaces addresses whose region has a value and whose index resolves to a slot of it.
     * @param memory Region name to slot values.
     * @return The rewritten expression.
     */
    default Expression substituteMemory(Map<String, double[]> memory) {
        return ExpressionRewriter.substituteAddresses(this, memory);
    }

    /**
     * Evaluates the expression without memory values.
     * @param bindings Variable name (without '%') to value.
     * @return The complex result.
     * @throws ExpressionException if a name is unbound or a division by zero occurs.
     */
    default Complex evaluate(Map<String, Complex> bindings) throws ExpressionException {
        return evaluate(bindings, Collections.emptyMap());
    }

    /**
     * Evaluates the expression.
     * @param bindings Variable name (without '%') to value.
     * @param memory Region name to slot values.
     * @return The complex result.
     * @throws ExpressionException if a name is unbound or a division by zero occurs.
     */
    default Complex evaluate(Map<String, Complex> bindings, Map<String, double[]> memory) throws ExpressionException {
        return new ExpressionEvaluator(bindings, memory).evaluate(this);
    }

    /**
     * @return The names of all referenced variables, in order of first appearance.
     */
    default Set<String> variables() {
        Set<String> names = new LinkedHashSet<>();
        ExpressionRewriter.visitNodes(this, node -> {
            if (node instanceof Variable v) {
                names.add(v.name());
            }
        });
        return Collections.unmodifiableSet(names);
    }

    /**
     * @return The names of all referenced memory regions, in order of first appearance.
     */
    default Set<String> addresses() {
        Set<String> names = new LinkedHashSet<>();
        for (Address address : addressReferences()) {
            names.add(address.region());
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * @return Every address node, including those nested in other addresses' indices.
     */
    default List<Address> addressReferences() {
        List<Address> result = new ArrayList<>();
        ExpressionRewriter.visitNodes(this, node -> {
            if (node instanceof Address a) {
                result.add(a);
            }
        });
        return Collections.unmodifiableList(result);
    }

    /**
     * @return The printed form of {@link #simplify()}; the basis of equality.
     */
    default String canonicalText() {
        return ExpressionPrinter.print(simplify());
    }

    /**
     * @param value A real value.
     * @return A number literal.
     */
    static Expression real(double value) {
        return new Number(value);
    }

    /**
     * @param name A variable name without the leading '%'.
     * @return A variable reference.
     */
    static Expression variable(String name) {
        return new Variable(name);
    }
}
