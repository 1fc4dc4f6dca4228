package org.quilkit.compiler.expression;

import org.apache.commons.math3.complex.Complex;
import org.quilkit.compiler.frontend.parser.ExpressionParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests evaluation, substitution and simplification of {@link Expression} trees.
 */
public class ExpressionTest {

    private static Expression parse(String text) throws Exception {
        return ExpressionParser.parse(text);
    }

    @Test
    @Tag("unit")
    void testEvaluateWithBindings() throws Exception {
        // Arrange
        Expression expression = parse("2*pi*%theta");

        // Act
        Complex value = expression.evaluate(Map.of("theta", new Complex(0.25)));

        // Assert
        assertThat(value.getReal()).isCloseTo(1.5707963, within(1e-7));
        assertThat(value.getImaginary()).isEqualTo(0.0);
    }

    @Test
    @Tag("unit")
    void testSquareRootOfNegativeIsImaginary() throws Exception {
        // Act
        Complex root = parse("SQRT(-1)").evaluate(Map.of());
        Complex power = parse("(-1)^0.5").evaluate(Map.of());

        // Assert
        assertThat(root.getReal()).isCloseTo(0.0, within(1e-12));
        assertThat(root.getImaginary()).isCloseTo(1.0, within(1e-12));
        assertThat(power.getReal()).isCloseTo(0.0, within(1e-12));
        assertThat(power.getImaginary()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @Tag("unit")
    void testCisIsUnitPhase() throws Exception {
        // Act
        Complex value = parse("cis(pi/2)").evaluate(Map.of());

        // Assert
        assertThat(value.getReal()).isCloseTo(0.0, within(1e-12));
        assertThat(value.getImaginary()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @Tag("unit")
    void testDivisionByZeroFails() throws Exception {
        // Arrange
        Expression expression = parse("1/(%x - %x)");

        // Act & Assert
        assertThatThrownBy(() -> expression.evaluate(Map.of("x", Complex.ONE)))
                .isInstanceOf(ExpressionException.class)
                .extracting(e -> ((ExpressionException) e).getKind())
                .isEqualTo(ExpressionException.Kind.DIVISION_BY_ZERO);
    }

    @Test
    @Tag("unit")
    void testUnboundVariableFails() throws Exception {
        // Arrange
        Expression expression = parse("%phi + 1");

        // Act & Assert
        assertThatThrownBy(() -> expression.evaluate(Map.of()))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("phi")
                .extracting(e -> ((ExpressionException) e).getKind())
                .isEqualTo(ExpressionException.Kind.UNBOUND_VARIABLE);
    }

    @Test
    @Tag("unit")
    void testAddressesResolveAgainstMemory() throws Exception {
        // Arrange
        Expression expression = parse("theta[1] * 2");
        Map<String, double[]> memory = Map.of("theta", new double[]{0.0, 0.75});

        // Act
        Complex value = expression.evaluate(Map.of(), memory);

        // Assert
        assertThat(value.getReal()).isEqualTo(1.5);
        assertThatThrownBy(() -> expression.evaluate(Map.of()))
                .isInstanceOf(ExpressionException.class)
                .extracting(e -> ((ExpressionException) e).getKind())
                .isEqualTo(ExpressionException.Kind.UNBOUND_ADDRESS);
        assertThatThrownBy(() -> parse("theta[5]").evaluate(Map.of(), memory))
                .isInstanceOf(ExpressionException.class)
                .extracting(e -> ((ExpressionException) e).getKind())
                .isEqualTo(ExpressionException.Kind.UNBOUND_ADDRESS);
    }

    @Test
    @Tag("unit")
    void testSubstituteKeepsUnboundVariables() throws Exception {
        // Arrange
        Expression expression = parse("%a + %b");

        // Act
        Expression substituted = expression.substitute(Map.of("a", new Complex(2.0)));

        // Assert
        assertThat(substituted.variables()).containsExactly("b");
        assertThat(substituted).isEqualTo(parse("2 + %b"));
    }

    @Test
    @Tag("unit")
    void testSubstituteMemoryThenSimplify() throws Exception {
        // Arrange
        Expression expression = parse("2*theta[0] + phi[0]");

        // Act
        Expression substituted = expression.substituteMemory(Map.of("theta", new double[]{0.5}));

        // Assert
        assertThat(substituted.addresses()).containsExactly("phi");
        assertThat(substituted.simplify().toString()).isEqualTo("1 + phi[0]");
    }

    @Test
    @Tag("unit")
    void testSimplifyRemovesIdentities() throws Exception {
        assertThat(parse("%x * 1").simplify()).isEqualTo(new Expression.Variable("x"));
        assertThat(parse("0 + %x").simplify().toString()).isEqualTo("%x");
        assertThat(parse("%x ^ 0").simplify().toString()).isEqualTo("1");
        assertThat(parse("--%x").simplify().toString()).isEqualTo("%x");
        assertThat(parse("%x / 1 - 0").simplify().toString()).isEqualTo("%x");
    }

    @Test
    @Tag("unit")
    void testSimplifyLeavesDivisionByZero() throws Exception {
        // Act
        Expression simplified = parse("1/0").simplify();

        // Assert
        assertThat(simplified).isInstanceOf(Expression.Infix.class);
        assertThat(simplified.toString()).isEqualTo("1/0");
    }

    @Test
    @Tag("unit")
    void testSimplifyKeepsOverflowingFoldsUnfolded() throws Exception {
        // Act
        Expression product = parse("1e300 * 1e300").simplify();
        Expression exponential = parse("exp(1000)").simplify();

        // Assert
        assertThat(product).isInstanceOf(Expression.Infix.class);
        assertThat(exponential).isInstanceOf(Expression.FunctionCall.class);
        assertThat(ExpressionParser.parse(product.toString())).isEqualTo(product);
    }

    @Test
    @Tag("unit")
    void testEqualityComparesSimplifiedForms() throws Exception {
        assertThat(parse("2*pi/2")).isEqualTo(parse("pi"));
        assertThat(parse("2*pi/2").hashCode()).isEqualTo(parse("pi").hashCode());
        assertThat(parse("%a + 1")).isNotEqualTo(parse("1 + %a"));
    }

    @Test
    @Tag("unit")
    void testComplexLiteralsPrintAsSums() {
        assertThat(ExpressionPrinter.formatComplex(new Complex(1.0, 1.0))).isEqualTo("1+i");
        assertThat(ExpressionPrinter.formatComplex(new Complex(0.5, -2.0))).isEqualTo("0.5-2*i");
        assertThat(ExpressionPrinter.formatComplex(new Complex(0.0, -1.0))).isEqualTo("-i");
        assertThat(ExpressionPrinter.formatReal(3.0)).isEqualTo("3");
    }
}
