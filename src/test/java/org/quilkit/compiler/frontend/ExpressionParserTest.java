package org.quilkit.compiler.frontend;

import org.apache.commons.math3.complex.Complex;
import org.quilkit.compiler.api.CompilationException;
import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.expression.ExpressionException;
import org.quilkit.compiler.expression.ExpressionFunction;
import org.quilkit.compiler.expression.InfixOperator;
import org.quilkit.compiler.expression.MathConstant;
import org.quilkit.compiler.frontend.parser.ExpressionParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Contains unit tests for the {@link ExpressionParser}.
 * These tests pin down operator precedence and associativity and the recognition of
 * constants, functions, variables and memory addresses.
 */
public class ExpressionParserTest {

    private static double real(String text) throws CompilationException, ExpressionException {
        Complex value = ExpressionParser.parse(text).evaluate(Map.of());
        assertThat(value.getImaginary()).isCloseTo(0.0, within(1e-12));
        return value.getReal();
    }

    @Test
    @Tag("unit")
    void testMultiplicationBindsTighterThanAddition() throws Exception {
        // Act
        Expression expression = ExpressionParser.parse("1 + 2 * 3");

        // Assert
        assertThat(expression).isInstanceOf(Expression.Infix.class);
        assertThat(((Expression.Infix) expression).operator()).isEqualTo(InfixOperator.PLUS);
        assertThat(real("1 + 2 * 3")).isEqualTo(7.0);
        assertThat(real("(1 + 2) * 3")).isEqualTo(9.0);
    }

    @Test
    @Tag("unit")
    void testSubtractionAndDivisionAreLeftAssociative() throws Exception {
        assertThat(real("10 - 4 - 3")).isEqualTo(3.0);
        assertThat(real("24 / 4 / 2")).isEqualTo(3.0);
    }

    @Test
    @Tag("unit")
    void testPowerIsRightAssociative() throws Exception {
        assertThat(real("2^3^2")).isEqualTo(512.0);
    }

    @Test
    @Tag("unit")
    void testUnaryMinusBindsTighterThanPower() throws Exception {
        // Act
        Expression expression = ExpressionParser.parse("-2^2");

        // Assert
        assertThat(expression).isInstanceOf(Expression.Infix.class);
        assertThat(((Expression.Infix) expression).left()).isInstanceOf(Expression.Prefix.class);
        assertThat(real("-2^2")).isEqualTo(4.0);
    }

    @Test
    @Tag("unit")
    void testFunctionsAndConstants() throws Exception {
        // Act
        Expression expression = ExpressionParser.parse("COS(PI)");

        // Assert
        assertThat(expression).isInstanceOf(Expression.FunctionCall.class);
        Expression.FunctionCall call = (Expression.FunctionCall) expression;
        assertThat(call.function()).isEqualTo(ExpressionFunction.COS);
        assertThat(call.argument()).isEqualTo(new Expression.Constant(MathConstant.PI));
        assertThat(expression.toString()).isEqualTo("cos(pi)");
        assertThat(real("cos(pi)")).isCloseTo(-1.0, within(1e-12));
        assertThat(real("exp(0) + sin(0)")).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @Tag("unit")
    void testImaginaryUnit() throws Exception {
        // Act
        Complex value = ExpressionParser.parse("2 + 3*i").evaluate(Map.of());

        // Assert
        assertThat(value.getReal()).isEqualTo(2.0);
        assertThat(value.getImaginary()).isEqualTo(3.0);
    }

    @Test
    @Tag("unit")
    void testVariablesAndAddresses() throws Exception {
        // Act
        Expression expression = ExpressionParser.parse("%theta * beta[1] + gamma");

        // Assert
        assertThat(expression.variables()).containsExactly("theta");
        assertThat(expression.addresses()).containsExactly("beta", "gamma");
        assertThat(expression.addressReferences())
                .extracting(address -> address.slot().getAsLong())
                .containsExactly(1L, 0L);
    }

    @Test
    @Tag("unit")
    void testFunctionNameWithoutCallIsAnAddress() throws Exception {
        // Act
        Expression expression = ExpressionParser.parse("sin");

        // Assert
        assertThat(expression).isEqualTo(new Expression.Address("sin", 0));
    }

    @Test
    @Tag("unit")
    void testPrintingKeepsNeededParentheses() throws Exception {
        assertThat(ExpressionParser.parse("(1 + %a) * 2").toString()).isEqualTo("(1 + %a)*2");
        assertThat(ExpressionParser.parse("(2^3)^2").toString()).isEqualTo("(2^3)^2");
        assertThat(ExpressionParser.parse("2^(3^2)").toString()).isEqualTo("2^3^2");
        assertThat(ExpressionParser.parse("%a - (%b - %c)").toString()).isEqualTo("%a - (%b - %c)");
    }

    @Test
    @Tag("unit")
    void testIncompleteExpressionIsRejected() {
        // Act & Assert
        assertThatThrownBy(() -> ExpressionParser.parse("1 +"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).getExpected()).containsExactly("expression"));
    }

    @Test
    @Tag("unit")
    void testTrailingTokensAreRejected() {
        // Act & Assert
        assertThatThrownBy(() -> ExpressionParser.parse("1 2"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("end of input");
    }
}
