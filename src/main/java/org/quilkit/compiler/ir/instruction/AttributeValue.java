package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.expression.Expression;

import java.util.Objects;

/**
 * The value of a {@code DEFFRAME} attribute.
 */
public sealed interface AttributeValue permits AttributeValue.Text, AttributeValue.Expr {

    /**
     * A quoted string value.
     * @param value The unescaped content.
     */
    record Text(String value) implements AttributeValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * A numeric value.
     * @param value The expression.
     */
    record Expr(Expression value) implements AttributeValue {
        public Expr {
            Objects.requireNonNull(value, "value");
        }
    }
}
