package org.quilkit.compiler.ir.operand;

import org.quilkit.compiler.expression.ExpressionPrinter;

import java.util.Objects;

/**
 * The right-hand operand of a classical instruction: a memory slot or a literal.
 */
public sealed interface ClassicalOperand permits ClassicalOperand.IntegerLiteral, ClassicalOperand.RealLiteral, ClassicalOperand.Memory {

    /**
     * @param value The signed integer value.
     */
    record IntegerLiteral(long value) implements ClassicalOperand {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * @param value The signed real value.
     */
    record RealLiteral(double value) implements ClassicalOperand {
        @Override
        public String toString() {
            // Integral values keep their fraction so they read back as reals.
            if (value == Math.rint(value) && Math.abs(value) < 1e15) {
                return ExpressionPrinter.formatReal(value) + ".0";
            }
            return Double.toString(value);
        }
    }

    /**
     * @param reference The memory slot.
     */
    record Memory(MemoryReference reference) implements ClassicalOperand {
        public Memory {
            Objects.requireNonNull(reference, "reference");
        }

        @Override
        public String toString() {
            return reference.toString();
        }
    }
}
