package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Compares {@code left} with {@code right} and stores the outcome in {@code destination}.
 *
 * @param operator The comparison.
 * @param destination Written.
 * @param left Read.
 * @param right Read.
 */
public record Comparison(
        ComparisonOperator operator,
        MemoryReference destination,
        MemoryReference left,
        ClassicalOperand right
) implements Instruction {

    public Comparison {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
