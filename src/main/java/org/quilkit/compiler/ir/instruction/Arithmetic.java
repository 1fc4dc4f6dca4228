package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * A classical arithmetic update of {@code destination} with {@code source}.
 *
 * @param operator The operation.
 * @param destination Read and written.
 * @param source Read only.
 */
public record Arithmetic(
        ArithmeticOperator operator,
        MemoryReference destination,
        ClassicalOperand source
) implements Instruction {

    public Arithmetic {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(source, "source");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
