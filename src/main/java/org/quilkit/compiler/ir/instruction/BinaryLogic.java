package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * A bitwise update of {@code destination} with {@code source}.
 *
 * @param operator The operation.
 * @param destination Read and written.
 * @param source Read only.
 */
public record BinaryLogic(
        BinaryLogicOperator operator,
        MemoryReference destination,
        ClassicalOperand source
) implements Instruction {

    public BinaryLogic {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(source, "source");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
