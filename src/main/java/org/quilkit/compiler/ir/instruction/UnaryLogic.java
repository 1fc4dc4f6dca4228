package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Negates a memory slot in place.
 *
 * @param operator NEG or NOT.
 * @param operand Read and written.
 */
public record UnaryLogic(
        UnaryLogicOperator operator,
        MemoryReference operand
) implements Instruction {

    public UnaryLogic {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
