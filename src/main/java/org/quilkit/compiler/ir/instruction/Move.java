package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Copies a value into a memory slot.
 *
 * @param destination Written.
 * @param source Read.
 */
public record Move(
        MemoryReference destination,
        ClassicalOperand source
) implements Instruction {

    public Move {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(source, "source");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
