package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Swaps two memory slots.
 *
 * @param left Read and written.
 * @param right Read and written.
 */
public record Exchange(
        MemoryReference left,
        MemoryReference right
) implements Instruction {

    public Exchange {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
