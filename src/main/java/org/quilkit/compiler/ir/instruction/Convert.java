package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Converts a value between memory types.
 *
 * @param destination Written.
 * @param source Read.
 */
public record Convert(
        MemoryReference destination,
        MemoryReference source
) implements Instruction {

    public Convert {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(source, "source");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
