package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Reads {@code region[offset]} into {@code destination}, with the index taken from memory.
 *
 * @param destination Written.
 * @param region The source region; any of its slots may be read.
 * @param offset Holds the index.
 */
public record Load(
        MemoryReference destination,
        String region,
        MemoryReference offset
) implements Instruction {

    public Load {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(offset, "offset");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
