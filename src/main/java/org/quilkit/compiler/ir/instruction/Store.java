package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Writes {@code source} into {@code region[offset]}, with the index taken from memory.
 *
 * @param region The target region; any of its slots may be written.
 * @param offset Holds the index.
 * @param source The stored value.
 */
public record Store(
        String region,
        MemoryReference offset,
        ClassicalOperand source
) implements Instruction {

    public Store {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(offset, "offset");
        Objects.requireNonNull(source, "source");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
