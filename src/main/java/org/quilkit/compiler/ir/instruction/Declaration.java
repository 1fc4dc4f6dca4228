package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.Sharing;
import org.quilkit.compiler.ir.operand.Vector;

import java.util.Objects;

/**
 * Declares a classical memory region.
 *
 * @param name The region name.
 * @param size Element type and length.
 * @param sharing The aliased region, or {@code null}.
 */
public record Declaration(
        String name,
        Vector size,
        Sharing sharing
) implements Instruction {

    public Declaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(size, "size");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
