package org.quilkit.compiler.ir.instruction;

import java.util.Objects;

/**
 * An unconditional jump.
 *
 * @param target The label name without '@'.
 */
public record Jump(
        String target
) implements Instruction {

    public Jump {
        Objects.requireNonNull(target, "target");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
