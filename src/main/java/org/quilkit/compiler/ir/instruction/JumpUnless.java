package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Jumps when the condition slot is zero.
 *
 * @param target The label name without '@'.
 * @param condition The tested slot.
 */
public record JumpUnless(
        String target,
        MemoryReference condition
) implements Instruction {

    public JumpUnless {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(condition, "condition");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
