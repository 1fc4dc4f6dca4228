package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.FrameIdentifier;

import java.util.Objects;

/**
 * Exchanges the phases of two frames.
 *
 * @param first The first frame.
 * @param second The second frame.
 */
public record SwapPhases(
        FrameIdentifier first,
        FrameIdentifier second
) implements Instruction {

    public SwapPhases {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
