package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.ir.operand.FrameIdentifier;
import org.quilkit.compiler.ir.operand.MemoryReference;

import java.util.Objects;

/**
 * Records a frame's raw signal for a duration.
 *
 * @param blocking {@code false} when written with NONBLOCKING.
 * @param frame The frame.
 * @param duration The duration in seconds.
 * @param target The first result slot.
 */
public record RawCapture(
        boolean blocking,
        FrameIdentifier frame,
        Expression duration,
        MemoryReference target
) implements Instruction {

    public RawCapture {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(target, "target");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
