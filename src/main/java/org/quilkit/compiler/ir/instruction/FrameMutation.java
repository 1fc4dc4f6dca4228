package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.ir.operand.FrameIdentifier;

import java.util.Objects;

/**
 * Sets or shifts a frequency, phase or scale of a frame.
 *
 * @param operation The mutation.
 * @param frame The frame.
 * @param value The new value or shift.
 */
public record FrameMutation(
        FrameOperation operation,
        FrameIdentifier frame,
        Expression value
) implements Instruction {

    public FrameMutation {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
