package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.FrameIdentifier;
import org.quilkit.compiler.ir.operand.MemoryReference;
import org.quilkit.compiler.ir.operand.WaveformInvocation;

import java.util.Objects;

/**
 * Integrates a frame's signal against a waveform and stores the result.
 *
 * @param blocking {@code false} when written with NONBLOCKING.
 * @param frame The frame.
 * @param waveform The kernel.
 * @param target The result slot.
 */
public record Capture(
        boolean blocking,
        FrameIdentifier frame,
        WaveformInvocation waveform,
        MemoryReference target
) implements Instruction {

    public Capture {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(waveform, "waveform");
        Objects.requireNonNull(target, "target");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
