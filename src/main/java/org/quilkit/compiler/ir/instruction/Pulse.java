package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.FrameIdentifier;
import org.quilkit.compiler.ir.operand.WaveformInvocation;

import java.util.Objects;

/**
 * Plays a waveform on a frame.
 *
 * @param blocking {@code false} when written with NONBLOCKING.
 * @param frame The frame.
 * @param waveform The waveform.
 */
public record Pulse(
        boolean blocking,
        FrameIdentifier frame,
        WaveformInvocation waveform
) implements Instruction {

    public Pulse {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(waveform, "waveform");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
