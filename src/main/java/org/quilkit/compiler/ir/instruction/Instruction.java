package org.quilkit.compiler.ir.instruction;

/**
 * One Quil instruction. Every variant is an immutable record with content equality.
 * Source positions are kept by the owning {@link org.quilkit.compiler.ir.Program}.
 */
public sealed interface Instruction permits
        GateApplication, Measurement, Reset,
        Arithmetic, UnaryLogic, BinaryLogic, Comparison, Move, Exchange, Convert, Load, Store,
        Label, Jump, JumpWhen, JumpUnless, Halt, Wait, Nop,
        Declaration, Pragma,
        GateDefinition, CircuitDefinition, CalibrationDefinition, MeasureCalibrationDefinition,
        FrameDefinition, WaveformDefinition,
        Pulse, Capture, RawCapture, Delay, Fence, FrameMutation, SwapPhases {

    /**
     * Dispatches to the visitor method of this variant.
     *
     * @param visitor The visitor.
     * @param <T> The result type.
     * @return The visitor's result.
     */
    <T> T accept(InstructionVisitor<T> visitor);

    /**
     * @return {@code true} for declarations and definitions, which are not part of the executable body.
     */
    default boolean isDefinition() {
        return this instanceof Declaration
                || this instanceof GateDefinition
                || this instanceof CircuitDefinition
                || this instanceof CalibrationDefinition
                || this instanceof MeasureCalibrationDefinition
                || this instanceof FrameDefinition
                || this instanceof WaveformDefinition;
    }

    /**
     * @return {@code true} for instructions that may only close a basic block.
     */
    default boolean isTerminator() {
        return this instanceof Jump || this instanceof JumpWhen || this instanceof JumpUnless || this instanceof Halt;
    }
}
