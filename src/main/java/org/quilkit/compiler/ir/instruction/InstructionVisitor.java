package org.quilkit.compiler.ir.instruction;

/**
 * A visitor over all instruction variants.
 * Adding a variant breaks every implementation, which keeps the analyses exhaustive.
 *
 * @param <T> The return type of the visit methods.
 */
public interface InstructionVisitor<T> {
    T visit(GateApplication instruction);
    T visit(Measurement instruction);
    T visit(Reset instruction);
    T visit(Arithmetic instruction);
    T visit(UnaryLogic instruction);
    T visit(BinaryLogic instruction);
    T visit(Comparison instruction);
    T visit(Move instruction);
    T visit(Exchange instruction);
    T visit(Convert instruction);
    T visit(Load instruction);
    T visit(Store instruction);
    T visit(Label instruction);
    T visit(Jump instruction);
    T visit(JumpWhen instruction);
    T visit(JumpUnless instruction);
    T visit(Halt instruction);
    T visit(Wait instruction);
    T visit(Nop instruction);
    T visit(Declaration instruction);
    T visit(Pragma instruction);
    T visit(GateDefinition instruction);
    T visit(CircuitDefinition instruction);
    T visit(CalibrationDefinition instruction);
    T visit(MeasureCalibrationDefinition instruction);
    T visit(FrameDefinition instruction);
    T visit(WaveformDefinition instruction);
    T visit(Pulse instruction);
    T visit(Capture instruction);
    T visit(RawCapture instruction);
    T visit(Delay instruction);
    T visit(Fence instruction);
    T visit(FrameMutation instruction);
    T visit(SwapPhases instruction);
}
