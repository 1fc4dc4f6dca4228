package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.Qubit;

import java.util.List;

/**
 * Defines the pulse-level implementation of {@code MEASURE}.
 *
 * @param qubit The qubit, or {@code null} for any qubit.
 * @param parameter The memory parameter name, or {@code null} for a discarding measurement.
 * @param body The body in order.
 */
public record MeasureCalibrationDefinition(
        Qubit qubit,
        String parameter,
        List<Instruction> body
) implements Instruction {

    public MeasureCalibrationDefinition {
        body = List.copyOf(body);
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
