package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.Qubit;

/**
 * Resets one qubit, or every qubit when {@code qubit} is {@code null}.
 *
 * @param qubit The qubit, or {@code null} for all.
 */
public record Reset(
        Qubit qubit
) implements Instruction {

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
