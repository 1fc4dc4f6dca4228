package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.Qubit;

import java.util.List;

/**
 * Synchronizes all frames of the qubits, or of every qubit when the list is empty.
 *
 * @param qubits The qubits, possibly empty.
 */
public record Fence(
        List<Qubit> qubits
) implements Instruction {

    public Fence {
        qubits = List.copyOf(qubits);
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
