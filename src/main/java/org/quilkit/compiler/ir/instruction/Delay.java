package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.ir.operand.Qubit;

import java.util.List;
import java.util.Objects;

/**
 * Delays the named frames of the qubits, or all of their frames when none are named.
 *
 * @param qubits The qubits.
 * @param frameNames Frame names, possibly empty.
 * @param duration The duration in seconds.
 */
public record Delay(
        List<Qubit> qubits,
        List<String> frameNames,
        Expression duration
) implements Instruction {

    public Delay {
        qubits = List.copyOf(qubits);
        frameNames = List.copyOf(frameNames);
        Objects.requireNonNull(duration, "duration");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
