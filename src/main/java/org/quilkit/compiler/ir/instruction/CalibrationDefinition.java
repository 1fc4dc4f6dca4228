package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.ir.operand.GateModifier;
import org.quilkit.compiler.ir.operand.Qubit;

import java.util.List;
import java.util.Objects;

/**
 * Defines the pulse-level implementation of a gate on specific qubits.
 *
 * @param modifiers Modifiers of the calibrated gate.
 * @param name The gate name.
 * @param parameters Parameter patterns.
 * @param qubits The qubits.
 * @param body The body in order.
 */
public record CalibrationDefinition(
        List<GateModifier> modifiers,
        String name,
        List<Expression> parameters,
        List<Qubit> qubits,
        List<Instruction> body
) implements Instruction {

    public CalibrationDefinition {
        modifiers = List.copyOf(modifiers);
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(parameters);
        qubits = List.copyOf(qubits);
        body = List.copyOf(body);
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
