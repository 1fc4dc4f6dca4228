package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.ir.operand.GateModifier;
import org.quilkit.compiler.ir.operand.Qubit;

import java.util.List;
import java.util.Objects;

/**
 * Applies a named gate, possibly modified, to one or more qubits.
 *
 * @param name The gate name.
 * @param modifiers Modifiers in source order, outermost first.
 * @param parameters The gate parameters.
 * @param qubits The target qubits, controls first.
 */
public record GateApplication(
        String name,
        List<GateModifier> modifiers,
        List<Expression> parameters,
        List<Qubit> qubits
) implements Instruction {

    public GateApplication {
        Objects.requireNonNull(name, "name");
        modifiers = List.copyOf(modifiers);
        parameters = List.copyOf(parameters);
        qubits = List.copyOf(qubits);
        if (qubits.isEmpty()) {
            throw new IllegalArgumentException("Gate " + name + " needs at least one qubit");
        }
    }

    public GateApplication(String name, List<Expression> parameters, List<Qubit> qubits) {
        this(name, List.of(), parameters, qubits);
    }

    /**
     * @param modifier The modifier to count.
     * @return How often the modifier is applied.
     */
    public int count(GateModifier modifier) {
        int count = 0;
        for (GateModifier m : modifiers) {
            if (m == modifier) {
                count++;
            }
        }
        return count;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
