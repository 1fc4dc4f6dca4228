package org.quilkit.compiler.ir.instruction;

import java.util.List;
import java.util.Objects;

/**
 * Defines a named, parameterized sequence of instructions.
 * Labels inside the body are local to it.
 *
 * @param name The circuit name.
 * @param parameters Parameter names without '%'.
 * @param qubitVariables Names of the qubit placeholders.
 * @param body The body in order.
 */
public record CircuitDefinition(
        String name,
        List<String> parameters,
        List<String> qubitVariables,
        List<Instruction> body
) implements Instruction {

    public CircuitDefinition {
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(parameters);
        qubitVariables = List.copyOf(qubitVariables);
        body = List.copyOf(body);
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
