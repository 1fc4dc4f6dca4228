package org.quilkit.compiler.ir.instruction;

import java.util.List;
import java.util.Objects;

/**
 * Defines a gate by matrix, permutation or Pauli sum.
 *
 * @param name The gate name.
 * @param parameters Parameter names without '%'.
 * @param specification The definition body.
 */
public record GateDefinition(
        String name,
        List<String> parameters,
        GateSpecification specification
) implements Instruction {

    public GateDefinition {
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(parameters);
        Objects.requireNonNull(specification, "specification");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
