package org.quilkit.compiler.ir.instruction;

import java.util.Objects;

/**
 * A jump target.
 *
 * @param name The label name without '@'.
 */
public record Label(
        String name
) implements Instruction {

    public Label {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
