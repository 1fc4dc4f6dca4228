package org.quilkit.compiler.ir.instruction;

import java.util.List;
import java.util.Objects;

/**
 * An opaque directive to downstream tools.
 *
 * @param name The pragma name.
 * @param arguments Identifier or integer arguments as written.
 * @param data The trailing string, or {@code null}.
 */
public record Pragma(
        String name,
        List<String> arguments,
        String data
) implements Instruction {

    public Pragma {
        Objects.requireNonNull(name, "name");
        arguments = List.copyOf(arguments);
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
