package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.expression.Expression;

import java.util.List;
import java.util.Objects;

/**
 * Defines a waveform by explicit samples.
 *
 * @param name The waveform name.
 * @param parameters Parameter names without '%'.
 * @param samples The samples.
 */
public record WaveformDefinition(
        String name,
        List<String> parameters,
        List<Expression> samples
) implements Instruction {

    public WaveformDefinition {
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(parameters);
        samples = List.copyOf(samples);
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
