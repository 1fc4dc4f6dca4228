package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.MemoryReference;
import org.quilkit.compiler.ir.operand.Qubit;

import java.util.Objects;

/**
 * Measures a qubit, optionally storing the result.
 *
 * @param qubit The measured qubit.
 * @param target The result slot, or {@code null} to discard the result.
 */
public record Measurement(
        Qubit qubit,
        MemoryReference target
) implements Instruction {

    public Measurement {
        Objects.requireNonNull(qubit, "qubit");
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
