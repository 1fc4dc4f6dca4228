package org.quilkit.compiler.ir.instruction;

/**
 * Stops execution.
 */
public record Halt() implements Instruction {

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
