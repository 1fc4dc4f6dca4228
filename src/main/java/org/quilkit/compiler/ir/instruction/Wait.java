package org.quilkit.compiler.ir.instruction;

/**
 * Waits for an external trigger.
 */
public record Wait() implements Instruction {

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
