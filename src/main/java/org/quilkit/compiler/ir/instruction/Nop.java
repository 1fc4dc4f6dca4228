package org.quilkit.compiler.ir.instruction;

/**
 * Does nothing.
 */
public record Nop() implements Instruction {

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
