package org.quilkit.compiler.frontend.parser.features.control;

import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Halt;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Nop;
import org.quilkit.compiler.ir.instruction.Wait;

/**
 * Handles the operand-less commands {@code HALT}, {@code WAIT} and {@code NOP}.
 */
public class SimpleCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) {
        Keyword keyword = (Keyword) context.advance().value();
        switch (keyword) {
            case HALT: return new Halt();
            case WAIT: return new Wait();
            case NOP: return new Nop();
            default: throw new IllegalStateException("Not an operand-less command: " + keyword.text());
        }
    }
}
