package org.quilkit.compiler.frontend.parser.features.control;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Jump;
import org.quilkit.compiler.ir.instruction.JumpUnless;
import org.quilkit.compiler.ir.instruction.JumpWhen;
import org.quilkit.compiler.ir.operand.MemoryReference;

/**
 * Handles {@code JUMP @target}, {@code JUMP-WHEN @target memory} and {@code JUMP-UNLESS @target memory}.
 */
public class JumpCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        Keyword keyword = (Keyword) context.advance().value();
        String target = (String) context.consume(TokenType.LABEL, "label").value();
        if (keyword == Keyword.JUMP) {
            return new Jump(target);
        }
        MemoryReference condition = OperandParser.memoryReference(context);
        return keyword == Keyword.JUMP_WHEN ? new JumpWhen(target, condition) : new JumpUnless(target, condition);
    }
}
