package org.quilkit.compiler.frontend.parser.features.control;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Label;

/**
 * Handles {@code LABEL @name}.
 */
public class LabelCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume LABEL
        String name = (String) context.consume(TokenType.LABEL, "label").value();
        return new Label(name);
    }
}
