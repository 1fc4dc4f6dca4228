package org.quilkit.compiler.frontend.parser.features.defcircuit;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.CircuitDefinition;
import org.quilkit.compiler.ir.instruction.Instruction;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code DEFCIRCUIT name[(%p, ...)] q...:} followed by an indented instruction body.
 */
public class DefCircuitCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume DEFCIRCUIT
        String name = context.consume(TokenType.IDENTIFIER, "circuit name").text();
        List<String> parameters = OperandParser.optionalParameterNames(context);
        List<String> qubitVariables = new ArrayList<>();
        while (context.check(TokenType.IDENTIFIER) || context.check(TokenType.VARIABLE)) {
            qubitVariables.add(context.peek().type() == TokenType.VARIABLE
                    ? (String) context.advance().value()
                    : context.advance().text());
        }
        context.consume(TokenType.COLON, "':'");
        return new CircuitDefinition(name, parameters, qubitVariables, context.instructionBody());
    }
}
