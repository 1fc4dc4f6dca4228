package org.quilkit.compiler.frontend.parser.features.defwaveform;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.WaveformDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code DEFWAVEFORM name[(%p, ...)]:} followed by comma-separated samples on
 * one or more indented lines. A line may end with a comma.
 */
public class DefWaveformCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume DEFWAVEFORM
        String name = context.consume(TokenType.IDENTIFIER, "waveform name").text();
        List<String> parameters = OperandParser.optionalParameterNames(context);
        context.consume(TokenType.COLON, "':'");

        List<Expression> samples = new ArrayList<>();
        while (context.enterBlockLine()) {
            samples.add(context.expression());
            while (context.match(TokenType.COMMA)) {
                if (context.check(TokenType.NEWLINE) || context.isAtEnd()) {
                    break;
                }
                samples.add(context.expression());
            }
            context.expectEndOfInstruction();
        }
        if (samples.isEmpty()) {
            throw new ParseException("indented waveform samples", context.peek());
        }
        return new WaveformDefinition(name, parameters, samples);
    }
}
