package org.quilkit.compiler.frontend.parser.features.defframe;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.AttributeValue;
import org.quilkit.compiler.ir.instruction.FrameDefinition;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.operand.FrameIdentifier;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handles {@code DEFFRAME qubit+ "name"[:]} with indented {@code ATTRIBUTE: value} lines.
 * Without the colon the frame has no attributes.
 */
public class DefFrameCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume DEFFRAME
        FrameIdentifier frame = OperandParser.frame(context);
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        if (context.match(TokenType.COLON)) {
            while (context.enterBlockLine()) {
                String name = context.consume(TokenType.IDENTIFIER, "frame attribute name").text();
                context.consume(TokenType.COLON, "':'");
                AttributeValue value = context.check(TokenType.STRING)
                        ? new AttributeValue.Text((String) context.advance().value())
                        : new AttributeValue.Expr(context.expression());
                context.expectEndOfInstruction();
                attributes.put(name, value);
            }
        }
        return new FrameDefinition(frame, attributes);
    }
}
