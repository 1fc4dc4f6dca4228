package org.quilkit.compiler.frontend.parser.features.declare;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Declaration;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.operand.Offset;
import org.quilkit.compiler.ir.operand.ScalarType;
import org.quilkit.compiler.ir.operand.Sharing;
import org.quilkit.compiler.ir.operand.Vector;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code DECLARE name TYPE[length] [SHARING parent (OFFSET count TYPE)*]}.
 * A missing length means a single element.
 */
public class DeclareCommandHandler implements ICommandHandler {

    private static final String SHARING = "SHARING";
    private static final String OFFSET = "OFFSET";

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume DECLARE
        Token name = context.consume(TokenType.IDENTIFIER, "memory region name");
        ScalarType type = OperandParser.scalarType(context);
        long length = 1;
        if (context.match(TokenType.LEFT_BRACKET)) {
            Token size = context.consume(TokenType.INTEGER, "vector length");
            length = (Long) size.value();
            if (length < 1) {
                throw new ParseException("positive vector length", size);
            }
            context.consume(TokenType.RIGHT_BRACKET, "']'");
        }

        Sharing sharing = null;
        if (checkWord(context, SHARING)) {
            context.advance();
            String parent = context.consume(TokenType.IDENTIFIER, "shared memory region").text();
            List<Offset> offsets = new ArrayList<>();
            while (checkWord(context, OFFSET)) {
                context.advance();
                long count = (Long) context.consume(TokenType.INTEGER, "offset count").value();
                offsets.add(new Offset(count, OperandParser.scalarType(context)));
            }
            sharing = new Sharing(parent, offsets);
        }
        return new Declaration(name.text(), new Vector(type, length), sharing);
    }

    private static boolean checkWord(ParsingContext context, String word) {
        return context.check(TokenType.IDENTIFIER) && word.equals(context.peek().text());
    }
}
