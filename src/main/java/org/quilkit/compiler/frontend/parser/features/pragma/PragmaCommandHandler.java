package org.quilkit.compiler.frontend.parser.features.pragma;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Pragma;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code PRAGMA name (identifier | integer)* ["data"]}.
 * The arguments are kept as written and never interpreted.
 */
public class PragmaCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume PRAGMA
        Token name = context.peek();
        if (!isWord(name)) {
            throw new ParseException("pragma name", name);
        }
        context.advance();

        List<String> arguments = new ArrayList<>();
        while (isWord(context.peek()) || context.check(TokenType.INTEGER)) {
            arguments.add(context.advance().text());
        }
        String data = null;
        if (context.check(TokenType.STRING)) {
            data = (String) context.advance().value();
        }
        return new Pragma(name.text(), arguments, data);
    }

    private static boolean isWord(Token token) {
        return token.type() == TokenType.IDENTIFIER || token.type() == TokenType.KEYWORD;
    }
}
