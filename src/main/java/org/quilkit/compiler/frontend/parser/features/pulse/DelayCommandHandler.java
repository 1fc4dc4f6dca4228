package org.quilkit.compiler.frontend.parser.features.pulse;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Delay;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.operand.Qubit;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Handles {@code DELAY qubit+ "frame"* duration}.
 * <p>
 * Qubits and the duration share a syntax; an integer or identifier is a qubit only while
 * another operand follows it.
 */
public class DelayCommandHandler implements ICommandHandler {

    private static final Set<TokenType> OPERAND_STARTS = EnumSet.of(
            TokenType.INTEGER, TokenType.FLOAT, TokenType.IDENTIFIER, TokenType.VARIABLE,
            TokenType.STRING, TokenType.LEFT_PAREN, TokenType.MINUS, TokenType.PLUS);

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume DELAY
        List<Qubit> qubits = new ArrayList<>();
        while (isQubit(context)) {
            qubits.add(OperandParser.qubit(context));
        }
        if (qubits.isEmpty()) {
            throw new ParseException("qubit index", context.peek());
        }
        List<String> frameNames = new ArrayList<>();
        while (context.check(TokenType.STRING)) {
            frameNames.add((String) context.advance().value());
        }
        Expression duration = context.expression();
        return new Delay(qubits, frameNames, duration);
    }

    private static boolean isQubit(ParsingContext context) {
        if (!OperandParser.startsQubit(context)) {
            return false;
        }
        TokenType next = context.peekNext().type();
        if (context.check(TokenType.IDENTIFIER) && (next == TokenType.LEFT_PAREN || next == TokenType.LEFT_BRACKET)) {
            return false;
        }
        return OPERAND_STARTS.contains(next);
    }
}
