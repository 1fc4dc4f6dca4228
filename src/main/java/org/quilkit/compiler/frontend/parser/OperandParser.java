package org.quilkit.compiler.frontend.parser;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.FrameIdentifier;
import org.quilkit.compiler.ir.operand.MemoryReference;
import org.quilkit.compiler.ir.operand.Qubit;
import org.quilkit.compiler.ir.operand.ScalarType;
import org.quilkit.compiler.ir.operand.WaveformInvocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsers for the operand shapes shared by several command families.
 */
public final class OperandParser {

    private OperandParser() {
    }

    /**
     * @return true if the current token can be read as a qubit.
     */
    public static boolean startsQubit(ParsingContext context) {
        return context.check(TokenType.INTEGER) || context.check(TokenType.IDENTIFIER) || context.check(TokenType.VARIABLE);
    }

    /**
     * Reads a fixed qubit ({@code 3}) or a placeholder ({@code q} or {@code %q}).
     */
    public static Qubit qubit(ParsingContext context) throws ParseException {
        if (context.match(TokenType.INTEGER)) {
            return new Qubit.Fixed((Long) context.previous().value());
        }
        if (context.match(TokenType.IDENTIFIER)) {
            return new Qubit.Variable(context.previous().text());
        }
        if (context.match(TokenType.VARIABLE)) {
            return new Qubit.Variable((String) context.previous().value());
        }
        throw new ParseException("qubit index", context.peek());
    }

    /**
     * Reads qubits for as long as they follow.
     * @return The qubits, possibly none.
     */
    public static List<Qubit> qubits(ParsingContext context) throws ParseException {
        List<Qubit> qubits = new ArrayList<>();
        while (startsQubit(context)) {
            qubits.add(qubit(context));
        }
        return qubits;
    }

    /**
     * Reads {@code name} or {@code name[index]}; a bare name refers to slot 0.
     */
    public static MemoryReference memoryReference(ParsingContext context) throws ParseException {
        Token name = context.consume(TokenType.IDENTIFIER, "memory reference");
        long index = 0;
        if (context.match(TokenType.LEFT_BRACKET)) {
            index = (Long) context.consume(TokenType.INTEGER, "memory index").value();
            context.consume(TokenType.RIGHT_BRACKET, "']'");
        }
        return new MemoryReference(name.text(), index);
    }

    /**
     * Reads a memory reference or a signed integer or real literal.
     */
    public static ClassicalOperand classicalOperand(ParsingContext context) throws ParseException {
        if (context.check(TokenType.IDENTIFIER)) {
            return new ClassicalOperand.Memory(memoryReference(context));
        }
        boolean negative = false;
        if (context.match(TokenType.MINUS)) {
            negative = true;
        } else {
            context.match(TokenType.PLUS);
        }
        if (context.match(TokenType.INTEGER)) {
            long value = (Long) context.previous().value();
            return new ClassicalOperand.IntegerLiteral(negative ? -value : value);
        }
        if (context.match(TokenType.FLOAT)) {
            double value = (Double) context.previous().value();
            return new ClassicalOperand.RealLiteral(negative ? -value : value);
        }
        Set<String> expected = new LinkedHashSet<>(List.of("integer", "real"));
        if (!negative) {
            expected.add("memory reference");
        }
        throw new ParseException(expected, context.peek());
    }

    /**
     * Reads a frame: one or more qubits followed by the quoted frame name.
     */
    public static FrameIdentifier frame(ParsingContext context) throws ParseException {
        List<Qubit> qubits = qubits(context);
        if (qubits.isEmpty()) {
            throw new ParseException("qubit index", context.peek());
        }
        Token name = context.consume(TokenType.STRING, "frame name");
        return new FrameIdentifier((String) name.value(), qubits);
    }

    /**
     * Reads {@code name} or {@code name(param: value, ...)}.
     */
    public static WaveformInvocation waveformInvocation(ParsingContext context) throws ParseException {
        Token name = context.consume(TokenType.IDENTIFIER, "waveform name");
        Map<String, Expression> parameters = new LinkedHashMap<>();
        if (context.match(TokenType.LEFT_PAREN)) {
            do {
                Token parameter = context.consume(TokenType.IDENTIFIER, "waveform parameter name");
                context.consume(TokenType.COLON, "':'");
                parameters.put(parameter.text(), context.expression());
            } while (context.match(TokenType.COMMA));
            context.consume(TokenType.RIGHT_PAREN, "')'");
        }
        return new WaveformInvocation(name.text(), parameters);
    }

    /**
     * Reads an optional parenthesized, comma-separated expression list.
     * @return The expressions; empty when no '(' follows.
     */
    public static List<Expression> optionalExpressionList(ParsingContext context) throws ParseException {
        List<Expression> expressions = new ArrayList<>();
        if (context.match(TokenType.LEFT_PAREN)) {
            do {
                expressions.add(context.expression());
            } while (context.match(TokenType.COMMA));
            context.consume(TokenType.RIGHT_PAREN, "')'");
        }
        return expressions;
    }

    /**
     * Reads an optional parameter list {@code (%a, %b)}.
     * @return The parameter names without '%'; empty when no '(' follows.
     */
    public static List<String> optionalParameterNames(ParsingContext context) throws ParseException {
        List<String> names = new ArrayList<>();
        if (context.match(TokenType.LEFT_PAREN)) {
            do {
                names.add((String) context.consume(TokenType.VARIABLE, "parameter").value());
            } while (context.match(TokenType.COMMA));
            context.consume(TokenType.RIGHT_PAREN, "')'");
        }
        return names;
    }

    /**
     * Reads one of {@code BIT}, {@code OCTET}, {@code INTEGER} or {@code REAL}.
     */
    public static ScalarType scalarType(ParsingContext context) throws ParseException {
        Token token = context.peek();
        if (token.type() == TokenType.IDENTIFIER) {
            for (ScalarType type : ScalarType.values()) {
                if (type.name().equals(token.text())) {
                    context.advance();
                    return type;
                }
            }
        }
        throw new ParseException(new LinkedHashSet<>(List.of("BIT", "OCTET", "INTEGER", "REAL")), token);
    }
}
