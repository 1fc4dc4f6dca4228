package org.quilkit.compiler.frontend.parser.features.defgate;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.GateDefinition;
import org.quilkit.compiler.ir.instruction.GateSpecification;
import org.quilkit.compiler.ir.instruction.Instruction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Handles {@code DEFGATE}. Three body forms are supported:
 * <pre>
 * DEFGATE name[(%p, ...)] [AS MATRIX]:
 *     row, of, expressions
 * DEFGATE name AS PERMUTATION:
 *     0, 1, 3, 2
 * DEFGATE name[(%p, ...)] a b AS PAULI-SUM:
 *     ZZ(%p/2) a b
 * </pre>
 */
public class DefGateCommandHandler implements ICommandHandler {

    private static final String MATRIX = "MATRIX";
    private static final String PERMUTATION = "PERMUTATION";
    private static final String PAULI_SUM = "PAULI-SUM";

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume DEFGATE
        String name = context.consume(TokenType.IDENTIFIER, "gate name").text();
        List<String> parameters = OperandParser.optionalParameterNames(context);

        List<String> arguments = new ArrayList<>();
        while (context.check(TokenType.IDENTIFIER) && !"AS".equals(context.peek().text())) {
            arguments.add(context.advance().text());
        }

        String kind = MATRIX;
        if (context.check(TokenType.IDENTIFIER)) {
            context.advance(); // consume AS
            Token kindToken = context.peek();
            if (kindToken.type() != TokenType.IDENTIFIER
                    || !List.of(MATRIX, PERMUTATION, PAULI_SUM).contains(kindToken.text())) {
                throw new ParseException(new LinkedHashSet<>(List.of(MATRIX, PERMUTATION, PAULI_SUM)), kindToken);
            }
            kind = context.advance().text();
        }
        if (!arguments.isEmpty() && !PAULI_SUM.equals(kind)) {
            throw new ParseException("AS PAULI-SUM", context.peek());
        }
        context.consume(TokenType.COLON, "':'");

        GateSpecification specification;
        switch (kind) {
            case PERMUTATION:
                specification = permutation(context);
                break;
            case PAULI_SUM:
                specification = pauliSum(context, arguments);
                break;
            default:
                specification = matrix(context);
                break;
        }
        return new GateDefinition(name, parameters, specification);
    }

    private GateSpecification matrix(ParsingContext context) throws ParseException {
        List<List<Expression>> rows = new ArrayList<>();
        while (context.enterBlockLine()) {
            List<Expression> row = new ArrayList<>();
            do {
                row.add(context.expression());
            } while (context.match(TokenType.COMMA));
            context.expectEndOfInstruction();
            rows.add(row);
        }
        if (rows.isEmpty()) {
            throw new ParseException("indented matrix row", context.peek());
        }
        return new GateSpecification.Matrix(rows);
    }

    private GateSpecification permutation(ParsingContext context) throws ParseException {
        List<Long> entries = new ArrayList<>();
        while (context.enterBlockLine()) {
            do {
                entries.add((Long) context.consume(TokenType.INTEGER, "permutation entry").value());
            } while (context.match(TokenType.COMMA));
            context.expectEndOfInstruction();
        }
        if (entries.isEmpty()) {
            throw new ParseException("indented permutation", context.peek());
        }
        return new GateSpecification.Permutation(entries);
    }

    private GateSpecification pauliSum(ParsingContext context, List<String> arguments) throws ParseException {
        List<GateSpecification.PauliTerm> terms = new ArrayList<>();
        while (context.enterBlockLine()) {
            String word = context.consume(TokenType.IDENTIFIER, "Pauli word").text();
            context.consume(TokenType.LEFT_PAREN, "'('");
            Expression coefficient = context.expression();
            context.consume(TokenType.RIGHT_PAREN, "')'");
            List<String> qubits = new ArrayList<>();
            while (context.check(TokenType.IDENTIFIER)) {
                qubits.add(context.advance().text());
            }
            context.expectEndOfInstruction();
            terms.add(new GateSpecification.PauliTerm(word, coefficient, qubits));
        }
        return new GateSpecification.PauliSum(arguments, terms);
    }
}
