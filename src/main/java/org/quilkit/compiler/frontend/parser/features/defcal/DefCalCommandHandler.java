package org.quilkit.compiler.frontend.parser.features.defcal;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.CalibrationDefinition;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.MeasureCalibrationDefinition;
import org.quilkit.compiler.ir.operand.GateModifier;
import org.quilkit.compiler.ir.operand.Qubit;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles gate calibrations {@code DEFCAL modifiers* name[(expr, ...)] qubit+:} and
 * measurement calibrations {@code DEFCAL MEASURE [qubit [parameter]]:}, each followed by
 * an indented instruction body.
 */
public class DefCalCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume DEFCAL
        if (context.match(Keyword.MEASURE)) {
            return measureCalibration(context);
        }

        List<GateModifier> modifiers = new ArrayList<>();
        while (context.check(TokenType.KEYWORD) && ((Keyword) context.peek().value()).isModifier()) {
            modifiers.add(GateModifier.valueOf(((Keyword) context.advance().value()).name()));
        }
        String name = context.consume(TokenType.IDENTIFIER, "gate name").text();
        List<Expression> parameters = OperandParser.optionalExpressionList(context);
        List<Qubit> qubits = OperandParser.qubits(context);
        if (qubits.isEmpty()) {
            throw new ParseException("qubit index", context.peek());
        }
        context.consume(TokenType.COLON, "':'");
        return new CalibrationDefinition(modifiers, name, parameters, qubits, context.instructionBody());
    }

    private Instruction measureCalibration(ParsingContext context) throws ParseException {
        Qubit qubit = null;
        String parameter = null;
        if (OperandParser.startsQubit(context)) {
            qubit = OperandParser.qubit(context);
            if (context.check(TokenType.IDENTIFIER)) {
                parameter = context.advance().text();
            } else if (context.check(TokenType.VARIABLE)) {
                parameter = (String) context.advance().value();
            }
        }
        context.consume(TokenType.COLON, "':'");
        return new MeasureCalibrationDefinition(qubit, parameter, context.instructionBody());
    }
}
