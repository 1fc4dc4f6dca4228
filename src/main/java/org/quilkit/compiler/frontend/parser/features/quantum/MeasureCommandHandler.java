package org.quilkit.compiler.frontend.parser.features.quantum;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Measurement;
import org.quilkit.compiler.ir.operand.MemoryReference;
import org.quilkit.compiler.ir.operand.Qubit;

/**
 * Handles {@code MEASURE qubit [memory]}.
 */
public class MeasureCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume MEASURE
        Qubit qubit = OperandParser.qubit(context);
        MemoryReference target = null;
        if (context.check(TokenType.IDENTIFIER)) {
            target = OperandParser.memoryReference(context);
        }
        return new Measurement(qubit, target);
    }
}
