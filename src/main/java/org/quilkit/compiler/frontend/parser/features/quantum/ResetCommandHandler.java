package org.quilkit.compiler.frontend.parser.features.quantum;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Reset;

/**
 * Handles {@code RESET} and {@code RESET qubit}.
 */
public class ResetCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume RESET
        if (OperandParser.startsQubit(context)) {
            return new Reset(OperandParser.qubit(context));
        }
        return new Reset(null);
    }
}
