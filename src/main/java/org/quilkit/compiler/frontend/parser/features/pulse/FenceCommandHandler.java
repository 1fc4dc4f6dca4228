package org.quilkit.compiler.frontend.parser.features.pulse;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Fence;
import org.quilkit.compiler.ir.instruction.Instruction;

/**
 * Handles {@code FENCE qubit*}; without qubits the fence spans every qubit.
 */
public class FenceCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        context.advance(); // consume FENCE
        return new Fence(OperandParser.qubits(context));
    }
}
