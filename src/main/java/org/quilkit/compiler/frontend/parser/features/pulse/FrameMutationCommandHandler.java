package org.quilkit.compiler.frontend.parser.features.pulse;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.FrameMutation;
import org.quilkit.compiler.ir.instruction.FrameOperation;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.SwapPhases;
import org.quilkit.compiler.ir.operand.FrameIdentifier;

/**
 * Handles {@code SET-FREQUENCY}, {@code SHIFT-FREQUENCY}, {@code SET-PHASE}, {@code SHIFT-PHASE}
 * and {@code SET-SCALE} ({@code OP frame value}) as well as {@code SWAP-PHASES frame frame}.
 */
public class FrameMutationCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        Keyword keyword = (Keyword) context.advance().value();
        FrameIdentifier frame = OperandParser.frame(context);
        if (keyword == Keyword.SWAP_PHASES) {
            return new SwapPhases(frame, OperandParser.frame(context));
        }
        return new FrameMutation(FrameOperation.valueOf(keyword.name()), frame, context.expression());
    }
}
