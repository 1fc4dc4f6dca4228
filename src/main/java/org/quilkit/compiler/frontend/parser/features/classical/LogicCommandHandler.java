package org.quilkit.compiler.frontend.parser.features.classical;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.BinaryLogic;
import org.quilkit.compiler.ir.instruction.BinaryLogicOperator;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.UnaryLogic;
import org.quilkit.compiler.ir.instruction.UnaryLogicOperator;
import org.quilkit.compiler.ir.operand.MemoryReference;

/**
 * Handles the unary {@code NEG} and {@code NOT} and the binary {@code AND}, {@code IOR} and {@code XOR}.
 */
public class LogicCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        Keyword keyword = (Keyword) context.advance().value();
        MemoryReference first = OperandParser.memoryReference(context);
        if (keyword == Keyword.NEG || keyword == Keyword.NOT) {
            return new UnaryLogic(UnaryLogicOperator.valueOf(keyword.name()), first);
        }
        return new BinaryLogic(BinaryLogicOperator.valueOf(keyword.name()), first, OperandParser.classicalOperand(context));
    }
}
