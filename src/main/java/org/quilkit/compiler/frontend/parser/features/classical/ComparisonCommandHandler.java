package org.quilkit.compiler.frontend.parser.features.classical;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Comparison;
import org.quilkit.compiler.ir.instruction.ComparisonOperator;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.MemoryReference;

/**
 * Handles {@code EQ}, {@code GT}, {@code GE}, {@code LT} and {@code LE}: {@code OP destination left right}.
 */
public class ComparisonCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        Keyword keyword = (Keyword) context.advance().value();
        MemoryReference destination = OperandParser.memoryReference(context);
        MemoryReference left = OperandParser.memoryReference(context);
        ClassicalOperand right = OperandParser.classicalOperand(context);
        return new Comparison(ComparisonOperator.valueOf(keyword.name()), destination, left, right);
    }
}
