package org.quilkit.compiler.frontend.parser.features.classical;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Arithmetic;
import org.quilkit.compiler.ir.instruction.ArithmeticOperator;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.MemoryReference;

/**
 * Handles {@code ADD}, {@code SUB}, {@code MUL} and {@code DIV}: {@code OP destination source}.
 */
public class ArithmeticCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        Keyword keyword = (Keyword) context.advance().value();
        MemoryReference destination = OperandParser.memoryReference(context);
        ClassicalOperand source = OperandParser.classicalOperand(context);
        return new Arithmetic(ArithmeticOperator.valueOf(keyword.name()), destination, source);
    }
}
