package org.quilkit.compiler.frontend.parser.features.classical;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Convert;
import org.quilkit.compiler.ir.instruction.Exchange;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Load;
import org.quilkit.compiler.ir.instruction.Move;
import org.quilkit.compiler.ir.instruction.Store;
import org.quilkit.compiler.ir.operand.MemoryReference;

/**
 * Handles the data movement commands.
 * <ul>
 *   <li>{@code MOVE destination source}</li>
 *   <li>{@code EXCHANGE left right}</li>
 *   <li>{@code CONVERT destination source}</li>
 *   <li>{@code LOAD destination region offset}</li>
 *   <li>{@code STORE region offset source}</li>
 * </ul>
 */
public class TransferCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        Keyword keyword = (Keyword) context.advance().value();
        switch (keyword) {
            case MOVE: {
                MemoryReference destination = OperandParser.memoryReference(context);
                return new Move(destination, OperandParser.classicalOperand(context));
            }
            case EXCHANGE: {
                MemoryReference left = OperandParser.memoryReference(context);
                return new Exchange(left, OperandParser.memoryReference(context));
            }
            case CONVERT: {
                MemoryReference destination = OperandParser.memoryReference(context);
                return new Convert(destination, OperandParser.memoryReference(context));
            }
            case LOAD: {
                MemoryReference destination = OperandParser.memoryReference(context);
                String region = context.consume(TokenType.IDENTIFIER, "memory region name").text();
                return new Load(destination, region, OperandParser.memoryReference(context));
            }
            case STORE: {
                String region = context.consume(TokenType.IDENTIFIER, "memory region name").text();
                MemoryReference offset = OperandParser.memoryReference(context);
                return new Store(region, offset, OperandParser.classicalOperand(context));
            }
            default:
                throw new IllegalStateException("Not a transfer command: " + keyword.text());
        }
    }
}
