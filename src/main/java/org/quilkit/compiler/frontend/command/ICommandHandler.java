package org.quilkit.compiler.frontend.command;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Instruction;

/**
 * The base interface for all command handlers.
 * Each handler is responsible for one family of Quil commands (e.g., "ADD", "SUB", "MUL", "DIV").
 */
public interface ICommandHandler {

    /**
     * Parses the command and its arguments. The context is positioned on the command keyword,
     * which the handler consumes itself. Parsing stops before the end of the line.
     *
     * @param context The context that provides access to the token stream.
     * @return The parsed instruction.
     * @throws ParseException on the first syntax error.
     */
    Instruction parse(ParsingContext context) throws ParseException;
}
