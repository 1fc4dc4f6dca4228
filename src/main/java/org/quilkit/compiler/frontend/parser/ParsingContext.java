package org.quilkit.compiler.frontend.parser;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.ir.instruction.Instruction;

import java.util.List;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides command handlers with access to the token stream and other necessary services
 * without coupling them directly to a specific implementation like the parser.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Consumes the current token if it is the given keyword.
     * @param keyword The keyword to match.
     * @return true if the keyword was consumed.
     */
    boolean match(Keyword keyword);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks if the current token is the given keyword without consuming it.
     * @param keyword The keyword to check.
     * @return true if the current token is the keyword.
     */
    boolean check(Keyword keyword);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type.
     */
    boolean checkNext(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the token after the current one without consuming anything.
     * @return The next token; the end-of-file token if there is none.
     */
    Token peekNext();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param expectation A human-readable description of what was expected.
     * @return The consumed token.
     * @throws ParseException if the type did not match.
     */
    Token consume(TokenType type, String expectation) throws ParseException;

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Requires the current instruction to end here: at a newline, ';' or the end of input.
     * Nothing is consumed.
     * @throws ParseException if another token follows.
     */
    void expectEndOfInstruction() throws ParseException;

    /**
     * Parses an arithmetic expression starting at the current token.
     * @return The expression.
     * @throws ParseException if no expression starts here.
     */
    Expression expression() throws ParseException;

    /**
     * Moves onto the next indented body line of a block, skipping blank and comment lines.
     * If the block ends, the position is left unchanged.
     * @return true if an indented line follows and its indentation was consumed.
     */
    boolean enterBlockLine();

    /**
     * Parses the indented instruction lines of a {@code DEFCIRCUIT} or {@code DEFCAL} body.
     * @return The body instructions in order.
     * @throws ParseException on the first error inside the body.
     */
    List<Instruction> instructionBody() throws ParseException;

    /**
     * Remembers where an instruction was read from.
     * @param instruction The instruction.
     * @param location Its first token's position.
     */
    void recordSource(Instruction instruction, SourceInfo location);
}
