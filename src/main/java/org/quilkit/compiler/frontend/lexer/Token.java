package org.quilkit.compiler.frontend.lexer;

import org.quilkit.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Keyword, Integer, Label).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (e.g., the {@link Long} value of an integer).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param byteOffset The UTF-8 byte offset where the token begins.
 * @param fileName The logical file name from which this token originates.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        int byteOffset,
        String fileName
) {

    /**
     * @return The position of this token as public source information.
     */
    public SourceInfo location() {
        return new SourceInfo(fileName, line, column, byteOffset);
    }

    /**
     * @param keyword The keyword to test for.
     * @return {@code true} if this token is the given reserved word.
     */
    public boolean is(Keyword keyword) {
        return type == TokenType.KEYWORD && value == keyword;
    }
}
