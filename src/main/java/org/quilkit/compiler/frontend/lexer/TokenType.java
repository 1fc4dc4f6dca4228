package org.quilkit.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '+' character. */
    PLUS,
    /** The '-' character when it does not belong to an identifier. */
    MINUS,
    /** The '*' character. */
    STAR,
    /** The '/' character. */
    SLASH,
    /** The '^' character. */
    CARET,
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The '[' character. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The ',' character. */
    COMMA,
    /** The ':' character, closing block headers and separating attributes. */
    COLON,

    // Literals.
    /** An identifier, such as a gate or memory region name. */
    IDENTIFIER,
    /** An unsigned integer literal; the value is a {@link Long}. */
    INTEGER,
    /** A decimal or scientific literal; the value is a {@link Double}. */
    FLOAT,
    /** A double-quoted string; the value is the unescaped content. */
    STRING,
    /** A label reference such as {@code @loop}; the value is the bare name. */
    LABEL,
    /** A parameter variable such as {@code %theta}; the value is the bare name. */
    VARIABLE,

    // Keywords.
    /** A reserved command or modifier word; the value is the {@link Keyword}. */
    KEYWORD,

    // Layout.
    /** A line break or a ';'. */
    NEWLINE,
    /** Leading whitespace of a line that carries code inside a block body. */
    INDENTATION,
    /** Represents the end of the source file. */
    END_OF_FILE
}
