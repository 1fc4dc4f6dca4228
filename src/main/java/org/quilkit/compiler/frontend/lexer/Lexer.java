package org.quilkit.compiler.frontend.lexer;

import org.quilkit.compiler.api.LexException;
import org.quilkit.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Lexing stops at the first character that cannot start a token. Positions are tracked as
 * 1-based line and column numbers plus a UTF-8 byte offset.
 */
public class Lexer {

    /** Default number of leading spaces that count as indentation. */
    public static final int DEFAULT_INDENT_WIDTH = 4;

    private final String source;
    private final String logicalFileName;
    private final int indentWidth;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int startLine = 1;
    private int startColumn = 1;
    private int startByte = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int byteOffset = 0;
    private boolean atLineStart = true;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this(source, logicalFileName, DEFAULT_INDENT_WIDTH);
    }

    /**
     * Creates a new Lexer with an explicit logical file name and indentation width.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     * @param indentWidth The number of leading spaces that mark an indented line.
     */
    public Lexer(String source, String logicalFileName, int indentWidth) {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("Indent width must be positive: " + indentWidth);
        }
        this.source = source;
        this.logicalFileName = logicalFileName;
        this.indentWidth = indentWidth;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always ending with {@link TokenType#END_OF_FILE}.
     * @throws LexException at the first unexpected character, unterminated string or oversized number.
     */
    public List<Token> scanTokens() throws LexException {
        while (!isAtEnd()) {
            if (atLineStart) {
                atLineStart = false;
                indentation();
                continue;
            }
            markStart();
            scanToken();
        }
        markStart();
        addToken(TokenType.END_OF_FILE, null, "");
        return tokens;
    }

    private void scanToken() throws LexException {
        char c = advance();
        switch (c) {
            case '"': string(); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '^': addToken(TokenType.CARET); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.NEWLINE); break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '@': prefixedName(TokenType.LABEL); break;
            case '%': prefixedName(TokenType.VARIABLE); break;
            // Ignore whitespace
            case ' ', '\r', '\t':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                column = 1;
                atLineStart = true;
                break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    throw new LexException("Unexpected character", String.valueOf(c), startLocation());
                }
                break;
        }
    }

    private void indentation() {
        markStart();
        boolean sawTab = false;
        int spaces = 0;
        while (peek() == ' ' || peek() == '\t') {
            if (advance() == '\t') {
                sawTab = true;
            } else {
                spaces++;
            }
        }
        char next = peek();
        boolean carriesCode = !isAtEnd() && next != '\n' && next != '\r' && next != '#';
        if (carriesCode && (sawTab || spaces >= indentWidth)) {
            addToken(TokenType.INDENTATION);
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        // An identifier never ends in a hyphen; give trailing ones back.
        while (source.charAt(current - 1) == '-') retreat();
        String text = source.substring(start, current);
        Keyword keyword = Keyword.fromText(text).orElse(null);
        if (keyword != null) {
            addToken(TokenType.KEYWORD, keyword);
        } else {
            addToken(TokenType.IDENTIFIER, text);
        }
    }

    private void prefixedName(TokenType type) throws LexException {
        if (!isIdentifierStart(peek())) {
            String found = isAtEnd() ? "end of input" : String.valueOf(peek());
            throw new LexException("Expected a name after '" + source.charAt(start) + "'", found, startLocation());
        }
        advance();
        while (isIdentifierPart(peek())) advance();
        while (source.charAt(current - 1) == '-') retreat();
        addToken(type, source.substring(start + 1, current));
    }

    private void number() throws LexException {
        boolean isFloat = false;
        if (source.charAt(start) == '.') {
            isFloat = true;
            while (isDigit(peek())) advance();
        } else {
            while (isDigit(peek())) advance();
            if (peek() == '.') {
                isFloat = true;
                advance(); // consume the '.'
                while (isDigit(peek())) advance();
            }
        }
        if ((peek() == 'e' || peek() == 'E') && exponentFollows()) {
            isFloat = true;
            advance(); // consume the 'e'
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }

        String numberString = source.substring(start, current);
        if (isFloat) {
            double value = Double.parseDouble(numberString);
            if (Double.isInfinite(value)) {
                throw new LexException("Real literal out of range", numberString, startLocation());
            }
            addToken(TokenType.FLOAT, value);
            return;
        }
        try {
            addToken(TokenType.INTEGER, Long.parseLong(numberString));
        } catch (NumberFormatException e) {
            throw new LexException("Integer literal out of range", numberString, startLocation());
        }
    }

    private boolean exponentFollows() {
        char next = peekNext();
        if (isDigit(next)) {
            return true;
        }
        return (next == '+' || next == '-') && current + 2 < source.length() && isDigit(source.charAt(current + 2));
    }

    private void string() throws LexException {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                throw new LexException("Unterminated string", "end of line", startLocation());
            }
            if (c == '\\' && (peek() == '"' || peek() == '\\')) {
                c = advance();
            }
            value.append(c);
        }

        if (isAtEnd()) {
            throw new LexException("Unterminated string", "end of input", startLocation());
        }

        // The closing "
        advance();

        // The text of the token is the string *with* quotes, the value is the content.
        addToken(TokenType.STRING, value.toString());
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
        startByte = byteOffset;
    }

    private SourceInfo startLocation() {
        return new SourceInfo(logicalFileName, startLine, startColumn, startByte);
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        byteOffset += utf8Length(c);
        return c;
    }

    private void retreat() {
        char c = source.charAt(--current);
        column--;
        byteOffset -= utf8Length(c);
    }

    private static int utf8Length(char c) {
        if (c < 0x80) return 1;
        if (c < 0x800) return 2;
        // Each half of a surrogate pair carries two of the pair's four bytes.
        if (Character.isSurrogate(c)) return 2;
        return 3;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        addToken(type, literal, source.substring(start, current));
    }

    private void addToken(TokenType type, Object literal, String text) {
        tokens.add(new Token(type, text, literal, startLine, startColumn, startByte, logicalFileName));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '-';
    }
}
