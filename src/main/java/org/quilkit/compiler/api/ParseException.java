package org.quilkit.compiler.api;

import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.lexer.TokenType;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Thrown by the parser on the first syntactic error. No partial program is returned.
 */
public class ParseException extends CompilationException {

    private final Set<String> expected;
    private final Token found;

    /**
     * @param expected Human-readable descriptions of what would have been accepted.
     * @param found The token that was found instead.
     */
    public ParseException(Set<String> expected, Token found) {
        super("Expected " + String.join(" or ", expected) + " but found " + describe(found), found.location());
        this.expected = Collections.unmodifiableSet(new LinkedHashSet<>(expected));
        this.found = found;
    }

    /**
     * Convenience constructor for a single expectation.
     * @param expected What would have been accepted.
     * @param found The token that was found instead.
     */
    public ParseException(String expected, Token found) {
        this(Set.of(expected), found);
    }

    public Set<String> getExpected() {
        return expected;
    }

    public Token getFound() {
        return found;
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.NEWLINE) {
            return "end of line";
        }
        if (token.type() == TokenType.END_OF_FILE) {
            return "end of input";
        }
        if (token.type() == TokenType.INDENTATION) {
            return "indentation";
        }
        return "'" + token.text() + "'";
    }
}
