package org.quilkit.compiler.api;

/**
 * Thrown by the lexer when it meets text it cannot turn into a token.
 * Tokenization aborts immediately; no tokens are returned.
 */
public class LexException extends CompilationException {

    private final String unexpected;

    /**
     * @param reason Short description of the problem.
     * @param unexpected The offending character, or a description such as "end of input".
     * @param location Where the offending character starts.
     */
    public LexException(String reason, String unexpected, SourceInfo location) {
        super(reason + ": " + unexpected, location);
        this.unexpected = unexpected;
    }

    /**
     * @return The offending character, or a description such as "end of input".
     */
    public String getUnexpected() {
        return unexpected;
    }
}
