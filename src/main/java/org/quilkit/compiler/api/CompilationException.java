package org.quilkit.compiler.api;

/**
 * An exception that is thrown when the source text cannot be turned into a program.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * Lexing and parsing stop at the first error, so each instance describes exactly one defect.
 */
public class CompilationException extends Exception {

    private final SourceInfo location;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
        this.location = null;
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.location = null;
    }

    /**
     * Constructs a new compilation exception with the specified detail message and source information.
     * @param message The detail message.
     * @param location The source information.
     */
    public CompilationException(String message, SourceInfo location) {
        super(String.format("%s at %s", message, location), null);
        this.location = location;
    }

    /**
     * @return The position of the defect, or {@code null} if it has none.
     */
    public SourceInfo getLocation() {
        return location;
    }
}
