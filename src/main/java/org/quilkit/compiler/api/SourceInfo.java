package org.quilkit.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The logical file the code was read from.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 * @param byteOffset The 0-based UTF-8 byte offset from the start of the source.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, int byteOffset) {

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
