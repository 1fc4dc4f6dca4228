package org.quilkit.compiler.api;

import org.quilkit.compiler.ir.Program;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the Quil front end.
 */
public interface ICompiler {

    /**
     * Parses the given Quil source text.
     *
     * @param source The complete program text.
     * @param programName A logical name for the program, used in source locations.
     * @return The parsed {@link Program}.
     * @throws CompilationException ({@link LexException} or {@link ParseException}) on the first error.
     */
    Program parse(String source, String programName) throws CompilationException;

    /**
     * Parses the given Quil source text under the name {@code <memory>}.
     * @param source The complete program text.
     * @return The parsed {@link Program}.
     * @throws CompilationException on the first lexical or syntactic error.
     */
    default Program parse(String source) throws CompilationException {
        return parse(source, "<memory>");
    }

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Parses a UTF-8 source file.
     * @param programPath The path to the source file.
     * @return The parsed {@link Program}.
     * @throws CompilationException on the first lexical or syntactic error.
     * @throws IOException if the file cannot be read.
     */
    default Program parse(Path programPath) throws CompilationException, IOException {
        return parse(Files.readString(programPath, StandardCharsets.UTF_8), programPath.toString().replace('\\', '/'));
    }
}
