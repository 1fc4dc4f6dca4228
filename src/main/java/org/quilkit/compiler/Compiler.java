package org.quilkit.compiler;

import org.quilkit.compiler.api.CompilationException;
import org.quilkit.compiler.api.ICompiler;
import org.quilkit.compiler.config.CompilerSettings;
import org.quilkit.compiler.diagnostics.CompilerLogger;
import org.quilkit.compiler.frontend.lexer.Lexer;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.parser.Parser;
import org.quilkit.compiler.ir.Program;

import java.util.List;
import java.util.Objects;

/**
 * The main front end implementation. It runs the lexer and the parser over a source text
 * and returns the resulting {@link Program}. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private final CompilerSettings settings;
    private int verbosity = -1;

    /**
     * Creates a compiler with the settings from the default configuration.
     */
    public Compiler() {
        this(CompilerSettings.defaults());
    }

    /**
     * @param settings The settings to use.
     */
    public Compiler(CompilerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * {@inheritDoc}
     * <p>
     * The verbosity set through {@link #setVerbosity(int)} takes precedence over the configured one.
     */
    @Override
    public Program parse(String source, String programName) throws CompilationException {
        CompilerLogger.setLevel(verbosity >= 0 ? verbosity : settings.verbosity());
        CompilerLogger.debug("Compiler: " + programName);

        // Phase 1: Lexing
        Lexer lexer = new Lexer(source, programName, settings.indentWidth());
        List<Token> tokens = lexer.scanTokens();
        CompilerLogger.trace("Lexed " + programName + " into " + tokens.size() + " tokens");

        // Phase 2: Parsing
        Parser parser = new Parser(tokens, programName);
        Program program = parser.parse();

        CompilerLogger.debug("Compiler: " + program + " parsed");
        return program;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    public CompilerSettings settings() {
        return settings;
    }
}
