package org.quilkit.compiler.frontend.semantics.analysis;

import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.diagnostics.DiagnosticsEngine;
import org.quilkit.compiler.frontend.semantics.SymbolTable;
import org.quilkit.compiler.ir.instruction.Instruction;

/**
 * Interface for specialized handlers in program validation.
 * Each handler is responsible for checking a specific kind of instruction.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single instruction.
     * @param instruction The instruction to analyze.
     * @param location Where the instruction was read from, or {@code null}.
     * @param symbolTable The symbol table, positioned at the instruction's scope.
     * @param diagnostics The engine for reporting errors.
     */
    void analyze(Instruction instruction, SourceInfo location, SymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
