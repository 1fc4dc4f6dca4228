package org.quilkit.compiler.frontend.semantics.analysis;

import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.diagnostics.DiagnosticsEngine;
import org.quilkit.compiler.diagnostics.ValidationErrorKind;
import org.quilkit.compiler.frontend.semantics.Symbol;
import org.quilkit.compiler.frontend.semantics.SymbolTable;
import org.quilkit.compiler.ir.instruction.Instruction;

/**
 * Checks that every memory region an instruction refers to is declared.
 * Runs for every instruction, in addition to its type-specific handler.
 */
public class MemoryReferenceAnalysisHandler implements IAnalysisHandler {

    private final MemoryReferenceCollector collector = new MemoryReferenceCollector();

    @Override
    public void analyze(Instruction instruction, SourceInfo location, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        for (String region : instruction.accept(collector)) {
            if (symbolTable.resolve(region, Symbol.Type.MEMORY).isEmpty()) {
                diagnostics.report(ValidationErrorKind.UNDECLARED_MEMORY_REFERENCE,
                        "Memory region '" + region + "' is not declared.", location);
            }
        }
    }
}
