package org.quilkit.compiler.frontend.semantics.analysis;

import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.diagnostics.DiagnosticsEngine;
import org.quilkit.compiler.diagnostics.ValidationErrorKind;
import org.quilkit.compiler.frontend.semantics.Symbol;
import org.quilkit.compiler.frontend.semantics.SymbolTable;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Jump;
import org.quilkit.compiler.ir.instruction.JumpUnless;
import org.quilkit.compiler.ir.instruction.JumpWhen;

/**
 * Checks that the target of {@code JUMP}, {@code JUMP-WHEN} and {@code JUMP-UNLESS}
 * names a label of the same scope.
 */
public class JumpTargetAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(Instruction instruction, SourceInfo location, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        String target;
        if (instruction instanceof Jump jump) {
            target = jump.target();
        } else if (instruction instanceof JumpWhen jumpWhen) {
            target = jumpWhen.target();
        } else if (instruction instanceof JumpUnless jumpUnless) {
            target = jumpUnless.target();
        } else {
            return;
        }

        if (symbolTable.resolve(target, Symbol.Type.LABEL).isEmpty()) {
            diagnostics.report(ValidationErrorKind.UNRESOLVED_JUMP_TARGET,
                    "Jump target '@" + target + "' is not a label of this scope.", location);
        }
    }
}
