package org.quilkit.compiler.frontend.semantics.analysis;

import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.diagnostics.DiagnosticsEngine;
import org.quilkit.compiler.diagnostics.ValidationErrorKind;
import org.quilkit.compiler.frontend.semantics.Symbol;
import org.quilkit.compiler.frontend.semantics.SymbolTable;
import org.quilkit.compiler.ir.instruction.CircuitDefinition;
import org.quilkit.compiler.ir.instruction.GateApplication;
import org.quilkit.compiler.ir.instruction.GateDefinition;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.operand.GateModifier;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Checks the qubit and parameter counts of a gate application against the
 * {@code DEFGATE} or {@code DEFCIRCUIT} of the same name.
 * <p>
 * Every {@code CONTROLLED} or {@code FORKED} adds one control qubit, and every {@code FORKED}
 * also doubles the parameter list. Gates without a definition in the program (the standard gate set of
 * the target) are not checked.
 */
public class GateArityAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(Instruction instruction, SourceInfo location, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (!(instruction instanceof GateApplication gate)) {
            return;
        }

        int baseQubits;
        int baseParameters;
        Optional<Symbol> gateSymbol = symbolTable.resolve(gate.name(), Symbol.Type.GATE);
        Optional<Symbol> circuitSymbol = symbolTable.resolve(gate.name(), Symbol.Type.CIRCUIT);
        if (gateSymbol.isPresent() && gateSymbol.get().instruction() instanceof GateDefinition definition) {
            OptionalInt qubitCount = definition.specification().qubitCount();
            baseQubits = qubitCount.orElse(-1);
            baseParameters = definition.parameters().size();
        } else if (circuitSymbol.isPresent() && circuitSymbol.get().instruction() instanceof CircuitDefinition definition) {
            baseQubits = definition.qubitVariables().size();
            baseParameters = definition.parameters().size();
        } else {
            return;
        }

        int controls = gate.count(GateModifier.CONTROLLED);
        int forks = gate.count(GateModifier.FORKED);

        if (baseQubits >= 0) {
            int expectedQubits = baseQubits + controls + forks;
            if (gate.qubits().size() != expectedQubits) {
                diagnostics.report(ValidationErrorKind.ARITY_MISMATCH,
                        String.format("Gate '%s' expects %d qubit(s) but got %d.",
                                gate.name(), expectedQubits, gate.qubits().size()),
                        location);
            }
        }

        long expectedParameters = (long) baseParameters << Math.min(forks, 32);
        if (gate.parameters().size() != expectedParameters) {
            diagnostics.report(ValidationErrorKind.ARITY_MISMATCH,
                    String.format("Gate '%s' expects %d parameter(s) but got %d.",
                            gate.name(), expectedParameters, gate.parameters().size()),
                    location);
        }
    }
}
