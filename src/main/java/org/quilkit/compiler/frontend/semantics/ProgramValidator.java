package org.quilkit.compiler.frontend.semantics;

import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.diagnostics.CompilerLogger;
import org.quilkit.compiler.diagnostics.DiagnosticsEngine;
import org.quilkit.compiler.diagnostics.ValidationError;
import org.quilkit.compiler.diagnostics.ValidationErrorKind;
import org.quilkit.compiler.frontend.semantics.analysis.GateArityAnalysisHandler;
import org.quilkit.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.quilkit.compiler.frontend.semantics.analysis.JumpTargetAnalysisHandler;
import org.quilkit.compiler.frontend.semantics.analysis.MemoryReferenceAnalysisHandler;
import org.quilkit.compiler.ir.Program;
import org.quilkit.compiler.ir.instruction.CalibrationDefinition;
import org.quilkit.compiler.ir.instruction.CircuitDefinition;
import org.quilkit.compiler.ir.instruction.Declaration;
import org.quilkit.compiler.ir.instruction.GateApplication;
import org.quilkit.compiler.ir.instruction.GateDefinition;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Jump;
import org.quilkit.compiler.ir.instruction.JumpUnless;
import org.quilkit.compiler.ir.instruction.JumpWhen;
import org.quilkit.compiler.ir.instruction.Label;
import org.quilkit.compiler.ir.instruction.MeasureCalibrationDefinition;
import org.quilkit.compiler.ir.instruction.WaveformDefinition;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a {@link Program} for the problems the parser cannot see: duplicate names,
 * unresolved jumps, undeclared memory and gate arity.
 * <p>
 * It performs two passes. The first collects labels, declarations and definitions of every
 * scope so that forward references resolve, and reports duplicates. The second dispatches
 * each instruction to the handlers registered for its class. Validation never stops at
 * the first problem.
 */
public class ProgramValidator {

    private final Set<ValidationErrorKind> enabledChecks;
    private final Map<Class<? extends Instruction>, IAnalysisHandler> handlers = new HashMap<>();
    private final IAnalysisHandler memoryHandler = new MemoryReferenceAnalysisHandler();

    /**
     * Creates a validator that runs every check.
     */
    public ProgramValidator() {
        this(EnumSet.allOf(ValidationErrorKind.class));
    }

    /**
     * @param enabledChecks The kinds of problems to report; all others are ignored.
     */
    public ProgramValidator(Set<ValidationErrorKind> enabledChecks) {
        this.enabledChecks = Set.copyOf(enabledChecks);
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        IAnalysisHandler jumpHandler = new JumpTargetAnalysisHandler();
        handlers.put(Jump.class, jumpHandler);
        handlers.put(JumpWhen.class, jumpHandler);
        handlers.put(JumpUnless.class, jumpHandler);
        handlers.put(GateApplication.class, new GateArityAnalysisHandler());
    }

    /**
     * Validates the program.
     * @param program The program to check; it is not modified.
     * @return All problems found. Duplicate names come first, then the remaining problems in program order.
     */
    public List<ValidationError> validate(Program program) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(enabledChecks);
        SymbolTable symbolTable = new SymbolTable();
        Map<Instruction, SymbolTable.Scope> scopeMap = new IdentityHashMap<>();

        collectSymbols(program, program.items(), symbolTable, scopeMap);
        reportDuplicates(symbolTable, diagnostics);
        symbolTable.resetScope();
        traverseAndAnalyze(program, program.items(), symbolTable, scopeMap, diagnostics);

        List<ValidationError> errors = diagnostics.getErrors();
        CompilerLogger.debug("Validation of " + program.programName() + " found " + errors.size() + " problem(s)");
        return errors;
    }

    private void collectSymbols(Program program, List<Instruction> instructions,
                                SymbolTable symbolTable, Map<Instruction, SymbolTable.Scope> scopeMap) {
        for (Instruction instruction : instructions) {
            SourceInfo location = program.sourceOf(instruction);
            if (instruction instanceof Label label) {
                symbolTable.define(new Symbol(label.name(), Symbol.Type.LABEL, label, location));
            } else if (instruction instanceof Declaration declaration) {
                symbolTable.define(new Symbol(declaration.name(), Symbol.Type.MEMORY, declaration, location));
            } else if (instruction instanceof GateDefinition gate) {
                symbolTable.define(new Symbol(gate.name(), Symbol.Type.GATE, gate, location));
            } else if (instruction instanceof WaveformDefinition waveform) {
                symbolTable.define(new Symbol(waveform.name(), Symbol.Type.WAVEFORM, waveform, location));
            } else if (instruction instanceof CircuitDefinition circuit) {
                symbolTable.define(new Symbol(circuit.name(), Symbol.Type.CIRCUIT, circuit, location));
            }

            List<Instruction> body = bodyOf(instruction);
            if (body != null) {
                scopeMap.put(instruction, symbolTable.enterScope());
                if (instruction instanceof MeasureCalibrationDefinition measure && measure.parameter() != null) {
                    symbolTable.define(new Symbol(measure.parameter(), Symbol.Type.MEMORY, measure, location));
                }
                collectSymbols(program, body, symbolTable, scopeMap);
                symbolTable.leaveScope();
            }
        }
    }

    private void traverseAndAnalyze(Program program, List<Instruction> instructions, SymbolTable symbolTable,
                                    Map<Instruction, SymbolTable.Scope> scopeMap, DiagnosticsEngine diagnostics) {
        for (Instruction instruction : instructions) {
            SourceInfo location = program.sourceOf(instruction);
            memoryHandler.analyze(instruction, location, symbolTable, diagnostics);
            IAnalysisHandler handler = handlers.get(instruction.getClass());
            if (handler != null) {
                handler.analyze(instruction, location, symbolTable, diagnostics);
            }

            List<Instruction> body = bodyOf(instruction);
            if (body != null) {
                symbolTable.setCurrentScope(scopeMap.get(instruction));
                reportDuplicates(symbolTable, diagnostics);
                traverseAndAnalyze(program, body, symbolTable, scopeMap, diagnostics);
                symbolTable.leaveScope();
            }
        }
    }

    private static void reportDuplicates(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        for (Symbol.Type type : Symbol.Type.values()) {
            for (List<Symbol> defined : symbolTable.duplicates(type)) {
                String name = defined.get(0).name();
                List<SourceInfo> locations = new ArrayList<>();
                for (Symbol symbol : defined) {
                    locations.add(symbol.location());
                }
                switch (type) {
                    case LABEL -> diagnostics.report(ValidationErrorKind.DUPLICATE_LABEL,
                            "Label '@" + name + "' is defined " + defined.size() + " times.", locations);
                    case MEMORY -> diagnostics.report(ValidationErrorKind.DUPLICATE_DECLARATION,
                            "Memory region '" + name + "' is declared " + defined.size() + " times.", locations);
                    default -> diagnostics.report(ValidationErrorKind.DUPLICATE_DEFINITION,
                            type.name().charAt(0) + type.name().substring(1).toLowerCase()
                                    + " '" + name + "' is defined " + defined.size() + " times.", locations);
                }
            }
        }
    }

    private static List<Instruction> bodyOf(Instruction instruction) {
        if (instruction instanceof CircuitDefinition circuit) {
            return circuit.body();
        }
        if (instruction instanceof CalibrationDefinition calibration) {
            return calibration.body();
        }
        if (instruction instanceof MeasureCalibrationDefinition measure) {
            return measure.body();
        }
        return null;
    }
}
