package org.quilkit.compiler.backend.emit;

import org.quilkit.compiler.diagnostics.CompilerLogger;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.expression.ExpressionPrinter;
import org.quilkit.compiler.ir.Program;
import org.quilkit.compiler.ir.instruction.Arithmetic;
import org.quilkit.compiler.ir.instruction.AttributeValue;
import org.quilkit.compiler.ir.instruction.BinaryLogic;
import org.quilkit.compiler.ir.instruction.CalibrationDefinition;
import org.quilkit.compiler.ir.instruction.Capture;
import org.quilkit.compiler.ir.instruction.CircuitDefinition;
import org.quilkit.compiler.ir.instruction.Comparison;
import org.quilkit.compiler.ir.instruction.Convert;
import org.quilkit.compiler.ir.instruction.Declaration;
import org.quilkit.compiler.ir.instruction.Delay;
import org.quilkit.compiler.ir.instruction.Exchange;
import org.quilkit.compiler.ir.instruction.Fence;
import org.quilkit.compiler.ir.instruction.FrameDefinition;
import org.quilkit.compiler.ir.instruction.FrameMutation;
import org.quilkit.compiler.ir.instruction.GateApplication;
import org.quilkit.compiler.ir.instruction.GateDefinition;
import org.quilkit.compiler.ir.instruction.GateSpecification;
import org.quilkit.compiler.ir.instruction.Halt;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.InstructionVisitor;
import org.quilkit.compiler.ir.instruction.Jump;
import org.quilkit.compiler.ir.instruction.JumpUnless;
import org.quilkit.compiler.ir.instruction.JumpWhen;
import org.quilkit.compiler.ir.instruction.Label;
import org.quilkit.compiler.ir.instruction.Load;
import org.quilkit.compiler.ir.instruction.MeasureCalibrationDefinition;
import org.quilkit.compiler.ir.instruction.Measurement;
import org.quilkit.compiler.ir.instruction.Move;
import org.quilkit.compiler.ir.instruction.Nop;
import org.quilkit.compiler.ir.instruction.Pragma;
import org.quilkit.compiler.ir.instruction.Pulse;
import org.quilkit.compiler.ir.instruction.RawCapture;
import org.quilkit.compiler.ir.instruction.Reset;
import org.quilkit.compiler.ir.instruction.Store;
import org.quilkit.compiler.ir.instruction.SwapPhases;
import org.quilkit.compiler.ir.instruction.UnaryLogic;
import org.quilkit.compiler.ir.instruction.Wait;
import org.quilkit.compiler.ir.instruction.WaveformDefinition;
import org.quilkit.compiler.ir.operand.FrameIdentifier;
import org.quilkit.compiler.ir.operand.GateModifier;
import org.quilkit.compiler.ir.operand.Offset;
import org.quilkit.compiler.ir.operand.Qubit;
import org.quilkit.compiler.ir.operand.WaveformInvocation;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Writes a {@link Program} as canonical Quil text.
 * <p>
 * One item per line, block bodies indented, memory references always indexed and
 * expressions with the fewest parentheses their precedence allows. Reading the output
 * back yields an equal program, and writing that program again yields the same text.
 */
public class QuilSerializer implements InstructionVisitor<String> {

    /** The indent used when no configuration is at hand. */
    public static final String DEFAULT_INDENT = "    ";

    private final String indent;

    public QuilSerializer() {
        this(DEFAULT_INDENT);
    }

    /**
     * @param indent The text placed before every line of a block body.
     */
    public QuilSerializer(String indent) {
        if (indent.isEmpty() || !indent.isBlank()) {
            throw new IllegalArgumentException("Indent must be non-empty whitespace: '" + indent + "'");
        }
        this.indent = indent;
    }

    /**
     * Serializes a whole program.
     * @param program The program.
     * @return The text, every line terminated by a newline; empty for an empty program.
     */
    public String serialize(Program program) {
        StringBuilder out = new StringBuilder();
        for (Instruction item : program.items()) {
            out.append(item.accept(this)).append('\n');
        }
        CompilerLogger.debug("Serialized " + program.programName() + " (" + program.items().size() + " items)");
        return out.toString();
    }

    /**
     * Serializes one instruction with the default indent.
     * @param instruction The instruction.
     * @return Its text without a trailing newline; definitions span several lines.
     */
    public static String serializeInstruction(Instruction instruction) {
        return instruction.accept(new QuilSerializer());
    }

    // region Quantum

    @Override
    public String visit(GateApplication instruction) {
        StringBuilder out = new StringBuilder();
        for (GateModifier modifier : instruction.modifiers()) {
            out.append(modifier.name()).append(' ');
        }
        out.append(instruction.name()).append(expressionList(instruction.parameters()));
        return out.append(' ').append(qubits(instruction.qubits())).toString();
    }

    @Override
    public String visit(Measurement instruction) {
        String text = "MEASURE " + instruction.qubit();
        return instruction.target() == null ? text : text + " " + instruction.target();
    }

    @Override
    public String visit(Reset instruction) {
        return instruction.qubit() == null ? "RESET" : "RESET " + instruction.qubit();
    }

    // endregion

    // region Classical

    @Override
    public String visit(Arithmetic instruction) {
        return instruction.operator().name() + " " + instruction.destination() + " " + instruction.source();
    }

    @Override
    public String visit(UnaryLogic instruction) {
        return instruction.operator().name() + " " + instruction.operand();
    }

    @Override
    public String visit(BinaryLogic instruction) {
        return instruction.operator().name() + " " + instruction.destination() + " " + instruction.source();
    }

    @Override
    public String visit(Comparison instruction) {
        return instruction.operator().name() + " " + instruction.destination()
                + " " + instruction.left() + " " + instruction.right();
    }

    @Override
    public String visit(Move instruction) {
        return "MOVE " + instruction.destination() + " " + instruction.source();
    }

    @Override
    public String visit(Exchange instruction) {
        return "EXCHANGE " + instruction.left() + " " + instruction.right();
    }

    @Override
    public String visit(Convert instruction) {
        return "CONVERT " + instruction.destination() + " " + instruction.source();
    }

    @Override
    public String visit(Load instruction) {
        return "LOAD " + instruction.destination() + " " + instruction.region() + " " + instruction.offset();
    }

    @Override
    public String visit(Store instruction) {
        return "STORE " + instruction.region() + " " + instruction.offset() + " " + instruction.source();
    }

    // endregion

    // region Control

    @Override
    public String visit(Label instruction) {
        return "LABEL @" + instruction.name();
    }

    @Override
    public String visit(Jump instruction) {
        return "JUMP @" + instruction.target();
    }

    @Override
    public String visit(JumpWhen instruction) {
        return "JUMP-WHEN @" + instruction.target() + " " + instruction.condition();
    }

    @Override
    public String visit(JumpUnless instruction) {
        return "JUMP-UNLESS @" + instruction.target() + " " + instruction.condition();
    }

    @Override
    public String visit(Halt instruction) {
        return "HALT";
    }

    @Override
    public String visit(Wait instruction) {
        return "WAIT";
    }

    @Override
    public String visit(Nop instruction) {
        return "NOP";
    }

    // endregion

    @Override
    public String visit(Declaration instruction) {
        StringBuilder out = new StringBuilder("DECLARE ")
                .append(instruction.name()).append(' ').append(instruction.size());
        if (instruction.sharing() != null) {
            out.append(" SHARING ").append(instruction.sharing().parent());
            for (Offset offset : instruction.sharing().offsets()) {
                out.append(' ').append(offset);
            }
        }
        return out.toString();
    }

    @Override
    public String visit(Pragma instruction) {
        StringBuilder out = new StringBuilder("PRAGMA ").append(instruction.name());
        for (String argument : instruction.arguments()) {
            out.append(' ').append(argument);
        }
        if (instruction.data() != null) {
            out.append(' ').append(quote(instruction.data()));
        }
        return out.toString();
    }

    // region Definitions

    @Override
    public String visit(GateDefinition instruction) {
        StringBuilder out = new StringBuilder("DEFGATE ")
                .append(instruction.name())
                .append(parameterNames(instruction.parameters()));
        GateSpecification specification = instruction.specification();
        if (specification instanceof GateSpecification.Matrix matrix) {
            out.append(':');
            for (List<Expression> row : matrix.rows()) {
                newLine(out).append(expressions(row));
            }
        } else if (specification instanceof GateSpecification.Permutation permutation) {
            out.append(" AS PERMUTATION:");
            newLine(out).append(permutation.entries().stream().map(String::valueOf).collect(Collectors.joining(", ")));
        } else if (specification instanceof GateSpecification.PauliSum pauliSum) {
            for (String argument : pauliSum.arguments()) {
                out.append(' ').append(argument);
            }
            out.append(" AS PAULI-SUM:");
            for (GateSpecification.PauliTerm term : pauliSum.terms()) {
                newLine(out).append(term.word())
                        .append('(').append(ExpressionPrinter.print(term.coefficient())).append(')');
                for (String qubit : term.qubits()) {
                    out.append(' ').append(qubit);
                }
            }
        }
        return out.toString();
    }

    @Override
    public String visit(CircuitDefinition instruction) {
        StringBuilder out = new StringBuilder("DEFCIRCUIT ")
                .append(instruction.name())
                .append(parameterNames(instruction.parameters()));
        for (String qubit : instruction.qubitVariables()) {
            out.append(' ').append(qubit);
        }
        out.append(':');
        return body(out, instruction.body());
    }

    @Override
    public String visit(CalibrationDefinition instruction) {
        StringBuilder out = new StringBuilder("DEFCAL ");
        for (GateModifier modifier : instruction.modifiers()) {
            out.append(modifier.name()).append(' ');
        }
        out.append(instruction.name())
                .append(expressionList(instruction.parameters()))
                .append(' ').append(qubits(instruction.qubits()))
                .append(':');
        return body(out, instruction.body());
    }

    @Override
    public String visit(MeasureCalibrationDefinition instruction) {
        StringBuilder out = new StringBuilder("DEFCAL MEASURE");
        if (instruction.qubit() != null) {
            out.append(' ').append(instruction.qubit());
            if (instruction.parameter() != null) {
                out.append(' ').append(instruction.parameter());
            }
        }
        out.append(':');
        return body(out, instruction.body());
    }

    @Override
    public String visit(FrameDefinition instruction) {
        StringBuilder out = new StringBuilder("DEFFRAME ").append(frame(instruction.frame()));
        if (instruction.attributes().isEmpty()) {
            return out.toString();
        }
        out.append(':');
        for (Map.Entry<String, AttributeValue> attribute : instruction.attributes().entrySet()) {
            newLine(out).append(attribute.getKey()).append(": ");
            AttributeValue value = attribute.getValue();
            if (value instanceof AttributeValue.Text text) {
                out.append(quote(text.value()));
            } else if (value instanceof AttributeValue.Expr expr) {
                out.append(ExpressionPrinter.print(expr.value()));
            }
        }
        return out.toString();
    }

    @Override
    public String visit(WaveformDefinition instruction) {
        StringBuilder out = new StringBuilder("DEFWAVEFORM ")
                .append(instruction.name())
                .append(parameterNames(instruction.parameters()))
                .append(':');
        newLine(out).append(expressions(instruction.samples()));
        return out.toString();
    }

    // endregion

    // region Pulse level

    @Override
    public String visit(Pulse instruction) {
        return blocking(instruction.blocking()) + "PULSE " + frame(instruction.frame())
                + " " + waveform(instruction.waveform());
    }

    @Override
    public String visit(Capture instruction) {
        return blocking(instruction.blocking()) + "CAPTURE " + frame(instruction.frame())
                + " " + waveform(instruction.waveform()) + " " + instruction.target();
    }

    @Override
    public String visit(RawCapture instruction) {
        return blocking(instruction.blocking()) + "RAW-CAPTURE " + frame(instruction.frame())
                + " " + ExpressionPrinter.print(instruction.duration()) + " " + instruction.target();
    }

    @Override
    public String visit(Delay instruction) {
        StringBuilder out = new StringBuilder("DELAY");
        for (Qubit qubit : instruction.qubits()) {
            out.append(' ').append(qubit);
        }
        for (String frameName : instruction.frameNames()) {
            out.append(' ').append(quote(frameName));
        }
        return out.append(' ').append(delayDuration(instruction)).toString();
    }

    /**
     * A duration right after a qubit is parenthesized unless it is a lone real number or
     * variable, so that no part of it reads back as another qubit.
     */
    private static String delayDuration(Delay instruction) {
        Expression duration = instruction.duration();
        String text = ExpressionPrinter.print(duration);
        if (!instruction.frameNames().isEmpty() || duration instanceof Expression.Variable) {
            return text;
        }
        if (duration instanceof Expression.Number n && n.value().getImaginary() == 0) {
            return text;
        }
        return "(" + text + ")";
    }

    @Override
    public String visit(Fence instruction) {
        return instruction.qubits().isEmpty() ? "FENCE" : "FENCE " + qubits(instruction.qubits());
    }

    @Override
    public String visit(FrameMutation instruction) {
        return instruction.operation().text() + " " + frame(instruction.frame())
                + " " + ExpressionPrinter.print(instruction.value());
    }

    @Override
    public String visit(SwapPhases instruction) {
        return "SWAP-PHASES " + frame(instruction.first()) + " " + frame(instruction.second());
    }

    // endregion

    private StringBuilder newLine(StringBuilder out) {
        return out.append('\n').append(indent);
    }

    private String body(StringBuilder out, List<Instruction> body) {
        for (Instruction instruction : body) {
            newLine(out).append(instruction.accept(this));
        }
        return out.toString();
    }

    private static String blocking(boolean blocking) {
        return blocking ? "" : "NONBLOCKING ";
    }

    private static String qubits(List<Qubit> qubits) {
        return qubits.stream().map(Qubit::toString).collect(Collectors.joining(" "));
    }

    private static String expressions(List<Expression> expressions) {
        return expressions.stream().map(ExpressionPrinter::print).collect(Collectors.joining(", "));
    }

    private static String expressionList(List<Expression> expressions) {
        return expressions.isEmpty() ? "" : "(" + expressions(expressions) + ")";
    }

    private static String parameterNames(List<String> names) {
        if (names.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (String name : names) {
            joiner.add("%" + name);
        }
        return joiner.toString();
    }

    private static String frame(FrameIdentifier frame) {
        return qubits(frame.qubits()) + " " + quote(frame.name());
    }

    private static String waveform(WaveformInvocation waveform) {
        if (waveform.parameters().isEmpty()) {
            return waveform.name();
        }
        StringJoiner joiner = new StringJoiner(", ", waveform.name() + "(", ")");
        for (Map.Entry<String, Expression> parameter : waveform.parameters().entrySet()) {
            joiner.add(parameter.getKey() + ": " + ExpressionPrinter.print(parameter.getValue()));
        }
        return joiner.toString();
    }

    static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
