package org.quilkit.compiler.frontend.semantics.analysis;

import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.ir.instruction.Arithmetic;
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
import org.quilkit.compiler.ir.instruction.Halt;
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
import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.MemoryReference;
import org.quilkit.compiler.ir.operand.WaveformInvocation;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the names of all memory regions an instruction refers to, through operands,
 * jump conditions, measurement and capture targets, expression addresses and
 * {@code SHARING} parents. Definitions contribute nothing: their bodies are visited
 * instruction by instruction.
 */
final class MemoryReferenceCollector implements InstructionVisitor<Set<String>> {

    private static Set<String> regions(Object... parts) {
        Set<String> names = new LinkedHashSet<>();
        for (Object part : parts) {
            add(names, part);
        }
        return names;
    }

    private static void add(Set<String> names, Object part) {
        if (part instanceof MemoryReference reference) {
            names.add(reference.name());
        } else if (part instanceof ClassicalOperand.Memory memory) {
            names.add(memory.reference().name());
        } else if (part instanceof Expression expression) {
            names.addAll(expression.addresses());
        } else if (part instanceof WaveformInvocation waveform) {
            for (Expression value : waveform.parameters().values()) {
                names.addAll(value.addresses());
            }
        } else if (part instanceof String region) {
            names.add(region);
        } else if (part instanceof Collection<?> collection) {
            for (Object element : collection) {
                add(names, element);
            }
        }
    }

    @Override
    public Set<String> visit(GateApplication instruction) {
        return regions(instruction.parameters());
    }

    @Override
    public Set<String> visit(Measurement instruction) {
        return regions(instruction.target());
    }

    @Override
    public Set<String> visit(Reset instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(Arithmetic instruction) {
        return regions(instruction.destination(), instruction.source());
    }

    @Override
    public Set<String> visit(UnaryLogic instruction) {
        return regions(instruction.operand());
    }

    @Override
    public Set<String> visit(BinaryLogic instruction) {
        return regions(instruction.destination(), instruction.source());
    }

    @Override
    public Set<String> visit(Comparison instruction) {
        return regions(instruction.destination(), instruction.left(), instruction.right());
    }

    @Override
    public Set<String> visit(Move instruction) {
        return regions(instruction.destination(), instruction.source());
    }

    @Override
    public Set<String> visit(Exchange instruction) {
        return regions(instruction.left(), instruction.right());
    }

    @Override
    public Set<String> visit(Convert instruction) {
        return regions(instruction.destination(), instruction.source());
    }

    @Override
    public Set<String> visit(Load instruction) {
        return regions(instruction.destination(), instruction.region(), instruction.offset());
    }

    @Override
    public Set<String> visit(Store instruction) {
        return regions(instruction.region(), instruction.offset(), instruction.source());
    }

    @Override
    public Set<String> visit(Label instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(Jump instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(JumpWhen instruction) {
        return regions(instruction.condition());
    }

    @Override
    public Set<String> visit(JumpUnless instruction) {
        return regions(instruction.condition());
    }

    @Override
    public Set<String> visit(Halt instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(Wait instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(Nop instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(Declaration instruction) {
        return instruction.sharing() == null ? Set.of() : regions(instruction.sharing().parent());
    }

    @Override
    public Set<String> visit(Pragma instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(GateDefinition instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(CircuitDefinition instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(CalibrationDefinition instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(MeasureCalibrationDefinition instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(FrameDefinition instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(WaveformDefinition instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(Pulse instruction) {
        return regions(instruction.waveform());
    }

    @Override
    public Set<String> visit(Capture instruction) {
        return regions(instruction.waveform(), instruction.target());
    }

    @Override
    public Set<String> visit(RawCapture instruction) {
        return regions(instruction.duration(), instruction.target());
    }

    @Override
    public Set<String> visit(Delay instruction) {
        return regions(instruction.duration());
    }

    @Override
    public Set<String> visit(Fence instruction) {
        return Set.of();
    }

    @Override
    public Set<String> visit(FrameMutation instruction) {
        return regions(instruction.value());
    }

    @Override
    public Set<String> visit(SwapPhases instruction) {
        return Set.of();
    }
}
