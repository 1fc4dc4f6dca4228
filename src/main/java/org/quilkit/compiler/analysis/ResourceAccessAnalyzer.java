package org.quilkit.compiler.analysis;

import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.ir.MemoryLayout;
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
import org.quilkit.compiler.ir.operand.FrameIdentifier;
import org.quilkit.compiler.ir.operand.MemoryReference;
import org.quilkit.compiler.ir.operand.Qubit;
import org.quilkit.compiler.ir.operand.WaveformInvocation;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Computes the {@link ResourceAccess} of an instruction.
 * <p>
 * Every instruction reads the barrier. Regions of a {@code SHARING} group are always
 * accessed as one {@link Resource.MemoryRegion} on the group root, all other memory per slot.
 * Where the exact slots are unknown (an undeclared region in {@code LOAD}/{@code STORE},
 * or a computed address index), the barrier is written instead.
 */
public class ResourceAccessAnalyzer implements InstructionVisitor<ResourceAccess> {

    private final MemoryLayout layout;
    private final boolean pragmaBarrier;

    /**
     * @param layout The memory declarations of the program the instructions belong to.
     * @param pragmaBarrier Whether {@code PRAGMA} writes the barrier.
     */
    public ResourceAccessAnalyzer(MemoryLayout layout, boolean pragmaBarrier) {
        this.layout = layout;
        this.pragmaBarrier = pragmaBarrier;
    }

    private static ResourceAccess.Builder access() {
        return new ResourceAccess.Builder().read(Resource.BARRIER);
    }

    private static ResourceAccess barrier() {
        return access().write(Resource.BARRIER).build();
    }

    private Resource slot(MemoryReference reference) {
        return slot(reference.name(), reference.index());
    }

    private Resource slot(String region, long index) {
        String root = layout.rootOf(region);
        if (layout.isAliased(root)) {
            return new Resource.MemoryRegion(root);
        }
        return new Resource.MemorySlot(region, index);
    }

    private void read(ResourceAccess.Builder builder, ClassicalOperand operand) {
        if (operand instanceof ClassicalOperand.Memory memory) {
            builder.read(slot(memory.reference()));
        }
    }

    private void read(ResourceAccess.Builder builder, Expression expression) {
        for (Expression.Address address : expression.addressReferences()) {
            OptionalLong index = address.slot();
            if (index.isPresent()) {
                builder.read(slot(address.region(), index.getAsLong()));
            } else {
                readRegion(builder, address.region());
            }
        }
    }

    private void read(ResourceAccess.Builder builder, WaveformInvocation waveform) {
        for (Expression value : waveform.parameters().values()) {
            read(builder, value);
        }
    }

    private void readRegion(ResourceAccess.Builder builder, String region) {
        Optional<Declaration> declaration = layout.declaration(region);
        if (declaration.isEmpty()) {
            builder.write(Resource.BARRIER);
            return;
        }
        for (long i = 0; i < declaration.get().size().length(); i++) {
            builder.read(slot(region, i));
        }
    }

    private void writeRegion(ResourceAccess.Builder builder, String region) {
        Optional<Declaration> declaration = layout.declaration(region);
        if (declaration.isEmpty()) {
            builder.write(Resource.BARRIER);
            return;
        }
        for (long i = 0; i < declaration.get().size().length(); i++) {
            builder.write(slot(region, i));
        }
    }

    private static void writeQubits(ResourceAccess.Builder builder, List<Qubit> qubits) {
        for (Qubit qubit : qubits) {
            builder.write(new Resource.QubitResource(qubit));
        }
    }

    private static void readQubits(ResourceAccess.Builder builder, List<Qubit> qubits) {
        for (Qubit qubit : qubits) {
            builder.read(new Resource.QubitResource(qubit));
        }
    }

    private static void useFrame(ResourceAccess.Builder builder, boolean blocking, FrameIdentifier frame) {
        builder.write(new Resource.Frame(frame));
        if (blocking) {
            writeQubits(builder, frame.qubits());
        } else {
            readQubits(builder, frame.qubits());
        }
    }

    @Override
    public ResourceAccess visit(GateApplication instruction) {
        ResourceAccess.Builder builder = access();
        writeQubits(builder, instruction.qubits());
        for (Expression parameter : instruction.parameters()) {
            read(builder, parameter);
        }
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Measurement instruction) {
        ResourceAccess.Builder builder = access().write(new Resource.QubitResource(instruction.qubit()));
        if (instruction.target() != null) {
            builder.write(slot(instruction.target()));
        }
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Reset instruction) {
        if (instruction.qubit() == null) {
            return barrier();
        }
        return access().write(new Resource.QubitResource(instruction.qubit())).build();
    }

    @Override
    public ResourceAccess visit(Arithmetic instruction) {
        ResourceAccess.Builder builder = access().write(slot(instruction.destination()));
        read(builder, instruction.source());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(UnaryLogic instruction) {
        return access().write(slot(instruction.operand())).build();
    }

    @Override
    public ResourceAccess visit(BinaryLogic instruction) {
        ResourceAccess.Builder builder = access().write(slot(instruction.destination()));
        read(builder, instruction.source());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Comparison instruction) {
        ResourceAccess.Builder builder = access()
                .write(slot(instruction.destination()))
                .read(slot(instruction.left()));
        read(builder, instruction.right());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Move instruction) {
        ResourceAccess.Builder builder = access().write(slot(instruction.destination()));
        read(builder, instruction.source());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Exchange instruction) {
        return access().write(slot(instruction.left())).write(slot(instruction.right())).build();
    }

    @Override
    public ResourceAccess visit(Convert instruction) {
        return access().write(slot(instruction.destination())).read(slot(instruction.source())).build();
    }

    @Override
    public ResourceAccess visit(Load instruction) {
        ResourceAccess.Builder builder = access()
                .write(slot(instruction.destination()))
                .read(slot(instruction.offset()));
        readRegion(builder, instruction.region());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Store instruction) {
        ResourceAccess.Builder builder = access().read(slot(instruction.offset()));
        read(builder, instruction.source());
        writeRegion(builder, instruction.region());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Label instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(Jump instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(JumpWhen instruction) {
        return access().write(Resource.BARRIER).read(slot(instruction.condition())).build();
    }

    @Override
    public ResourceAccess visit(JumpUnless instruction) {
        return access().write(Resource.BARRIER).read(slot(instruction.condition())).build();
    }

    @Override
    public ResourceAccess visit(Halt instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(Wait instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(Nop instruction) {
        return access().build();
    }

    @Override
    public ResourceAccess visit(Pragma instruction) {
        return pragmaBarrier ? barrier() : access().build();
    }

    // Declarations and definitions never appear in a basic block; order them conservatively.

    @Override
    public ResourceAccess visit(Declaration instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(GateDefinition instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(CircuitDefinition instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(CalibrationDefinition instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(MeasureCalibrationDefinition instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(FrameDefinition instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(WaveformDefinition instruction) {
        return barrier();
    }

    @Override
    public ResourceAccess visit(Pulse instruction) {
        ResourceAccess.Builder builder = access();
        useFrame(builder, instruction.blocking(), instruction.frame());
        read(builder, instruction.waveform());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Capture instruction) {
        ResourceAccess.Builder builder = access();
        useFrame(builder, instruction.blocking(), instruction.frame());
        read(builder, instruction.waveform());
        builder.write(slot(instruction.target()));
        return builder.build();
    }

    @Override
    public ResourceAccess visit(RawCapture instruction) {
        ResourceAccess.Builder builder = access();
        useFrame(builder, instruction.blocking(), instruction.frame());
        read(builder, instruction.duration());
        builder.write(slot(instruction.target()));
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Delay instruction) {
        ResourceAccess.Builder builder = access();
        if (!instruction.frameNames().isEmpty()) {
            for (String name : instruction.frameNames()) {
                builder.write(new Resource.Frame(new FrameIdentifier(name, instruction.qubits())));
            }
            readQubits(builder, instruction.qubits());
        } else if (!instruction.qubits().isEmpty()) {
            writeQubits(builder, instruction.qubits());
        } else {
            builder.write(Resource.BARRIER);
        }
        read(builder, instruction.duration());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(Fence instruction) {
        if (instruction.qubits().isEmpty()) {
            return barrier();
        }
        ResourceAccess.Builder builder = access();
        writeQubits(builder, instruction.qubits());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(FrameMutation instruction) {
        ResourceAccess.Builder builder = access().write(new Resource.Frame(instruction.frame()));
        readQubits(builder, instruction.frame().qubits());
        read(builder, instruction.value());
        return builder.build();
    }

    @Override
    public ResourceAccess visit(SwapPhases instruction) {
        ResourceAccess.Builder builder = access()
                .write(new Resource.Frame(instruction.first()))
                .write(new Resource.Frame(instruction.second()));
        readQubits(builder, instruction.first().qubits());
        readQubits(builder, instruction.second().qubits());
        return builder.build();
    }
}
