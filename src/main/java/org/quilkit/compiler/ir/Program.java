package org.quilkit.compiler.ir;

import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.backend.emit.QuilSerializer;
import org.quilkit.compiler.config.CompilerSettings;
import org.quilkit.compiler.diagnostics.ValidationError;
import org.quilkit.compiler.frontend.semantics.ProgramValidator;
import org.quilkit.compiler.ir.instruction.CalibrationDefinition;
import org.quilkit.compiler.ir.instruction.CircuitDefinition;
import org.quilkit.compiler.ir.instruction.Declaration;
import org.quilkit.compiler.ir.instruction.FrameDefinition;
import org.quilkit.compiler.ir.instruction.GateDefinition;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Label;
import org.quilkit.compiler.ir.instruction.MeasureCalibrationDefinition;
import org.quilkit.compiler.ir.instruction.WaveformDefinition;
import org.quilkit.compiler.ir.operand.FrameIdentifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A Quil program: the ordered top-level items plus symbol tables over its declarations
 * and definitions. The order of items is the source order and is preserved by the serializer.
 * <p>
 * Construction through {@link #add} is single-writer. Once built, a program may be read by
 * any number of threads; none of the read operations mutate it.
 */
public final class Program {

    private final String programName;
    private final List<Instruction> items = new ArrayList<>();
    private final Map<Instruction, SourceInfo> sources = new IdentityHashMap<>();
    private final Map<String, Declaration> memoryRegions = new LinkedHashMap<>();
    private final Map<String, GateDefinition> gateDefinitions = new LinkedHashMap<>();
    private final Map<String, CircuitDefinition> circuitDefinitions = new LinkedHashMap<>();
    private final Map<String, WaveformDefinition> waveformDefinitions = new LinkedHashMap<>();
    private final Map<FrameIdentifier, FrameDefinition> frameDefinitions = new LinkedHashMap<>();
    private final List<CalibrationDefinition> calibrations = new ArrayList<>();
    private final List<MeasureCalibrationDefinition> measureCalibrations = new ArrayList<>();

    public Program() {
        this("<memory>");
    }

    /**
     * @param programName A logical name, used in log output.
     */
    public Program(String programName) {
        this.programName = Objects.requireNonNull(programName, "programName");
    }

    public String programName() {
        return programName;
    }

    /**
     * Appends an instruction that was not read from source.
     * @param instruction The instruction.
     * @return This program.
     */
    public Program add(Instruction instruction) {
        return add(instruction, null);
    }

    /**
     * Appends an instruction and registers it in the symbol tables. When a name is declared or
     * defined more than once, the first one stays in the table; every item stays in order.
     *
     * @param instruction The instruction.
     * @param source Where it was read from, or {@code null}.
     * @return This program.
     */
    public Program add(Instruction instruction, SourceInfo source) {
        Objects.requireNonNull(instruction, "instruction");
        items.add(instruction);
        recordSource(instruction, source);
        if (instruction instanceof Declaration d) {
            memoryRegions.putIfAbsent(d.name(), d);
        } else if (instruction instanceof GateDefinition g) {
            gateDefinitions.putIfAbsent(g.name(), g);
        } else if (instruction instanceof CircuitDefinition c) {
            circuitDefinitions.putIfAbsent(c.name(), c);
        } else if (instruction instanceof WaveformDefinition w) {
            waveformDefinitions.putIfAbsent(w.name(), w);
        } else if (instruction instanceof FrameDefinition f) {
            frameDefinitions.putIfAbsent(f.frame(), f);
        } else if (instruction instanceof CalibrationDefinition c) {
            calibrations.add(c);
        } else if (instruction instanceof MeasureCalibrationDefinition m) {
            measureCalibrations.add(m);
        }
        return this;
    }

    /**
     * Remembers where an instruction nested in a definition body was read from.
     * @param instruction The instruction instance.
     * @param source Its position, ignored when {@code null}.
     */
    public void recordSource(Instruction instruction, SourceInfo source) {
        if (source != null) {
            sources.put(instruction, source);
        }
    }

    /**
     * @param instruction An instruction instance of this program, top-level or nested.
     * @return Where it was read from, or {@code null} if it was built in code.
     */
    public SourceInfo sourceOf(Instruction instruction) {
        return sources.get(instruction);
    }

    /**
     * @return All top-level items in order, including declarations and definitions.
     */
    public List<Instruction> items() {
        return Collections.unmodifiableList(items);
    }

    /**
     * @return The executable body: every item that is neither a declaration nor a definition, in order.
     */
    public List<Instruction> instructions() {
        List<Instruction> body = new ArrayList<>();
        for (Instruction item : items) {
            if (!item.isDefinition()) {
                body.add(item);
            }
        }
        return Collections.unmodifiableList(body);
    }

    public Optional<Declaration> memoryRegion(String name) {
        return Optional.ofNullable(memoryRegions.get(name));
    }

    public Map<String, Declaration> memoryRegions() {
        return Collections.unmodifiableMap(memoryRegions);
    }

    public Optional<GateDefinition> gateDefinition(String name) {
        return Optional.ofNullable(gateDefinitions.get(name));
    }

    public Optional<CircuitDefinition> circuitDefinition(String name) {
        return Optional.ofNullable(circuitDefinitions.get(name));
    }

    public Optional<WaveformDefinition> waveformDefinition(String name) {
        return Optional.ofNullable(waveformDefinitions.get(name));
    }

    public Optional<FrameDefinition> frameDefinition(FrameIdentifier frame) {
        return Optional.ofNullable(frameDefinitions.get(frame));
    }

    public List<CalibrationDefinition> calibrations() {
        return Collections.unmodifiableList(calibrations);
    }

    public List<MeasureCalibrationDefinition> measureCalibrations() {
        return Collections.unmodifiableList(measureCalibrations);
    }

    /**
     * @return The names of the labels of the program body, in order, without duplicates.
     */
    public Set<String> labels() {
        Set<String> names = new LinkedHashSet<>();
        for (Instruction item : items) {
            if (item instanceof Label label) {
                names.add(label.name());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Splits the executable body into basic blocks. A label only ever opens a block and
     * a jump or HALT only ever closes one. The result is computed on every call.
     *
     * @return The blocks in program order; empty for a program without instructions.
     */
    public List<BasicBlock> basicBlocks() {
        MemoryLayout layout = MemoryLayout.of(memoryRegions.values());
        List<BasicBlock> blocks = new ArrayList<>();
        List<Instruction> current = new ArrayList<>();
        int start = 0;
        int index = 0;
        for (Instruction instruction : instructions()) {
            if (instruction instanceof Label && !current.isEmpty()) {
                blocks.add(new BasicBlock(blocks.size(), start, current, layout));
                current = new ArrayList<>();
                start = index;
            }
            current.add(instruction);
            index++;
            if (instruction.isTerminator()) {
                blocks.add(new BasicBlock(blocks.size(), start, current, layout));
                current = new ArrayList<>();
                start = index;
            }
        }
        if (!current.isEmpty()) {
            blocks.add(new BasicBlock(blocks.size(), start, current, layout));
        }
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Runs every validation check enabled in the default configuration.
     * @return All problems found, in program order; empty for a valid program.
     */
    public List<ValidationError> validate() {
        return new ProgramValidator(CompilerSettings.defaults().enabledChecks()).validate(this);
    }

    /**
     * @return The canonical Quil text of this program.
     */
    public String toQuil() {
        return new QuilSerializer(CompilerSettings.defaults().serializerIndent()).serialize(this);
    }

    @Override
    public String toString() {
        return "Program{" + programName + ", " + items.size() + " items}";
    }
}
