package org.quilkit.compiler.ir;

import org.quilkit.compiler.analysis.DependencyGraph;
import org.quilkit.compiler.analysis.DependencyGraphBuilder;
import org.quilkit.compiler.config.CompilerSettings;
import org.quilkit.compiler.ir.instruction.Instruction;

import java.util.List;

/**
 * A maximal run of the executable body without control transfer in its interior.
 *
 * @param index The position of the block among the program's blocks.
 * @param startIndex The index of the first instruction in {@link Program#instructions()}.
 * @param instructions The instructions, a leading label and a trailing terminator included.
 * @param memoryLayout The program's memory declarations when the block was derived.
 */
public record BasicBlock(int index, int startIndex, List<Instruction> instructions, MemoryLayout memoryLayout) {

    public BasicBlock {
        instructions = List.copyOf(instructions);
    }

    public int size() {
        return instructions.size();
    }

    /**
     * Builds the block's dependency graph with the default configuration.
     * @return A freshly built graph.
     */
    public DependencyGraph dependencyGraph() {
        return new DependencyGraphBuilder(CompilerSettings.defaults().pragmaBarrier()).build(this);
    }
}
