package org.quilkit.compiler.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.quilkit.compiler.diagnostics.CompilerLogger;
import org.quilkit.compiler.ir.BasicBlock;
import org.quilkit.compiler.ir.instruction.Instruction;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link DependencyGraph} of a basic block in one linear pass.
 * <p>
 * For every resource the builder remembers the last writer and the readers since that
 * writer. Any access depends on the last writer; a write also depends on every recorded
 * reader and then becomes the new last writer; a read-only access is recorded as a reader.
 * Every pair of conflicting instructions is therefore connected by a path.
 */
public class DependencyGraphBuilder {

    private final boolean pragmaBarrier;

    /**
     * Creates a builder that treats {@code PRAGMA} as a barrier.
     */
    public DependencyGraphBuilder() {
        this(true);
    }

    /**
     * @param pragmaBarrier Whether {@code PRAGMA} orders against every other instruction.
     */
    public DependencyGraphBuilder(boolean pragmaBarrier) {
        this.pragmaBarrier = pragmaBarrier;
    }

    private static final class ResourceState {
        int lastWriter = -1;
        final IntArrayList readers = new IntArrayList();
    }

    /**
     * Builds the graph of a block.
     * @param block The block.
     * @return A freshly built graph whose nodes are the block's instruction indices.
     * @throws IllegalStateException if an edge would point backwards, which indicates a defect in the access rules.
     */
    public DependencyGraph build(BasicBlock block) {
        List<Instruction> instructions = block.instructions();
        int n = instructions.size();
        ResourceAccessAnalyzer analyzer = new ResourceAccessAnalyzer(block.memoryLayout(), pragmaBarrier);
        Map<Resource, ResourceState> states = new HashMap<>();
        IntSet[] successors = new IntSet[n];
        IntSet[] predecessors = new IntSet[n];
        for (int i = 0; i < n; i++) {
            successors[i] = new IntOpenHashSet();
            predecessors[i] = new IntOpenHashSet();
        }

        for (int i = 0; i < n; i++) {
            ResourceAccess access = instructions.get(i).accept(analyzer);

            for (Resource resource : access.writes()) {
                ResourceState state = states.computeIfAbsent(resource, r -> new ResourceState());
                if (state.lastWriter >= 0) {
                    addEdge(successors, predecessors, state.lastWriter, i);
                }
                for (int r = 0; r < state.readers.size(); r++) {
                    addEdge(successors, predecessors, state.readers.getInt(r), i);
                }
                state.readers.clear();
                state.lastWriter = i;
            }
            for (Resource resource : access.reads()) {
                if (access.writes().contains(resource)) {
                    continue;
                }
                ResourceState state = states.computeIfAbsent(resource, r -> new ResourceState());
                if (state.lastWriter >= 0) {
                    addEdge(successors, predecessors, state.lastWriter, i);
                }
                state.readers.add(i);
            }
        }

        int[] successorOffsets = new int[n + 1];
        int[] predecessorOffsets = new int[n + 1];
        int[] successorTargets = flatten(successors, successorOffsets);
        int[] predecessorTargets = flatten(predecessors, predecessorOffsets);
        DependencyGraph graph = new DependencyGraph(instructions,
                successorOffsets, successorTargets, predecessorOffsets, predecessorTargets);
        CompilerLogger.trace("Built dependency graph for block " + block.index() + ": " + graph);
        return graph;
    }

    private static void addEdge(IntSet[] successors, IntSet[] predecessors, int from, int to) {
        if (from < 0 || from >= to) {
            throw new IllegalStateException("Invalid dependency edge " + from + " -> " + to);
        }
        successors[from].add(to);
        predecessors[to].add(from);
    }

    private static int[] flatten(IntSet[] adjacency, int[] offsets) {
        int total = 0;
        for (int i = 0; i < adjacency.length; i++) {
            offsets[i] = total;
            total += adjacency[i].size();
        }
        offsets[adjacency.length] = total;

        int[] targets = new int[total];
        for (int i = 0; i < adjacency.length; i++) {
            int[] sorted = adjacency[i].toIntArray();
            Arrays.sort(sorted);
            System.arraycopy(sorted, 0, targets, offsets[i], sorted.length);
        }
        return targets;
    }
}
