package org.quilkit.compiler.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.quilkit.compiler.backend.emit.QuilSerializer;
import org.quilkit.compiler.ir.instruction.Instruction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The ordering constraints between the instructions of one basic block.
 * <p>
 * Node {@code i} is the {@code i}-th instruction of the block. An edge {@code a -> b}
 * means that {@code a} must execute before {@code b}; edges always point from a lower to a
 * higher index. Adjacency is stored in compressed sparse row form, successors and
 * predecessors each as an offset array plus a target array. Instances are immutable.
 */
public final class DependencyGraph implements GraphAccessor {

    /**
     * A single ordering constraint.
     * @param from The node that must come first.
     * @param to The node that must come later.
     */
    public record Edge(int from, int to) {
        @Override
        public String toString() {
            return from + " -> " + to;
        }
    }

    private final List<Instruction> instructions;
    private final int[] successorOffsets;
    private final int[] successorTargets;
    private final int[] predecessorOffsets;
    private final int[] predecessorTargets;

    DependencyGraph(List<Instruction> instructions,
                    int[] successorOffsets, int[] successorTargets,
                    int[] predecessorOffsets, int[] predecessorTargets) {
        this.instructions = List.copyOf(instructions);
        this.successorOffsets = successorOffsets;
        this.successorTargets = successorTargets;
        this.predecessorOffsets = predecessorOffsets;
        this.predecessorTargets = predecessorTargets;
    }

    @Override
    public int nodeCount() {
        return instructions.size();
    }

    public int edgeCount() {
        return successorTargets.length;
    }

    /**
     * @param node A node index.
     * @return The instruction behind the node.
     */
    public Instruction instruction(int node) {
        return instructions.get(node);
    }

    @Override
    public int[] successors(int node) {
        checkNode(node);
        return Arrays.copyOfRange(successorTargets, successorOffsets[node], successorOffsets[node + 1]);
    }

    @Override
    public int[] predecessors(int node) {
        checkNode(node);
        return Arrays.copyOfRange(predecessorTargets, predecessorOffsets[node], predecessorOffsets[node + 1]);
    }

    /**
     * @param from The source node.
     * @param to The target node.
     * @return {@code true} if there is a direct edge between the two nodes.
     */
    public boolean hasEdge(int from, int to) {
        checkNode(from);
        checkNode(to);
        return Arrays.binarySearch(successorTargets, successorOffsets[from], successorOffsets[from + 1], to) >= 0;
    }

    /**
     * @return All edges, ordered by source and then by target.
     */
    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>(successorTargets.length);
        for (int node = 0; node < nodeCount(); node++) {
            for (int i = successorOffsets[node]; i < successorOffsets[node + 1]; i++) {
                result.add(new Edge(node, successorTargets[i]));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Orders the nodes with Kahn's algorithm, always taking the lowest ready index first.
     * @return A topological order of all nodes.
     */
    public int[] topologicalOrder() {
        int n = nodeCount();
        int[] remaining = new int[n];
        IntArrayList ready = new IntArrayList();
        for (int node = 0; node < n; node++) {
            remaining[node] = predecessorOffsets[node + 1] - predecessorOffsets[node];
            if (remaining[node] == 0) {
                ready.add(node);
            }
        }

        int[] order = new int[n];
        int count = 0;
        int head = 0;
        while (head < ready.size()) {
            int node = ready.getInt(head++);
            order[count++] = node;
            for (int i = successorOffsets[node]; i < successorOffsets[node + 1]; i++) {
                int next = successorTargets[i];
                if (--remaining[next] == 0) {
                    ready.add(next);
                }
            }
        }
        if (count != n) {
            throw new IllegalStateException("Dependency graph contains a cycle");
        }
        return order;
    }

    /**
     * Checks whether an order of the nodes satisfies every edge.
     * @param order A permutation of the node indices.
     * @return {@code true} if every edge source comes before its target.
     */
    public boolean respects(int[] order) {
        if (order.length != nodeCount()) {
            return false;
        }
        int[] position = new int[order.length];
        Arrays.fill(position, -1);
        for (int i = 0; i < order.length; i++) {
            int node = order[i];
            if (node < 0 || node >= order.length || position[node] >= 0) {
                return false;
            }
            position[node] = i;
        }
        for (Edge edge : edges()) {
            if (position[edge.from()] > position[edge.to()]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String nodeLabel(int node) {
        checkNode(node);
        return QuilSerializer.serializeInstruction(instructions.get(node));
    }

    private void checkNode(int node) {
        if (node < 0 || node >= nodeCount()) {
            throw new IndexOutOfBoundsException("Node " + node + " out of range [0, " + nodeCount() + ")");
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph{" + nodeCount() + " nodes, " + edgeCount() + " edges}";
    }
}
