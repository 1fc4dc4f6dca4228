package org.quilkit.compiler.analysis;

import org.quilkit.compiler.frontend.lexer.Lexer;
import org.quilkit.compiler.frontend.parser.Parser;
import org.quilkit.compiler.ir.BasicBlock;
import org.quilkit.compiler.ir.MemoryLayout;
import org.quilkit.compiler.ir.Program;
import org.quilkit.compiler.ir.instruction.GateApplication;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.operand.Qubit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link DependencyGraphBuilder}.
 * Blocks are parsed from source and the resulting edges are compared exactly.
 */
public class DependencyGraphBuilderTest {

    private static BasicBlock block(String... lines) throws Exception {
        Program program = new Parser(new Lexer(String.join("\n", lines)).scanTokens()).parse();
        List<BasicBlock> blocks = program.basicBlocks();
        assertThat(blocks).hasSize(1);
        return blocks.get(0);
    }

    private static DependencyGraph graph(String... lines) throws Exception {
        return new DependencyGraphBuilder().build(block(lines));
    }

    private static boolean reachable(DependencyGraph graph, int from, int to) {
        Deque<Integer> pending = new ArrayDeque<>();
        boolean[] seen = new boolean[graph.nodeCount()];
        pending.push(from);
        while (!pending.isEmpty()) {
            int node = pending.pop();
            if (node == to) {
                return true;
            }
            for (int next : graph.successors(node)) {
                if (!seen[next]) {
                    seen[next] = true;
                    pending.push(next);
                }
            }
        }
        return false;
    }

    @Test
    @Tag("unit")
    void testSharedQubitsChainInstructions() throws Exception {
        // Act
        DependencyGraph graph = graph(
                "DECLARE ro BIT[2]",
                "H 0",
                "CNOT 0 1",
                "MEASURE 1 ro[1]");

        // Assert
        assertThat(graph.nodeCount()).isEqualTo(3);
        assertThat(graph.edges()).containsExactly(new DependencyGraph.Edge(0, 1), new DependencyGraph.Edge(1, 2));
        assertThat(graph.hasEdge(0, 2)).isFalse();
        assertThat(graph.predecessors(2)).containsExactly(1);
    }

    @Test
    @Tag("unit")
    void testIndependentMeasurementsHaveNoEdge() throws Exception {
        // Act
        DependencyGraph graph = graph(
                "DECLARE ro BIT[2]",
                "MEASURE 0 ro[0]",
                "MEASURE 1 ro[1]");

        // Assert
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    @Tag("unit")
    void testSameMeasurementTargetOrdersWrites() throws Exception {
        // Act
        DependencyGraph graph = graph(
                "DECLARE ro BIT",
                "MEASURE 0 ro",
                "MEASURE 1 ro");

        // Assert
        assertThat(graph.edges()).containsExactly(new DependencyGraph.Edge(0, 1));
    }

    @Test
    @Tag("unit")
    void testPragmaIsABarrierWhenConfigured() throws Exception {
        // Arrange
        BasicBlock block = block("H 0", "PRAGMA PRESERVE_BLOCK", "H 1");

        // Act
        DependencyGraph withBarrier = new DependencyGraphBuilder(true).build(block);
        DependencyGraph withoutBarrier = new DependencyGraphBuilder(false).build(block);

        // Assert
        assertThat(withBarrier.edges()).containsExactly(new DependencyGraph.Edge(0, 1), new DependencyGraph.Edge(1, 2));
        assertThat(withoutBarrier.edgeCount()).isZero();
    }

    @Test
    @Tag("unit")
    void testLabelAndHaltFenceTheBlock() throws Exception {
        // Act
        DependencyGraph graph = graph("LABEL @a", "H 0", "H 1", "HALT");

        // Assert
        assertThat(graph.edges()).containsExactly(
                new DependencyGraph.Edge(0, 1),
                new DependencyGraph.Edge(0, 2),
                new DependencyGraph.Edge(0, 3),
                new DependencyGraph.Edge(1, 3),
                new DependencyGraph.Edge(2, 3));
    }

    @Test
    @Tag("unit")
    void testConcurrentReadsAreUnorderedButPrecedeTheNextWrite() throws Exception {
        // Act
        DependencyGraph graph = graph(
                "DECLARE x REAL",
                "DECLARE y REAL[2]",
                "MOVE y[0] x",
                "MOVE y[1] x",
                "MOVE x 1.0");

        // Assert
        assertThat(graph.edges()).containsExactly(new DependencyGraph.Edge(0, 2), new DependencyGraph.Edge(1, 2));
    }

    @Test
    @Tag("unit")
    void testSharingAliasesConflict() throws Exception {
        // Act
        DependencyGraph aliased = graph(
                "DECLARE a REAL[2]",
                "DECLARE b REAL[2] SHARING a",
                "MOVE a[0] 1.0",
                "MOVE b[1] 2.0");
        DependencyGraph separate = graph(
                "DECLARE a REAL[2]",
                "DECLARE b REAL[2]",
                "MOVE a[0] 1.0",
                "MOVE b[1] 2.0");

        // Assert
        assertThat(aliased.edges()).containsExactly(new DependencyGraph.Edge(0, 1));
        assertThat(separate.edgeCount()).isZero();
    }

    @Test
    @Tag("unit")
    void testComputedAddressReadsWholeRegion() throws Exception {
        // Act
        DependencyGraph graph = graph(
                "DECLARE t REAL[2]",
                "MOVE t[1] 1.0",
                "RX(t[%k]) 0",
                "MOVE t[0] 2.0");

        // Assert
        assertThat(graph.edges()).containsExactly(new DependencyGraph.Edge(0, 1), new DependencyGraph.Edge(1, 2));
    }

    @Test
    @Tag("unit")
    void testNonBlockingPulsesShareTheirQubits() throws Exception {
        // Act
        DependencyGraph graph = graph(
                "PULSE 0 \"xy\" flat",
                "NONBLOCKING PULSE 0 \"ro_tx\" flat",
                "NONBLOCKING CAPTURE 0 \"ro_rx\" boxcar iq",
                "PULSE 0 \"xy\" flat");

        // Assert
        assertThat(graph.hasEdge(0, 1)).isTrue();
        assertThat(graph.hasEdge(0, 2)).isTrue();
        assertThat(graph.hasEdge(1, 2)).isFalse();
        assertThat(graph.hasEdge(1, 3)).isTrue();
        assertThat(graph.hasEdge(2, 3)).isTrue();
    }

    @Test
    @Tag("unit")
    void testSharingCycleIsOneRegion() throws Exception {
        // Act
        DependencyGraph graph = graph(
                "DECLARE a REAL SHARING b",
                "DECLARE b REAL SHARING a",
                "MOVE a 1.0",
                "MOVE b 2.0");

        // Assert
        assertThat(graph.edges()).containsExactly(new DependencyGraph.Edge(0, 1));
    }

    @Test
    @Tag("unit")
    void testFrameOperationsStayBetweenFences() throws Exception {
        // Act
        DependencyGraph graph = graph(
                "FENCE 0",
                "DELAY 0 \"xy\" 1.0",
                "SWAP-PHASES 0 \"a\" 0 \"b\"",
                "FENCE 0");

        // Assert
        assertThat(graph.hasEdge(0, 1)).isTrue();
        assertThat(graph.hasEdge(0, 2)).isTrue();
        assertThat(graph.hasEdge(1, 3)).isTrue();
        assertThat(graph.hasEdge(2, 3)).isTrue();
        assertThat(graph.hasEdge(1, 2)).isFalse();
    }

    @Test
    @Tag("unit")
    void testFrameDelayFollowsGateOnItsQubit() throws Exception {
        // Act
        DependencyGraph graph = graph(
                "X 0",
                "DELAY 0 \"xy\" 1.0",
                "SET-PHASE 0 \"xy\" 1.0");

        // Assert
        assertThat(graph.edges()).containsExactly(
                new DependencyGraph.Edge(0, 1), new DependencyGraph.Edge(0, 2), new DependencyGraph.Edge(1, 2));
    }

    @Test
    @Tag("unit")
    void testEveryConflictingPairIsOrdered() throws Exception {
        // Arrange
        BasicBlock block = block(
                "DECLARE ro BIT[2]",
                "DECLARE theta REAL[2]",
                "DECLARE alias REAL SHARING theta",
                "RX(theta[0]) 0",
                "MOVE alias 0.5",
                "H 1",
                "CNOT 1 2",
                "MEASURE 2 ro[1]",
                "DELAY 0 1e-6",
                "SET-PHASE 0 \"xy\" theta[1]",
                "PULSE 0 \"xy\" flat",
                "FENCE 1",
                "NOP",
                "RZ(theta[%k]) 1",
                "FENCE 0",
                "DELAY 0 \"xy\" 1.0",
                "SWAP-PHASES 0 \"a\" 0 \"b\"",
                "X 0",
                "RESET 2");
        ResourceAccessAnalyzer analyzer = new ResourceAccessAnalyzer(block.memoryLayout(), true);
        List<Instruction> instructions = block.instructions();

        // Act
        DependencyGraph graph = new DependencyGraphBuilder().build(block);

        // Assert
        for (int i = 0; i < instructions.size(); i++) {
            ResourceAccess first = instructions.get(i).accept(analyzer);
            for (int j = i + 1; j < instructions.size(); j++) {
                ResourceAccess second = instructions.get(j).accept(analyzer);
                if (first.conflictsWith(second)) {
                    assertThat(reachable(graph, i, j)).as("%d must precede %d", i, j).isTrue();
                }
            }
        }
        for (DependencyGraph.Edge edge : graph.edges()) {
            assertThat(edge.from()).isLessThan(edge.to());
        }
    }

    @Test
    @Tag("unit")
    void testTopologicalOrderAndRespects() throws Exception {
        // Arrange
        DependencyGraph graph = graph("H 0", "X 1", "CNOT 0 1");

        // Act
        int[] order = graph.topologicalOrder();

        // Assert
        assertThat(order).containsExactly(0, 1, 2);
        assertThat(graph.respects(order)).isTrue();
        assertThat(graph.respects(new int[]{1, 0, 2})).isTrue();
        assertThat(graph.respects(new int[]{2, 0, 1})).isFalse();
        assertThat(graph.respects(new int[]{0, 1})).isFalse();
        assertThat(graph.respects(new int[]{0, 0, 2})).isFalse();
    }

    @Test
    @Tag("unit")
    void testNodeLabelsAndBounds() throws Exception {
        // Arrange
        DependencyGraph graph = graph("H 0", "CNOT 0 1");

        // Act & Assert
        assertThat(graph.nodeLabel(1)).isEqualTo("CNOT 0 1");
        assertThat(graph.instruction(0)).isEqualTo(new GateApplication("H", List.of(), List.of(Qubit.of(0))));
        assertThatThrownBy(() -> graph.successors(2)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @Tag("unit")
    void testEmptyBlockHasNoNodes() {
        // Act
        DependencyGraph graph = new DependencyGraphBuilder().build(new BasicBlock(0, 0, List.of(), MemoryLayout.empty()));

        // Assert
        assertThat(graph.nodeCount()).isZero();
        assertThat(graph.topologicalOrder()).isEmpty();
    }
}
