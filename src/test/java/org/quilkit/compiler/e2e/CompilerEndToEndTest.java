package org.quilkit.compiler.e2e;

import org.quilkit.compiler.Compiler;
import org.quilkit.compiler.analysis.DependencyGraph;
import org.quilkit.compiler.api.ICompiler;
import org.quilkit.compiler.api.LexException;
import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.ir.BasicBlock;
import org.quilkit.compiler.ir.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs complete programs through the whole pipeline: parsing from a file, validation,
 * basic blocks, dependency graphs and serialization.
 */
public class CompilerEndToEndTest {

    private ICompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new Compiler();
        compiler.setVerbosity(1);
    }

    private static Path fixture(String name) throws Exception {
        return Path.of(CompilerEndToEndTest.class.getResource("/programs/" + name).toURI());
    }

    @ParameterizedTest
    @ValueSource(strings = {"bell.quil", "control_flow.quil", "parametric.quil", "pulses.quil"})
    @Tag("integration")
    void testFixturesCompileCleanly(String name) throws Exception {
        // Act
        Program program = compiler.parse(fixture(name));

        // Assert
        assertThat(program.validate()).isEmpty();
        for (BasicBlock block : program.basicBlocks()) {
            DependencyGraph graph = block.dependencyGraph();
            assertThat(graph.nodeCount()).isEqualTo(block.size());
            assertThat(graph.respects(graph.topologicalOrder())).isTrue();
        }
        assertThat(compiler.parse(program.toQuil()).items()).isEqualTo(program.items());
    }

    @Test
    @Tag("integration")
    void testBellPairGraph() throws Exception {
        // Arrange
        Program program = compiler.parse(fixture("bell.quil"));

        // Act
        List<BasicBlock> blocks = program.basicBlocks();
        DependencyGraph graph = blocks.get(0).dependencyGraph();

        // Assert
        assertThat(blocks).hasSize(1);
        assertThat(graph.edges()).containsExactly(
                new DependencyGraph.Edge(0, 1),
                new DependencyGraph.Edge(1, 2),
                new DependencyGraph.Edge(1, 3));
        assertThat(graph.nodeLabel(3)).isEqualTo("MEASURE 1 ro[1]");
    }

    @Test
    @Tag("integration")
    void testSourceLocationsCarryFileName() throws Exception {
        // Arrange
        Path path = fixture("bell.quil");

        // Act
        Program program = compiler.parse(path);
        SourceInfo location = program.sourceOf(program.items().get(1));

        // Assert
        assertThat(location.fileName()).endsWith("bell.quil");
        assertThat(location.lineNumber()).isEqualTo(4);
        assertThat(location.columnNumber()).isEqualTo(1);
    }

    @Test
    @Tag("integration")
    void testValidationFindsProblemsAcrossScopes() throws Exception {
        // Arrange
        String source = String.join("\n",
                "DEFCIRCUIT LOOP q:",
                "    LABEL @again",
                "    X q",
                "    JUMP-WHEN @again flag",
                "LOOP 0 1",
                "LABEL @again");

        // Act
        Program program = compiler.parse(source, "loop.quil");

        // Assert
        assertThat(program.validate()).extracting(error -> error.toString()).containsExactly(
                "[UNDECLARED_MEMORY_REFERENCE] loop.quil:4:5: Memory region 'flag' is not declared.",
                "[ARITY_MISMATCH] loop.quil:5:1: Gate 'LOOP' expects 1 qubit(s) but got 2.");
    }

    @Test
    @Tag("integration")
    void testLexicalErrorsPropagate() {
        // Act & Assert
        assertThatThrownBy(() -> compiler.parse("H 0\nX $1", "bad.quil"))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("bad.quil:2:3");
    }

    @Test
    @Tag("integration")
    void testParseErrorsPropagate() {
        // Act & Assert
        assertThatThrownBy(() -> compiler.parse("DECLARE ro BIT[0]", "bad.quil"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("positive vector length");
    }
}
