package org.quilkit.compiler.backend.emit;

import org.quilkit.compiler.frontend.lexer.Lexer;
import org.quilkit.compiler.frontend.parser.Parser;
import org.quilkit.compiler.ir.Program;
import org.quilkit.compiler.ir.instruction.Move;
import org.quilkit.compiler.ir.instruction.Pragma;
import org.quilkit.compiler.ir.operand.ClassicalOperand;
import org.quilkit.compiler.ir.operand.MemoryReference;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link QuilSerializer}.
 * Serialized text must parse back to an equal program and serializing twice must be stable.
 */
public class QuilSerializerTest {

    private static Program parse(String source) throws Exception {
        return new Parser(new Lexer(source).scanTokens()).parse();
    }

    private static String fixture(String name) throws Exception {
        return Files.readString(Path.of(QuilSerializerTest.class.getResource("/programs/" + name).toURI()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"bell.quil", "control_flow.quil", "parametric.quil", "pulses.quil"})
    @Tag("unit")
    void testFixturesRoundTrip(String name) throws Exception {
        // Arrange
        Program original = parse(fixture(name));
        QuilSerializer serializer = new QuilSerializer();

        // Act
        String text = serializer.serialize(original);
        Program reparsed = parse(text);

        // Assert
        assertThat(reparsed.items()).isEqualTo(original.items());
        assertThat(serializer.serialize(reparsed)).isEqualTo(text);
    }

    @ParameterizedTest
    @ValueSource(strings = {"DELAY 0 (%t + 1)", "DELAY 0 (1 - 2)", "DELAY 0 1 (2*%t)", "DELAY 0 -1.5", "DELAY 0 %t",
            "DELAY 0 \"xy\" %t + 1"})
    @Tag("unit")
    void testDelayDurationStaysApartFromQubits(String source) throws Exception {
        // Arrange
        Program original = parse(source);
        QuilSerializer serializer = new QuilSerializer();

        // Act
        String text = serializer.serialize(original);
        Program reparsed = parse(text);

        // Assert
        assertThat(reparsed.items()).isEqualTo(original.items());
        assertThat(serializer.serialize(reparsed)).isEqualTo(text);
    }

    @Test
    @Tag("unit")
    void testDelayDurationLayout() throws Exception {
        // Act
        String text = new QuilSerializer().serialize(parse(String.join("\n",
                "DELAY 0 (%t + 1)",
                "DELAY 0 1.0",
                "DELAY 0 \"xy\" %t + 1")));

        // Assert
        assertThat(text).isEqualTo(String.join("\n",
                "DELAY 0 (%t + 1)",
                "DELAY 0 1",
                "DELAY 0 \"xy\" %t + 1",
                ""));
    }

    @Test
    @Tag("unit")
    void testSimpleInstructions() throws Exception {
        // Act
        String text = new QuilSerializer().serialize(parse(String.join("\n",
                "DECLARE ro BIT[2]",
                "MEASURE 0 ro",
                "DAGGER RX(pi / 2) q",
                "JUMP-WHEN @top ro[1]",
                "RESET")));

        // Assert
        assertThat(text).isEqualTo(String.join("\n",
                "DECLARE ro BIT[2]",
                "MEASURE 0 ro[0]",
                "DAGGER RX(pi/2) q",
                "JUMP-WHEN @top ro[1]",
                "RESET",
                ""));
    }

    @Test
    @Tag("unit")
    void testRealLiteralsKeepTheirFraction() {
        // Act
        String text = QuilSerializer.serializeInstruction(
                new Move(new MemoryReference("theta", 0), new ClassicalOperand.RealLiteral(1.0)));

        // Assert
        assertThat(text).isEqualTo("MOVE theta[0] 1.0");
    }

    @Test
    @Tag("unit")
    void testCircuitBodyUsesConfiguredIndent() throws Exception {
        // Arrange
        Program program = parse("DEFCIRCUIT BELL a b:\n    H a\n    CNOT a b\nBELL 0 1");

        // Act
        String spaces = new QuilSerializer().serialize(program);
        String tabs = new QuilSerializer("\t").serialize(program);

        // Assert
        assertThat(spaces).isEqualTo("DEFCIRCUIT BELL a b:\n    H a\n    CNOT a b\nBELL 0 1\n");
        assertThat(tabs).isEqualTo("DEFCIRCUIT BELL a b:\n\tH a\n\tCNOT a b\nBELL 0 1\n");
    }

    @Test
    @Tag("unit")
    void testDefinitionLayouts() throws Exception {
        // Arrange
        Program program = parse(String.join("\n",
                "DEFGATE SWAPISH AS PERMUTATION:",
                "    0, 2, 1, 3",
                "DEFGATE RZZ(%t) a b AS PAULI-SUM:",
                "    ZZ(%t/2) a b",
                "DEFFRAME 0 \"rf\"",
                "DEFWAVEFORM wf:",
                "    0.5,",
                "    -0.5"));

        // Act
        String text = new QuilSerializer().serialize(program);

        // Assert
        assertThat(text).isEqualTo(String.join("\n",
                "DEFGATE SWAPISH AS PERMUTATION:",
                "    0, 2, 1, 3",
                "DEFGATE RZZ(%t) a b AS PAULI-SUM:",
                "    ZZ(%t/2) a b",
                "DEFFRAME 0 \"rf\"",
                "DEFWAVEFORM wf:",
                "    0.5, -0.5",
                ""));
    }

    @Test
    @Tag("unit")
    void testPragmaDataIsEscaped() {
        // Act
        String text = QuilSerializer.serializeInstruction(
                new Pragma("NOTE", List.of("0"), "say \"hi\" \\ bye"));

        // Assert
        assertThat(text).isEqualTo("PRAGMA NOTE 0 \"say \\\"hi\\\" \\\\ bye\"");
    }

    @Test
    @Tag("unit")
    void testEscapedPragmaParsesBack() throws Exception {
        // Arrange
        Pragma pragma = new Pragma("NOTE", List.of(), "a \"quoted\" word");

        // Act
        Program program = parse(QuilSerializer.serializeInstruction(pragma));

        // Assert
        assertThat(program.items()).containsExactly(pragma);
    }

    @Test
    @Tag("unit")
    void testIndentMustBeWhitespace() {
        assertThatThrownBy(() -> new QuilSerializer("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QuilSerializer("--")).isInstanceOf(IllegalArgumentException.class);
    }
}
