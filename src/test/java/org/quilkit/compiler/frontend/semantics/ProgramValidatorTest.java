package org.quilkit.compiler.frontend.semantics;

import org.quilkit.compiler.diagnostics.ValidationError;
import org.quilkit.compiler.diagnostics.ValidationErrorKind;
import org.quilkit.compiler.frontend.lexer.Lexer;
import org.quilkit.compiler.frontend.parser.Parser;
import org.quilkit.compiler.ir.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link ProgramValidator}.
 * Each test parses a small program and checks the exact set of reported problems.
 */
public class ProgramValidatorTest {

    private static Program parse(String... lines) throws Exception {
        return new Parser(new Lexer(String.join("\n", lines), "test.quil").scanTokens(), "test.quil").parse();
    }

    private static List<ValidationError> validate(String... lines) throws Exception {
        return new ProgramValidator().validate(parse(lines));
    }

    @Test
    @Tag("unit")
    void testValidProgramHasNoErrors() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "DECLARE ro BIT[2]",
                "LABEL @start",
                "H 0",
                "MEASURE 0 ro[1]",
                "JUMP-UNLESS @start ro[1]");

        // Assert
        assertThat(errors).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDuplicateLabelIsReportedOnceWithAllLocations() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "LABEL @a",
                "X 0",
                "LABEL @a",
                "JUMP @a");

        // Assert
        assertThat(errors).hasSize(1);
        ValidationError error = errors.get(0);
        assertThat(error.kind()).isEqualTo(ValidationErrorKind.DUPLICATE_LABEL);
        assertThat(error.message()).isEqualTo("Label '@a' is defined 2 times.");
        assertThat(error.locations()).extracting(location -> location.lineNumber()).containsExactly(1, 3);
    }

    @Test
    @Tag("unit")
    void testUnresolvedJumpTarget() throws Exception {
        // Act
        List<ValidationError> errors = validate("DECLARE c BIT", "JUMP-WHEN @missing c");

        // Assert
        assertThat(errors).extracting(ValidationError::kind).containsExactly(ValidationErrorKind.UNRESOLVED_JUMP_TARGET);
        assertThat(errors.get(0).message()).isEqualTo("Jump target '@missing' is not a label of this scope.");
        assertThat(errors.get(0).locations().get(0).lineNumber()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testUndeclaredMemoryInOperandsAndExpressions() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "MEASURE 0 ro[0]",
                "RX(2*theta[0]) 0");

        // Assert
        assertThat(errors).extracting(ValidationError::message).containsExactly(
                "Memory region 'ro' is not declared.",
                "Memory region 'theta' is not declared.");
        assertThat(errors).extracting(ValidationError::kind)
                .containsOnly(ValidationErrorKind.UNDECLARED_MEMORY_REFERENCE);
    }

    @Test
    @Tag("unit")
    void testSharingParentMustBeDeclared() throws Exception {
        // Act
        List<ValidationError> errors = validate("DECLARE alias REAL SHARING base");

        // Assert
        assertThat(errors).extracting(ValidationError::message).containsExactly("Memory region 'base' is not declared.");
    }

    @Test
    @Tag("unit")
    void testMeasureCalibrationParameterIsMemoryInItsBody() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "DEFCAL MEASURE 0 addr:",
                "    CAPTURE 0 \"ro_rx\" boxcar(duration: 1e-6) addr",
                "CAPTURE 0 \"ro_rx\" boxcar(duration: 1e-6) addr");

        // Assert
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).locations().get(0).lineNumber()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testArityAccountsForControlledAndForked() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "DEFGATE P(%a):",
                "    1, 0",
                "    0, cis(%a)",
                "CONTROLLED P(0.1) 0 1",
                "FORKED P(0.1, 0.2) 0 1",
                "P(0.1) 0 1",
                "FORKED P(0.1) 0 1",
                "UNKNOWN(1, 2, 3) 0");

        // Assert
        assertThat(errors).extracting(ValidationError::message).containsExactly(
                "Gate 'P' expects 1 qubit(s) but got 2.",
                "Gate 'P' expects 2 parameter(s) but got 1.");
        assertThat(errors).extracting(error -> error.locations().get(0).lineNumber()).containsExactly(6, 7);
    }

    @Test
    @Tag("unit")
    void testCircuitArity() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "DEFCIRCUIT BELL(%phase) a b:",
                "    H a",
                "    CNOT a b",
                "BELL(0) 0 1",
                "BELL 0");

        // Assert
        assertThat(errors).extracting(ValidationError::message).containsExactly(
                "Gate 'BELL' expects 2 qubit(s) but got 1.",
                "Gate 'BELL' expects 1 parameter(s) but got 0.");
    }

    @Test
    @Tag("unit")
    void testLabelsAreLocalToTheirScope() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "DEFCIRCUIT LOOP:",
                "    LABEL @inner",
                "    JUMP @inner",
                "    JUMP @outer",
                "LABEL @outer",
                "JUMP @inner");

        // Assert
        assertThat(errors).extracting(ValidationError::message).containsExactly(
                "Jump target '@outer' is not a label of this scope.",
                "Jump target '@inner' is not a label of this scope.");
        assertThat(errors).extracting(error -> error.locations().get(0).lineNumber()).containsExactly(4, 6);
    }

    @Test
    @Tag("unit")
    void testCircuitBodiesSeeTopLevelDeclarations() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "DECLARE theta REAL",
                "DEFCIRCUIT ROT q:",
                "    RX(theta) q");

        // Assert
        assertThat(errors).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDuplicatesComeBeforeOtherErrors() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "JUMP @nowhere",
                "DECLARE ro BIT",
                "DECLARE ro REAL",
                "DEFGATE G:",
                "    1, 0",
                "    0, 1",
                "DEFGATE G AS PERMUTATION:",
                "    1, 0",
                "DEFWAVEFORM w:",
                "    1",
                "DEFWAVEFORM w:",
                "    2");

        // Assert
        assertThat(errors).extracting(ValidationError::kind).containsExactly(
                ValidationErrorKind.DUPLICATE_DECLARATION,
                ValidationErrorKind.DUPLICATE_DEFINITION,
                ValidationErrorKind.DUPLICATE_DEFINITION,
                ValidationErrorKind.UNRESOLVED_JUMP_TARGET);
        assertThat(errors).extracting(ValidationError::message).containsExactly(
                "Memory region 'ro' is declared 2 times.",
                "Gate 'G' is defined 2 times.",
                "Waveform 'w' is defined 2 times.",
                "Jump target '@nowhere' is not a label of this scope.");
    }

    @Test
    @Tag("unit")
    void testGatesAndCircuitsHaveSeparateNamespaces() throws Exception {
        // Act
        List<ValidationError> errors = validate(
                "DEFGATE X2:",
                "    0, 1",
                "    1, 0",
                "DEFCIRCUIT X2 a b:",
                "    X a",
                "X2 0");

        // Assert
        assertThat(errors).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDisabledChecksAreNotReported() throws Exception {
        // Arrange
        Program program = parse("LABEL @a", "LABEL @a", "MEASURE 0 ro");
        ProgramValidator validator = new ProgramValidator(EnumSet.of(ValidationErrorKind.UNDECLARED_MEMORY_REFERENCE));

        // Act
        List<ValidationError> errors = validator.validate(program);

        // Assert
        assertThat(errors).extracting(ValidationError::kind).containsExactly(ValidationErrorKind.UNDECLARED_MEMORY_REFERENCE);
    }

    @Test
    @Tag("unit")
    void testValidationDoesNotModifyProgram() throws Exception {
        // Arrange
        Program program = parse("LABEL @a", "LABEL @a");
        int before = program.items().size();

        // Act
        List<ValidationError> first = program.validate();
        List<ValidationError> second = program.validate();

        // Assert
        assertThat(program.items()).hasSize(before);
        assertThat(second).isEqualTo(first);
    }
}
