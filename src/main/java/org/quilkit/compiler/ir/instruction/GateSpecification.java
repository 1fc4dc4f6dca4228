package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.expression.Expression;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The body of a {@code DEFGATE}.
 */
public sealed interface GateSpecification permits GateSpecification.Matrix, GateSpecification.Permutation, GateSpecification.PauliSum {

    /**
     * @return The number of qubits the gate acts on, or empty if the body does not have a power-of-two size.
     */
    OptionalInt qubitCount();

    /**
     * A unitary given row by row.
     * @param rows The rows; each has as many entries as there are rows.
     */
    record Matrix(List<List<Expression>> rows) implements GateSpecification {
        public Matrix {
            rows = rows.stream().map(List::copyOf).toList();
        }

        @Override
        public OptionalInt qubitCount() {
            return log2(rows.size());
        }
    }

    /**
     * A permutation of the computational basis.
     * @param entries The image of each basis state.
     */
    record Permutation(List<Long> entries) implements GateSpecification {
        public Permutation {
            entries = List.copyOf(entries);
        }

        @Override
        public OptionalInt qubitCount() {
            return log2(entries.size());
        }
    }

    /**
     * A sum of Pauli terms over named qubit arguments.
     * @param arguments The qubit argument names.
     * @param terms The terms.
     */
    record PauliSum(List<String> arguments, List<PauliTerm> terms) implements GateSpecification {
        public PauliSum {
            arguments = List.copyOf(arguments);
            terms = List.copyOf(terms);
        }

        @Override
        public OptionalInt qubitCount() {
            return OptionalInt.of(arguments.size());
        }
    }

    /**
     * One term of a Pauli sum, e.g. {@code ZZ((-%theta)/4) p q}.
     * @param word The Pauli word over I, X, Y and Z.
     * @param coefficient The coefficient.
     * @param qubits The argument names the word acts on.
     */
    record PauliTerm(String word, Expression coefficient, List<String> qubits) {
        public PauliTerm {
            Objects.requireNonNull(word, "word");
            Objects.requireNonNull(coefficient, "coefficient");
            qubits = List.copyOf(qubits);
        }
    }

    private static OptionalInt log2(int size) {
        if (size < 2 || Integer.bitCount(size) != 1) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.numberOfTrailingZeros(size));
    }
}
