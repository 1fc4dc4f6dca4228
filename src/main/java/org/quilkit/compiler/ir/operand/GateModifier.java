package org.quilkit.compiler.ir.operand;

/**
 * Modifiers that derive a new gate from a named one.
 */
public enum GateModifier {
    /** Adds one control qubit in front of the target qubits. */
    CONTROLLED,
    /** Takes the conjugate transpose. */
    DAGGER,
    /** Adds one qubit and doubles the parameter list. */
    FORKED
}
