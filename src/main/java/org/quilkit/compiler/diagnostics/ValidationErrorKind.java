package org.quilkit.compiler.diagnostics;

/**
 * Defines unique, testable codes for every issue program validation can report.
 * This decouples the test logic from the wording of the messages.
 */
public enum ValidationErrorKind {
    // region Control flow
    /** The same label name is defined more than once in one scope. */
    DUPLICATE_LABEL,
    /** A jump names a label that is not defined in its scope. */
    UNRESOLVED_JUMP_TARGET,
    // endregion

    // region Memory
    /** A memory reference names a region that was never declared. */
    UNDECLARED_MEMORY_REFERENCE,
    /** A memory region is declared more than once. */
    DUPLICATE_DECLARATION,
    // endregion

    // region Gates and definitions
    /** A gate application's qubit or parameter count does not match its definition. */
    ARITY_MISMATCH,
    /** A gate, circuit or waveform name is defined more than once. */
    DUPLICATE_DEFINITION
    // endregion
}
