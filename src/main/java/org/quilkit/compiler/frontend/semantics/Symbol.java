package org.quilkit.compiler.frontend.semantics;

import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.ir.instruction.Instruction;

/**
 * Represents a single named entity (a label, a memory region or a definition)
 * in the symbol table.
 *
 * @param name The name as written, without '@' or '%'.
 * @param type The kind of entity.
 * @param instruction The instruction that introduced the name.
 * @param location Where it was introduced, or {@code null} for instructions built in code.
 */
public record Symbol(String name, Type type, Instruction instruction, SourceInfo location) {

    /**
     * The type of a symbol in the symbol table. Each type is its own namespace.
     */
    public enum Type {
        /** A label defined with LABEL. */
        LABEL,
        /** A memory region from DECLARE, or the memory parameter of a DEFCAL MEASURE. */
        MEMORY,
        /** A gate defined with DEFGATE. */
        GATE,
        /** A circuit defined with DEFCIRCUIT. */
        CIRCUIT,
        /** A waveform defined with DEFWAVEFORM. */
        WAVEFORM
    }
}
