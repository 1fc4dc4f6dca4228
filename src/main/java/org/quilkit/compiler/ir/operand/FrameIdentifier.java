package org.quilkit.compiler.ir.operand;

import java.util.List;
import java.util.Objects;

/**
 * A frame: a named control channel attached to one or more qubits.
 *
 * @param name The frame name, e.g. {@code "xy"}.
 * @param qubits The qubits the frame belongs to.
 */
public record FrameIdentifier(String name, List<Qubit> qubits) {

    public FrameIdentifier {
        Objects.requireNonNull(name, "name");
        qubits = List.copyOf(qubits);
    }
}
