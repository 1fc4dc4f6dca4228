package org.quilkit.compiler.ir.operand;

import java.util.Objects;

/**
 * The shape of a memory region: element type and number of elements.
 *
 * @param type The element type.
 * @param length The number of elements, at least 1.
 */
public record Vector(ScalarType type, long length) {

    public Vector {
        Objects.requireNonNull(type, "type");
        if (length < 1) {
            throw new IllegalArgumentException("Vector length must be positive: " + length);
        }
    }

    @Override
    public String toString() {
        return type + "[" + length + "]";
    }
}
