package org.quilkit.compiler.ir.operand;

import java.util.Objects;

/**
 * One {@code OFFSET count TYPE} clause of a sharing declaration.
 *
 * @param count The number of elements to skip.
 * @param type The type of the skipped elements.
 */
public record Offset(long count, ScalarType type) {

    public Offset {
        Objects.requireNonNull(type, "type");
    }

    @Override
    public String toString() {
        return "OFFSET " + count + " " + type;
    }
}
