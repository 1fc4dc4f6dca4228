package org.quilkit.compiler.ir.operand;

import java.util.Objects;

/**
 * One slot of a declared classical memory region. A bare region name in source means slot 0.
 *
 * @param name The region name.
 * @param index The slot index.
 */
public record MemoryReference(String name, long index) {

    public MemoryReference {
        Objects.requireNonNull(name, "name");
        if (index < 0) {
            throw new IllegalArgumentException("Memory index must be non-negative: " + index);
        }
    }

    public MemoryReference(String name) {
        this(name, 0);
    }

    @Override
    public String toString() {
        return name + "[" + index + "]";
    }
}
