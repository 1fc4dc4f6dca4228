package org.quilkit.compiler.ir.operand;

import java.util.List;
import java.util.Objects;

/**
 * Declares that a region aliases storage of another region.
 *
 * @param parent The aliased region.
 * @param offsets The offset clauses, possibly empty.
 */
public record Sharing(String parent, List<Offset> offsets) {

    public Sharing {
        Objects.requireNonNull(parent, "parent");
        offsets = List.copyOf(offsets);
    }

    public Sharing(String parent) {
        this(parent, List.of());
    }
}
