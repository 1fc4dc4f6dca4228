package org.quilkit.compiler.analysis;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The resources one instruction reads and writes. A resource in both sets counts as written.
 *
 * @param reads Resources read.
 * @param writes Resources written.
 */
public record ResourceAccess(Set<Resource> reads, Set<Resource> writes) {

    public ResourceAccess {
        reads = Set.copyOf(reads);
        writes = Set.copyOf(writes);
    }

    /**
     * @param resource A resource.
     * @return {@code true} if the instruction reads or writes it.
     */
    public boolean touches(Resource resource) {
        return reads.contains(resource) || writes.contains(resource);
    }

    /**
     * @param other The access set of another instruction.
     * @return {@code true} if the two instructions may not be swapped.
     */
    public boolean conflictsWith(ResourceAccess other) {
        for (Resource resource : writes) {
            if (other.touches(resource)) {
                return true;
            }
        }
        for (Resource resource : other.writes) {
            if (touches(resource)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collects reads and writes in insertion order.
     */
    static final class Builder {
        private final Set<Resource> reads = new LinkedHashSet<>();
        private final Set<Resource> writes = new LinkedHashSet<>();

        Builder read(Resource resource) {
            reads.add(resource);
            return this;
        }

        Builder write(Resource resource) {
            writes.add(resource);
            return this;
        }

        ResourceAccess build() {
            return new ResourceAccess(reads, writes);
        }
    }
}
