package org.quilkit.compiler.analysis;

import org.quilkit.compiler.ir.operand.FrameIdentifier;
import org.quilkit.compiler.ir.operand.Qubit;

import java.util.Objects;

/**
 * Something an instruction reads or writes. Two instructions conflict when they touch the
 * same resource and at least one of them writes it.
 */
public sealed interface Resource permits Resource.QubitResource, Resource.MemorySlot, Resource.MemoryRegion,
        Resource.Frame, Resource.Barrier {

    /**
     * A single qubit, fixed or placeholder.
     * @param qubit The qubit.
     */
    record QubitResource(Qubit qubit) implements Resource {
        public QubitResource {
            Objects.requireNonNull(qubit, "qubit");
        }
    }

    /**
     * One element of a memory region that shares storage with no other region.
     * @param region The region name.
     * @param index The element index.
     */
    record MemorySlot(String region, long index) implements Resource {
        public MemorySlot {
            Objects.requireNonNull(region, "region");
        }
    }

    /**
     * All storage of a {@code SHARING} alias group, named by the group's root region.
     * @param root The root region name.
     */
    record MemoryRegion(String root) implements Resource {
        public MemoryRegion {
            Objects.requireNonNull(root, "root");
        }
    }

    /**
     * A frame on a specific set of qubits.
     * @param frame The frame.
     */
    record Frame(FrameIdentifier frame) implements Resource {
        public Frame {
            Objects.requireNonNull(frame, "frame");
        }
    }

    /**
     * The global ordering point. Every instruction reads it; control flow writes it.
     */
    record Barrier() implements Resource {
    }

    Barrier BARRIER = new Barrier();
}
