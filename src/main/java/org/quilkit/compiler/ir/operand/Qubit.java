package org.quilkit.compiler.ir.operand;

import java.util.Objects;

/**
 * A qubit operand: either a fixed index or a named placeholder bound by an enclosing
 * {@code DEFCIRCUIT} or {@code DEFCAL}.
 */
public sealed interface Qubit permits Qubit.Fixed, Qubit.Variable {

    /**
     * A physical or logical qubit index.
     * @param index The non-negative index.
     */
    record Fixed(long index) implements Qubit {
        public Fixed {
            if (index < 0) {
                throw new IllegalArgumentException("Qubit index must be non-negative: " + index);
            }
        }

        @Override
        public String toString() {
            return Long.toString(index);
        }
    }

    /**
     * A named placeholder qubit.
     * @param name The placeholder name.
     */
    record Variable(String name) implements Qubit {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    static Qubit of(long index) {
        return new Fixed(index);
    }

    static Qubit named(String name) {
        return new Variable(name);
    }
}
