package org.quilkit.compiler.ir.operand;

/**
 * Element types of classical memory.
 */
public enum ScalarType {
    BIT(1),
    OCTET(8),
    INTEGER(64),
    REAL(64);

    private final int bits;

    ScalarType(int bits) {
        this.bits = bits;
    }

    /**
     * @return The storage width of one element in bits.
     */
    public int bits() {
        return bits;
    }
}
