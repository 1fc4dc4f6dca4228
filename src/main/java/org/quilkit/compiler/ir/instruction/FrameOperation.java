package org.quilkit.compiler.ir.instruction;

/**
 * The frame mutations, with their source spelling.
 */
public enum FrameOperation {
    SET_FREQUENCY("SET-FREQUENCY"),
    SHIFT_FREQUENCY("SHIFT-FREQUENCY"),
    SET_PHASE("SET-PHASE"),
    SHIFT_PHASE("SHIFT-PHASE"),
    SET_SCALE("SET-SCALE");

    private final String text;

    FrameOperation(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
