package org.quilkit.compiler.frontend.lexer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The reserved words of Quil. Matching is case-sensitive; every other word lexes as an identifier.
 */
public enum Keyword {
    DECLARE("DECLARE"),
    MEASURE("MEASURE"),
    RESET("RESET"),
    LABEL("LABEL"),
    JUMP("JUMP"),
    JUMP_WHEN("JUMP-WHEN"),
    JUMP_UNLESS("JUMP-UNLESS"),
    HALT("HALT"),
    WAIT("WAIT"),
    NOP("NOP"),
    PRAGMA("PRAGMA"),
    DEFGATE("DEFGATE"),
    DEFCIRCUIT("DEFCIRCUIT"),
    DEFCAL("DEFCAL"),
    DEFFRAME("DEFFRAME"),
    DEFWAVEFORM("DEFWAVEFORM"),
    NEG("NEG"),
    NOT("NOT"),
    AND("AND"),
    IOR("IOR"),
    XOR("XOR"),
    ADD("ADD"),
    SUB("SUB"),
    MUL("MUL"),
    DIV("DIV"),
    MOVE("MOVE"),
    EXCHANGE("EXCHANGE"),
    CONVERT("CONVERT"),
    LOAD("LOAD"),
    STORE("STORE"),
    EQ("EQ"),
    GT("GT"),
    GE("GE"),
    LT("LT"),
    LE("LE"),
    PULSE("PULSE"),
    CAPTURE("CAPTURE"),
    RAW_CAPTURE("RAW-CAPTURE"),
    NONBLOCKING("NONBLOCKING"),
    DELAY("DELAY"),
    FENCE("FENCE"),
    SET_FREQUENCY("SET-FREQUENCY"),
    SHIFT_FREQUENCY("SHIFT-FREQUENCY"),
    SET_PHASE("SET-PHASE"),
    SHIFT_PHASE("SHIFT-PHASE"),
    SET_SCALE("SET-SCALE"),
    SWAP_PHASES("SWAP-PHASES"),
    CONTROLLED("CONTROLLED"),
    DAGGER("DAGGER"),
    FORKED("FORKED");

    private static final Map<String, Keyword> BY_TEXT = new HashMap<>();

    static {
        for (Keyword keyword : values()) {
            BY_TEXT.put(keyword.text, keyword);
        }
    }

    private final String text;

    Keyword(String text) {
        this.text = text;
    }

    /**
     * @return The spelling of the keyword in source code.
     */
    public String text() {
        return text;
    }

    /**
     * @return {@code true} for the gate modifiers CONTROLLED, DAGGER and FORKED.
     */
    public boolean isModifier() {
        return this == CONTROLLED || this == DAGGER || this == FORKED;
    }

    /**
     * Looks up a keyword by its exact source spelling.
     * @param text The word as written.
     * @return The keyword, or empty if the word is not reserved.
     */
    public static Optional<Keyword> fromText(String text) {
        return Optional.ofNullable(BY_TEXT.get(text));
    }
}
