package org.quilkit.compiler.ir.instruction;

/**
 * Classical arithmetic operations.
 */
public enum ArithmeticOperator {
    ADD, SUB, MUL, DIV
}
