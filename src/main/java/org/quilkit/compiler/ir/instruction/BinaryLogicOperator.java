package org.quilkit.compiler.ir.instruction;

/**
 * Bitwise operations. IOR is inclusive or.
 */
public enum BinaryLogicOperator {
    AND, IOR, XOR
}
