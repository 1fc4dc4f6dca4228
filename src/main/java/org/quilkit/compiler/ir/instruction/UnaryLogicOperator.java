package org.quilkit.compiler.ir.instruction;

public enum UnaryLogicOperator {
    NEG, NOT
}
