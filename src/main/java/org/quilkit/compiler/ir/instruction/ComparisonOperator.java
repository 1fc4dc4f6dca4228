package org.quilkit.compiler.ir.instruction;

public enum ComparisonOperator {
    EQ, GT, GE, LT, LE
}
