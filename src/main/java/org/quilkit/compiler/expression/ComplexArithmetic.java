package org.quilkit.compiler.expression;

import org.apache.commons.math3.complex.Complex;

/**
 * Complex arithmetic shared by simplification and evaluation.
 * Real operands stay on the real line where the real result is defined.
 */
final class ComplexArithmetic {

    private ComplexArithmetic() {
    }

    /**
     * @return {@code false} for a division by zero or zero raised to a negative power.
     */
    static boolean isDefined(InfixOperator operator, Complex left, Complex right) {
        if (operator == InfixOperator.SLASH) {
            return !isZero(right);
        }
        if (operator == InfixOperator.CARET) {
            return !(isZero(left) && right.getReal() < 0);
        }
        return true;
    }

    static Complex apply(InfixOperator operator, Complex left, Complex right) {
        switch (operator) {
            case PLUS: return left.add(right);
            case MINUS: return left.subtract(right);
            case STAR: return multiply(left, right);
            case SLASH: return divide(left, right);
            case CARET: return power(left, right);
            default: throw new IllegalArgumentException("Unknown operator: " + operator);
        }
    }

    static Complex apply(ExpressionFunction function, Complex argument) {
        switch (function) {
            case SIN: return isReal(argument) ? new Complex(Math.sin(argument.getReal())) : argument.sin();
            case COS: return isReal(argument) ? new Complex(Math.cos(argument.getReal())) : argument.cos();
            case EXP: return isReal(argument) ? new Complex(Math.exp(argument.getReal())) : argument.exp();
            case SQRT:
                if (isReal(argument) && argument.getReal() >= 0) {
                    return new Complex(Math.sqrt(argument.getReal()));
                }
                return argument.sqrt();
            case CIS: return Complex.I.multiply(argument).exp();
            default: throw new IllegalArgumentException("Unknown function: " + function);
        }
    }

    static Complex negate(Complex value) {
        // Subtracting from 0.0 never yields -0.0, which would flip the branch of sqrt.
        return new Complex(0.0 - value.getReal(), 0.0 - value.getImaginary());
    }

    static boolean isZero(Complex value) {
        return value.getReal() == 0 && value.getImaginary() == 0;
    }

    static boolean isOne(Complex value) {
        return value.getReal() == 1 && value.getImaginary() == 0;
    }

    static boolean isReal(Complex value) {
        return value.getImaginary() == 0;
    }

    private static Complex multiply(Complex left, Complex right) {
        if (isReal(left) && isReal(right)) {
            return new Complex(left.getReal() * right.getReal());
        }
        return left.multiply(right);
    }

    private static Complex divide(Complex left, Complex right) {
        if (isReal(left) && isReal(right)) {
            return new Complex(left.getReal() / right.getReal());
        }
        return left.divide(right);
    }

    private static Complex power(Complex base, Complex exponent) {
        if (isReal(base) && isReal(exponent)) {
            double b = base.getReal();
            double e = exponent.getReal();
            if (b >= 0 || e == Math.rint(e)) {
                return new Complex(Math.pow(b, e));
            }
        }
        if (isZero(exponent)) {
            return Complex.ONE;
        }
        if (isZero(base)) {
            return Complex.ZERO;
        }
        return base.pow(exponent);
    }
}
