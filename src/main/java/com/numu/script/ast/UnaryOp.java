package com.numu.script.ast;

import com.numu.script.InvariantViolation;

public enum UnaryOp {
    NEGATE, NOT,
    SIN, COS, TAN, ASIN, ACOS, ATAN,
    EXP, LOG, SQRT,
    TRANSPOSE, DETERMINANT, INVERSE;

    /** True for the scalar functions in the shared math table; NOT and the matrix ops are excluded. */
    public boolean isScalarMath() {
        switch (this) {
            case NOT:
            case TRANSPOSE:
            case DETERMINANT:
            case INVERSE:
                return false;
            default:
                return true;
        }
    }

    public boolean isMatrixOp() {
        return this == TRANSPOSE || this == DETERMINANT || this == INVERSE;
    }

    /** The shared scalar math table, without domain guards. */
    public double apply(double operand) {
        switch (this) {
            case NEGATE: return -operand;
            case SIN: return Math.sin(operand);
            case COS: return Math.cos(operand);
            case TAN: return Math.tan(operand);
            case ASIN: return Math.asin(operand);
            case ACOS: return Math.acos(operand);
            case ATAN: return Math.atan(operand);
            case EXP: return Math.exp(operand);
            case LOG: return Math.log(operand);
            case SQRT: return Math.sqrt(operand);
            default:
                throw new InvariantViolation("apply() called on non-scalar operator " + this);
        }
    }
}
