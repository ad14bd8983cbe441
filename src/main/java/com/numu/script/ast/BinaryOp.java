package com.numu.script.ast;

import com.numu.script.InvariantViolation;

public enum BinaryOp {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"), POW("^"),
    EQ("=="), NEQ("!="), LT("<"), LEQ("<="), GT(">"), GEQ(">="),
    AND("&&"), OR("||");

    public final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    /** Operators with a numeric meaning; the comparison and logical ones have none yet. */
    public boolean isArithmetic() {
        switch (this) {
            case ADD: case SUB: case MUL: case DIV: case MOD: case POW:
                return true;
            default:
                return false;
        }
    }

    /**
     * Raw IEEE-754 arithmetic. No zero checks: callers that need them (the evaluator) guard first.
     * MOD uses Java's %, which has fmod semantics.
     */
    public double apply(double left, double right) {
        switch (this) {
            case ADD: return left + right;
            case SUB: return left - right;
            case MUL: return left * right;
            case DIV: return left / right;
            case MOD: return left % right;
            case POW: return Math.pow(left, right);
            default:
                throw new InvariantViolation("apply() called on non-arithmetic operator " + this);
        }
    }
}
