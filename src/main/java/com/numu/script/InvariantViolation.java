package com.numu.script;

/** Programming-error fault: arena ownership broken, a required child missing, an unreachable branch taken. */
public class InvariantViolation extends IllegalStateException {
    public InvariantViolation(String message) {
        super(message);
    }
}
