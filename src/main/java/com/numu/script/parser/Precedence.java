package com.numu.script.parser;

/** Binding power, lowest first. Declaration order is significant. */
public enum Precedence {
    NONE,
    ASSIGNMENT,  // =
    TERNARY,     // reserved
    OR,          // ||
    AND,         // &&
    EQUALITY,    // == !=
    COMPARISON,  // < <= > >=
    TERM,        // + -
    FACTOR,      // * / %
    UNARY,       // - !
    POWER,       // ^ **
    CALL,        // f(...)
    PRIMARY;

    public Precedence higher() {
        Precedence[] all = values();
        return this == PRIMARY ? PRIMARY : all[ordinal() + 1];
    }

    public boolean atLeast(Precedence other) {
        return compareTo(other) >= 0;
    }
}
