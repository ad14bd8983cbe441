package com.numu.script.parser;

/**
 * How chains of binary operators group.
 *
 * CONVENTIONAL (default): + - * / % and the comparison/logical operators group left,
 *   ^ and ** group right. 10 - 4 - 3 is (10 - 4) - 3.
 * RIGHT_LEANING: every binary operator re-enters the expression parser at its own level,
 *   so all of them group right. 10 - 4 - 3 is 10 - (4 - 3). Kept for sources written against
 *   the older grouping.
 *
 * Assignment groups right in both modes.
 */
public enum Associativity {
    CONVENTIONAL,
    RIGHT_LEANING
}
