package com.numu.script;

/**
 * Base class for the three recoverable error kinds: lexing, parsing and evaluation.
 *
 * Lex and parse errors carry a 1-based source position; evaluation errors report 0/0.
 * Internal faults are never a ScriptError, see {@link InvariantViolation}.
 */
public abstract class ScriptError extends RuntimeException {

    public enum Stage {
        LEX,
        PARSE,
        EVALUATE
    }

    private final Stage stage;
    private final String reason;
    private final int line;
    private final int column;

    protected ScriptError(Stage stage, String reason, int line, int column) {
        super(line > 0 ? "[line " + line + ":" + column + "] " + reason : reason);
        this.stage = stage;
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public Stage stage() { return stage; }

    /** The message without the position prefix. */
    public String reason() { return reason; }

    public int line() { return line; }

    public int column() { return column; }
}
