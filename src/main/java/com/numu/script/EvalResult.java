package com.numu.script;

/** Outcome of {@link NumuScript#tryEvaluate(String)}: either a value or the error that stopped it. */
public class EvalResult {
    private final double value;
    private final ScriptError error;

    private EvalResult(double value, ScriptError error) {
        this.value = value;
        this.error = error;
    }

    public static EvalResult ok(double value) { return new EvalResult(value, null); }
    public static EvalResult failed(ScriptError error) { return new EvalResult(Double.NaN, error); }

    public boolean isOk() { return error == null; }

    public double value() {
        if (error != null) {
            throw new IllegalStateException("No value: evaluation failed with " + error.getMessage(), error);
        }
        return value;
    }

    /** Null on success. */
    public ScriptError error() { return error; }

    @Override
    public String toString() {
        return isOk() ? "ok(" + value + ")" : "failed(" + error.stage() + ": " + error.getMessage() + ")";
    }
}
