package com.numu.script.eval;

import com.numu.script.ScriptError;

public class EvaluationError extends ScriptError {
    public EvaluationError(String message) {
        super(Stage.EVALUATE, message, 0, 0);
    }
}
