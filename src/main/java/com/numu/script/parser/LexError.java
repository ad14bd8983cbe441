package com.numu.script.parser;

import com.numu.script.ScriptError;

public class LexError extends ScriptError {
    public LexError(String message, int line, int column) {
        super(Stage.LEX, message, line, column);
    }
}
