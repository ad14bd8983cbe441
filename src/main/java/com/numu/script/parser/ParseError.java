package com.numu.script.parser;

import com.numu.script.ScriptError;

public class ParseError extends ScriptError {
    public ParseError(String message, int line, int column) {
        super(Stage.PARSE, message, line, column);
    }
}
