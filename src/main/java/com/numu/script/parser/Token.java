package com.numu.script.parser;

/**
 * A lexed token. The text is a span over the lexer's source and is only materialised by {@link #text()}.
 */
public final class Token {
    public final TokenType type;
    private final String source;
    public final int offset;
    public final int length;
    /** Only meaningful for NUMBER tokens. */
    public final double value;
    public final int line;
    public final int column;

    Token(TokenType type, String source, int offset, int length, double value, int line, int column) {
        this.type = type;
        this.source = source;
        this.offset = offset;
        this.length = length;
        this.value = value;
        this.line = line;
        this.column = column;
    }

    public String text() {
        return source.substring(offset, offset + length);
    }

    /** For STRING tokens: the characters between the quotes, escapes left as written. */
    public String stringContent() {
        if (type != TokenType.STRING) {
            throw new IllegalStateException("stringContent() on " + type + " token");
        }
        return source.substring(offset + 1, offset + length - 1);
    }

    @Override
    public String toString() {
        return type + " '" + text() + "' @" + line + ":" + column;
    }
}
