package com.numu.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * On-demand lexer: each {@link #next()} scans one token. Once the input is exhausted every call
 * returns EOF. A LexError leaves the lexer unusable; build a new one to start over.
 */
public class Lexer {
    private final String source;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("let", TokenType.LET);
        map.put("fn", TokenType.FN);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("for", TokenType.FOR);
        map.put("while", TokenType.WHILE);
        map.put("return", TokenType.RETURN);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("inf", TokenType.INF);
        map.put("nan", TokenType.NAN);
        map.put("pi", TokenType.PI);
        map.put("e", TokenType.E);
        keywords = Collections.unmodifiableMap(map);
    }

    private static final Map<String, TokenType> twoCharOps;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("==", TokenType.EQUAL_EQUAL);
        map.put("!=", TokenType.BANG_EQUAL);
        map.put("<=", TokenType.LESS_EQUAL);
        map.put(">=", TokenType.GREATER_EQUAL);
        map.put("->", TokenType.ARROW);
        map.put("**", TokenType.STAR_STAR);
        map.put("&&", TokenType.AND_AND);
        map.put("||", TokenType.OR_OR);
        twoCharOps = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
    }

    public String source() { return source; }

    /** Scans until the first EOF (inclusive). */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = next();
            tokens.add(t);
        } while (t.type != TokenType.EOF);
        return tokens;
    }

    public Token next() {
        skipWhitespaceAndComments();
        if (isAtEnd()) {
            return new Token(TokenType.EOF, source, current, 0, 0.0, line, column);
        }

        char c = peek();

        if (isDigit(c) || (c == '.' && isDigit(peekNext()))) return number();
        if (isAlpha(c)) return identifier();
        if (c == '"') return string();

        if (current + 1 < source.length()) {
            TokenType op = twoCharOps.get(source.substring(current, current + 2));
            if (op != null) return emit(op, 2);
        }

        switch (c) {
            case '+': return emit(TokenType.PLUS, 1);
            case '-': return emit(TokenType.MINUS, 1);
            case '*': return emit(TokenType.STAR, 1);
            case '/': return emit(TokenType.SLASH, 1);
            case '%': return emit(TokenType.PERCENT, 1);
            case '^': return emit(TokenType.CARET, 1);
            case '=': return emit(TokenType.EQUAL, 1);
            case '<': return emit(TokenType.LESS, 1);
            case '>': return emit(TokenType.GREATER, 1);
            case '!': return emit(TokenType.BANG, 1);
            case '(': return emit(TokenType.LEFT_PAREN, 1);
            case ')': return emit(TokenType.RIGHT_PAREN, 1);
            case '[': return emit(TokenType.LEFT_BRACKET, 1);
            case ']': return emit(TokenType.RIGHT_BRACKET, 1);
            case '{': return emit(TokenType.LEFT_BRACE, 1);
            case '}': return emit(TokenType.RIGHT_BRACE, 1);
            case ',': return emit(TokenType.COMMA, 1);
            case '.': return emit(TokenType.DOT, 1);
            case ':': return emit(TokenType.COLON, 1);
            case ';': return emit(TokenType.SEMICOLON, 1);
            default:
                throw error("unexpected character: '" + c + "'");
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t') {
                current++;
                column++;
            } else if (c == '\n') {
                current++;
                newLine();
            } else if (c == '\r') {
                current++;
                if (peek() == '\n') current++;
                newLine();
            } else if (c == '#') {
                // stops before the newline so the line count stays right
                while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
                    current++;
                    column++;
                }
            } else {
                return;
            }
        }
    }

    private Token number() {
        int start = current;
        int startColumn = column;
        boolean hasDecimal = false;
        boolean hasExponent = false;

        while (!isAtEnd()) {
            char c = peek();
            if (isDigit(c)) {
                advance();
            } else if (c == '.' && !hasDecimal && !hasExponent) {
                hasDecimal = true;
                advance();
            } else if ((c == 'e' || c == 'E') && !hasExponent) {
                hasExponent = true;
                advance();
                if (peek() == '+' || peek() == '-') advance();
            } else {
                break;
            }
        }

        String text = source.substring(start, current);
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new LexError("invalid number format: " + text, line, startColumn);
        }
        return new Token(TokenType.NUMBER, source, start, current - start, value, line, startColumn);
    }

    private Token identifier() {
        int start = current;
        int startColumn = column;
        while (!isAtEnd() && isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, source, start, current - start, 0.0, line, startColumn);
    }

    private Token string() {
        int start = current;
        int startLine = line;
        int startColumn = column;
        advance(); // opening quote

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
            }
            char c = source.charAt(current);
            current++;
            if (c == '\n') {
                newLine();
            } else if (c == '\r') {
                if (peek() == '\n') current++;
                newLine();
            } else {
                column++;
            }
        }

        if (isAtEnd()) throw new LexError("unterminated string", startLine, startColumn);
        advance(); // closing quote
        return new Token(TokenType.STRING, source, start, current - start, 0.0, startLine, startColumn);
    }

    private Token emit(TokenType type, int width) {
        Token t = new Token(type, source, current, width, 0.0, line, column);
        current += width;
        column += width;
        return t;
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private void advance() {
        current++;
        column++;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private LexError error(String msg) {
        return new LexError(msg, line, column);
    }
}
