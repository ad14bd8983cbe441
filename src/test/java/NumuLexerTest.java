import org.junit.jupiter.api.Test;

import com.numu.script.ScriptError;
import com.numu.script.parser.LexError;
import com.numu.script.parser.Lexer;
import com.numu.script.parser.Token;
import com.numu.script.parser.TokenType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NumuLexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void expression_tokenStream() {
        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER, TokenType.PLUS,
                        TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.NUMBER, TokenType.COMMA,
                        TokenType.STRING, TokenType.RIGHT_PAREN, TokenType.SEMICOLON, TokenType.EOF),
                types("x = 3.5e2 + foo(1, \"s\");"));
    }

    @Test
    void numerals_roundTripBitForBit() {
        String[] spans = {"0", "42", "3.14", ".5", "5.", "1e10", "1.5E-3", "2.5e+7",
                "123456789.123456789", "0.1", "1e-320", "179769313486231570000000000000000"};
        for (String span : spans) {
            Token t = new Lexer(span).next();
            assertEquals(TokenType.NUMBER, t.type, span);
            assertEquals(span, t.text());
            long expected = Double.doubleToLongBits(Double.parseDouble(span));
            assertEquals(expected, Double.doubleToLongBits(t.value), span);

            String formatted = Double.toString(t.value);
            assertEquals(expected, Double.doubleToLongBits(new Lexer(formatted).next().value), span);
        }
    }

    @Test
    void number_stopsAtSecondDecimalPoint() {
        List<Token> tokens = new Lexer("1.2.3").tokenize();
        assertEquals(3, tokens.size());
        assertEquals("1.2", tokens.get(0).text());
        assertEquals(".3", tokens.get(1).text());
        assertEquals(0.3, tokens.get(1).value, 0.0);
    }

    @Test
    void number_noDecimalPointAfterExponent() {
        List<Token> tokens = new Lexer("1e5.5").tokenize();
        assertEquals("1e5", tokens.get(0).text());
        assertEquals(".5", tokens.get(1).text());
    }

    @Test
    void number_danglingExponent_isLexError() {
        LexError err = assertThrows(LexError.class, () -> new Lexer("2e").next());
        assertEquals(ScriptError.Stage.LEX, err.stage());
        assertTrue(err.reason().startsWith("invalid number format"));

        assertThrows(LexError.class, () -> new Lexer("1e+").next());
    }

    @Test
    void keywords_and_identifiers() {
        assertEquals(
                List.of(TokenType.LET, TokenType.FN, TokenType.IF, TokenType.ELSE, TokenType.FOR,
                        TokenType.WHILE, TokenType.RETURN, TokenType.TRUE, TokenType.FALSE,
                        TokenType.INF, TokenType.NAN, TokenType.PI, TokenType.E, TokenType.EOF),
                types("let fn if else for while return true false inf nan pi e"));

        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF),
                types("_foo bar9 elsewhere E"));
    }

    @Test
    void operators_twoCharBeforeSingle() {
        assertEquals(
                List.of(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                        TokenType.ARROW, TokenType.STAR_STAR, TokenType.AND_AND, TokenType.OR_OR, TokenType.EOF),
                types("== != <= >= -> ** && ||"));

        assertEquals(
                List.of(TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT,
                        TokenType.CARET, TokenType.EQUAL, TokenType.LESS, TokenType.GREATER, TokenType.BANG,
                        TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACKET, TokenType.RIGHT_BRACKET,
                        TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE, TokenType.COMMA, TokenType.DOT,
                        TokenType.COLON, TokenType.SEMICOLON, TokenType.EOF),
                types("+ - * / % ^ = < > ! ( ) [ ] { } , . : ;"));
    }

    @Test
    void unexpectedCharacter_reportsPosition() {
        Lexer lexer = new Lexer("1 +\n  @");
        lexer.next();
        lexer.next();
        LexError err = assertThrows(LexError.class, lexer::next);
        assertEquals("unexpected character: '@'", err.reason());
        assertEquals(2, err.line());
        assertEquals(3, err.column());
        assertTrue(err.getMessage().startsWith("[line 2:3]"));

        assertThrows(LexError.class, () -> new Lexer("a & b").tokenize());
    }

    @Test
    void comments_produceNoTokens() {
        List<Token> tokens = new Lexer("# header\n1 # trailing\n# only comment\n2").tokenize();
        assertEquals(3, tokens.size());
        assertEquals(2, tokens.get(0).line);
        assertEquals(1, tokens.get(0).column);
        assertEquals(4, tokens.get(1).line);
        assertEquals(TokenType.EOF, tokens.get(2).type);
    }

    @Test
    void lineBreaks_crlfCountsOnce() {
        List<Token> tokens = new Lexer("a\r\nb\rc\nd").tokenize();
        assertEquals(1, tokens.get(0).line);
        assertEquals(2, tokens.get(1).line);
        assertEquals(3, tokens.get(2).line);
        assertEquals(4, tokens.get(3).line);
        assertEquals(1, tokens.get(3).column);
    }

    @Test
    void columns_pointAtTokenStart() {
        List<Token> tokens = new Lexer("ab  cd\t12").tokenize();
        assertEquals(1, tokens.get(0).column);
        assertEquals(5, tokens.get(1).column);
        assertEquals(8, tokens.get(2).column);
    }

    @Test
    void strings_escapesPassThrough_andSpanKeepsQuotes() {
        Token t = new Lexer("\"hi \\\" there\"").next();
        assertEquals(TokenType.STRING, t.type);
        assertEquals("hi \\\" there", t.stringContent());
        assertEquals("\"hi \\\" there\"", t.text());

        Token empty = new Lexer("\"\"").next();
        assertEquals(2, empty.length);
        assertEquals("", empty.stringContent());
    }

    @Test
    void strings_rawNewlineAdvancesLine() {
        List<Token> tokens = new Lexer("\"a\nb\" x").tokenize();
        assertEquals(1, tokens.get(0).line);
        assertEquals(2, tokens.get(1).line);
        assertEquals(4, tokens.get(1).column);
    }

    @Test
    void unterminatedString_isLexError() {
        LexError err = assertThrows(LexError.class, () -> new Lexer("x = \"abc").tokenize());
        assertEquals("unterminated string", err.reason());
        assertEquals(1, err.line());
        assertEquals(5, err.column());

        assertThrows(LexError.class, () -> new Lexer("\"abc\\\"").tokenize());
    }

    @Test
    void eof_isRepeatedForever() {
        Lexer lexer = new Lexer("1");
        assertEquals(TokenType.NUMBER, lexer.next().type);
        for (int i = 0; i < 5; i++) {
            Token eof = lexer.next();
            assertEquals(TokenType.EOF, eof.type);
            assertEquals(0, eof.length);
        }
    }

    @Test
    void everyNonEofToken_hasNonEmptySpan() {
        for (Token t : new Lexer("let x = [1, 2.5] ** \"\" # c\n -> y").tokenize()) {
            if (t.type != TokenType.EOF) assertTrue(t.length > 0, t.toString());
        }
    }
}
