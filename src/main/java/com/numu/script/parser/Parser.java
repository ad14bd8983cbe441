package com.numu.script.parser;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.numu.script.InvariantViolation;
import com.numu.script.ast.BinaryOp;
import com.numu.script.ast.Node;
import com.numu.script.ast.Node.VariableNode;
import com.numu.script.ast.NodeArena;
import com.numu.script.ast.UnaryOp;

/**
 * Pratt parser. Each token type maps to an optional prefix handler, an optional infix handler
 * and a binding precedence; {@link #parseExpression(Precedence)} drives the table.
 *
 * Single pass: the parser pulls tokens from the lexer on demand and keeps two of them
 * (current and next). After the first lex or parse error it refuses further work.
 */
public class Parser {

    private interface PrefixHandler {
        Node parse();
    }

    private interface InfixHandler {
        Node parse(Node left);
    }

    private static final class ParseRule {
        final PrefixHandler prefix;
        final InfixHandler infix;
        final Precedence precedence;

        ParseRule(PrefixHandler prefix, InfixHandler infix, Precedence precedence) {
            this.prefix = prefix;
            this.infix = infix;
            this.precedence = precedence;
        }
    }

    private static final ParseRule NO_RULE = new ParseRule(null, null, Precedence.NONE);

    private final Lexer lexer;
    private final NodeArena arena;
    private final Associativity associativity;
    private final Map<TokenType, ParseRule> rules = new EnumMap<>(TokenType.class);

    private Token current;
    private Token next;
    private boolean failed = false;

    public Parser(Lexer lexer, NodeArena arena) {
        this(lexer, arena, Associativity.CONVENTIONAL);
    }

    public Parser(Lexer lexer, NodeArena arena, Associativity associativity) {
        if (lexer == null) throw new IllegalArgumentException("lexer must not be null");
        if (arena == null) throw new IllegalArgumentException("arena must not be null");
        this.lexer = lexer;
        this.arena = arena;
        this.associativity = (associativity == null) ? Associativity.CONVENTIONAL : associativity;
        setupRules();
        this.current = lexer.next();
        this.next = lexer.next();
    }

    private void setupRules() {
        rules.put(TokenType.NUMBER, new ParseRule(this::number, null, Precedence.NONE));
        rules.put(TokenType.STRING, new ParseRule(this::string, null, Precedence.NONE));
        rules.put(TokenType.TRUE, new ParseRule(this::bool, null, Precedence.NONE));
        rules.put(TokenType.FALSE, new ParseRule(this::bool, null, Precedence.NONE));
        rules.put(TokenType.PI, new ParseRule(this::constant, null, Precedence.NONE));
        rules.put(TokenType.E, new ParseRule(this::constant, null, Precedence.NONE));
        rules.put(TokenType.INF, new ParseRule(this::constant, null, Precedence.NONE));
        rules.put(TokenType.NAN, new ParseRule(this::constant, null, Precedence.NONE));
        rules.put(TokenType.IDENTIFIER, new ParseRule(this::variable, null, Precedence.NONE));

        rules.put(TokenType.LEFT_PAREN, new ParseRule(this::grouping, this::call, Precedence.CALL));
        rules.put(TokenType.LEFT_BRACKET, new ParseRule(this::matrix, null, Precedence.NONE));

        rules.put(TokenType.MINUS, new ParseRule(this::unary, this::binary, Precedence.TERM));
        rules.put(TokenType.PLUS, new ParseRule(null, this::binary, Precedence.TERM));
        rules.put(TokenType.STAR, new ParseRule(null, this::binary, Precedence.FACTOR));
        rules.put(TokenType.SLASH, new ParseRule(null, this::binary, Precedence.FACTOR));
        rules.put(TokenType.PERCENT, new ParseRule(null, this::binary, Precedence.FACTOR));
        rules.put(TokenType.CARET, new ParseRule(null, this::binary, Precedence.POWER));
        rules.put(TokenType.STAR_STAR, new ParseRule(null, this::binary, Precedence.POWER));

        rules.put(TokenType.EQUAL, new ParseRule(null, this::assignment, Precedence.ASSIGNMENT));

        rules.put(TokenType.EQUAL_EQUAL, new ParseRule(null, this::binary, Precedence.EQUALITY));
        rules.put(TokenType.BANG_EQUAL, new ParseRule(null, this::binary, Precedence.EQUALITY));
        rules.put(TokenType.LESS, new ParseRule(null, this::binary, Precedence.COMPARISON));
        rules.put(TokenType.LESS_EQUAL, new ParseRule(null, this::binary, Precedence.COMPARISON));
        rules.put(TokenType.GREATER, new ParseRule(null, this::binary, Precedence.COMPARISON));
        rules.put(TokenType.GREATER_EQUAL, new ParseRule(null, this::binary, Precedence.COMPARISON));
        rules.put(TokenType.AND_AND, new ParseRule(null, this::binary, Precedence.AND));
        rules.put(TokenType.OR_OR, new ParseRule(null, this::binary, Precedence.OR));

        rules.put(TokenType.BANG, new ParseRule(this::unary, null, Precedence.NONE));
    }

    public Associativity associativity() { return associativity; }

    /** Parses one expression, consuming only the tokens it needs. */
    public Node parse() {
        ensureUsable();
        try {
            return parseExpression(Precedence.ASSIGNMENT);
        } catch (RuntimeException e) {
            failed = true;
            throw e;
        }
    }

    /**
     * Parses ';'-separated expressions up to EOF into a Block. Empty statements are skipped,
     * so a trailing ';' is fine.
     */
    public Node parseProgram() {
        ensureUsable();
        try {
            List<Node> statements = new ArrayList<>();
            while (current.type != TokenType.EOF) {
                if (match(TokenType.SEMICOLON)) continue;
                statements.add(parseExpression(Precedence.ASSIGNMENT));
                if (current.type != TokenType.EOF && current.type != TokenType.SEMICOLON) {
                    throw error("expected ';' between expressions");
                }
            }
            return arena.block(statements);
        } catch (RuntimeException e) {
            failed = true;
            throw e;
        }
    }

    /** The token the parser stopped at. */
    public Token current() { return current; }

    private Node parseExpression(Precedence min) {
        Node expr = parsePrefix();
        while (true) {
            ParseRule rule = rule(current.type);
            if (rule.infix == null || !rule.precedence.atLeast(min)) break;
            expr = rule.infix.parse(expr);
        }
        return expr;
    }

    private Node parsePrefix() {
        ParseRule rule = rule(current.type);
        if (rule.prefix == null) {
            throw error("expected expression");
        }
        return rule.prefix.parse();
    }

    private ParseRule rule(TokenType type) {
        ParseRule r = rules.get(type);
        return r == null ? NO_RULE : r;
    }

    // -------------------------
    // Prefix handlers
    // -------------------------

    private Node number() {
        double value = current.value;
        advance();
        return arena.number(value);
    }

    private Node string() {
        String value = current.stringContent();
        advance();
        return arena.string(value);
    }

    private Node bool() {
        boolean value = current.type == TokenType.TRUE;
        advance();
        return arena.bool(value);
    }

    private Node constant() {
        double value;
        switch (current.type) {
            case PI: value = Math.PI; break;
            case E: value = Math.E; break;
            case INF: value = Double.POSITIVE_INFINITY; break;
            case NAN: value = Double.NaN; break;
            default: throw error("unknown constant");
        }
        advance();
        return arena.number(value);
    }

    private Node variable() {
        String name = current.text();
        advance();
        return arena.variable(name);
    }

    private Node grouping() {
        advance(); // (
        Node expr = parseExpression(Precedence.ASSIGNMENT);
        consume(TokenType.RIGHT_PAREN, "expected ')' after expression");
        return expr;
    }

    // [1, 2, 3] is three one-element rows; [[1, 2], [3, 4]] is two rows.
    private Node matrix() {
        advance(); // [
        List<List<Node>> rows = new ArrayList<>();

        if (!match(TokenType.RIGHT_BRACKET)) {
            do {
                List<Node> row = new ArrayList<>();
                if (match(TokenType.LEFT_BRACKET)) {
                    if (!match(TokenType.RIGHT_BRACKET)) {
                        do {
                            row.add(parseExpression(Precedence.ASSIGNMENT));
                        } while (match(TokenType.COMMA));
                        consume(TokenType.RIGHT_BRACKET, "expected ']' after row elements");
                    }
                } else {
                    row.add(parseExpression(Precedence.ASSIGNMENT));
                }
                rows.add(row);
            } while (match(TokenType.COMMA));

            consume(TokenType.RIGHT_BRACKET, "expected ']' after matrix rows");
        }

        return arena.matrix(rows);
    }

    private Node unary() {
        Token op = current;
        advance();
        Node operand = parseExpression(Precedence.UNARY);

        switch (op.type) {
            case MINUS: return arena.unary(UnaryOp.NEGATE, operand);
            case BANG: return arena.unary(UnaryOp.NOT, operand);
            default: throw new ParseError("invalid unary operator", op.line, op.column);
        }
    }

    // -------------------------
    // Infix handlers
    // -------------------------

    private Node binary(Node left) {
        Token op = current;
        advance();

        Precedence own = rule(op.type).precedence;
        Node right = parseExpression(rightOperandPrecedence(op.type, own));
        return arena.binary(binaryOp(op), left, right);
    }

    private Precedence rightOperandPrecedence(TokenType op, Precedence own) {
        if (associativity == Associativity.RIGHT_LEANING) return own;
        if (op == TokenType.CARET || op == TokenType.STAR_STAR) return own;
        return own.higher();
    }

    private Node assignment(Node left) {
        if (!(left instanceof VariableNode)) {
            throw error("invalid assignment target");
        }
        String name = ((VariableNode) left).name;
        advance(); // =
        Node value = parseExpression(Precedence.ASSIGNMENT);
        return arena.assignment(name, value);
    }

    private Node call(Node left) {
        if (!(left instanceof VariableNode)) {
            throw error("can only call functions");
        }
        String name = ((VariableNode) left).name;
        advance(); // (

        List<Node> args = new ArrayList<>();
        if (!match(TokenType.RIGHT_PAREN)) {
            do {
                args.add(parseExpression(Precedence.ASSIGNMENT));
            } while (match(TokenType.COMMA));
            consume(TokenType.RIGHT_PAREN, "expected ')' after arguments");
        }

        return arena.function(name, args);
    }

    private BinaryOp binaryOp(Token op) {
        switch (op.type) {
            case PLUS: return BinaryOp.ADD;
            case MINUS: return BinaryOp.SUB;
            case STAR: return BinaryOp.MUL;
            case SLASH: return BinaryOp.DIV;
            case PERCENT: return BinaryOp.MOD;
            case CARET:
            case STAR_STAR: return BinaryOp.POW;
            case EQUAL_EQUAL: return BinaryOp.EQ;
            case BANG_EQUAL: return BinaryOp.NEQ;
            case LESS: return BinaryOp.LT;
            case LESS_EQUAL: return BinaryOp.LEQ;
            case GREATER: return BinaryOp.GT;
            case GREATER_EQUAL: return BinaryOp.GEQ;
            case AND_AND: return BinaryOp.AND;
            case OR_OR: return BinaryOp.OR;
            default:
                throw new InvariantViolation("no binary operator for token " + op.type);
        }
    }

    // -------------------------
    // Token plumbing
    // -------------------------

    private void advance() {
        current = next;
        next = lexer.next();
    }

    private boolean match(TokenType type) {
        if (current.type == type) {
            advance();
            return true;
        }
        return false;
    }

    private void consume(TokenType type, String message) {
        if (current.type == type) {
            advance();
            return;
        }
        throw error(message);
    }

    private void ensureUsable() {
        if (failed) throw new IllegalStateException("Parser cannot be reused after a failed parse");
    }

    private ParseError error(String message) {
        return new ParseError(message, current.line, current.column);
    }
}
