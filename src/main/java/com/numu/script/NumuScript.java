package com.numu.script;

import com.numu.debug.Debug;
import com.numu.debug.DebugLevel;
import com.numu.script.ast.Node;
import com.numu.script.ast.NodeArena;
import com.numu.script.ast.Nodes;
import com.numu.script.eval.Environment;
import com.numu.script.eval.Evaluator;
import com.numu.script.eval.NativeFunction;
import com.numu.script.parser.Associativity;
import com.numu.script.parser.Lexer;
import com.numu.script.parser.Parser;

/**
 * Core numu engine.
 *
 * - Expression syntax: numbers, variables, calls, + - * / % ^, unary - and !, assignment with =
 * - Programs are ';'-separated expressions; the value is the last one
 * - Each instance owns its node arena and its environment (builtins installed), so two engines
 *   never share state
 * - Errors: LexError / ParseError / EvaluationError (all ScriptError); evaluate() throws them,
 *   tryEvaluate() returns them in an EvalResult
 */
public class NumuScript {

    private static final String TAG = "numu.engine";

    private final NodeArena arena = new NodeArena();
    private final Environment environment;
    private Associativity associativity = Associativity.CONVENTIONAL;

    public NumuScript() {
        this(Environment.withBuiltins());
    }

    /** Uses the given environment as is; no builtins are added. */
    public NumuScript(Environment environment) {
        if (environment == null) throw new IllegalArgumentException("environment must not be null");
        this.environment = environment;
    }

    public NodeArena arena() { return arena; }

    public Environment environment() { return environment; }

    public Associativity getAssociativity() { return associativity; }

    public void setAssociativity(Associativity associativity) {
        this.associativity = (associativity == null) ? Associativity.CONVENTIONAL : associativity;
    }

    // ===================== ENVIRONMENT HOOKS =====================

    public void setVariable(String name, double value) { environment.setVariable(name, value); }

    public double getVariable(String name) { return environment.getVariable(name); }

    public void registerFunction(String name, NativeFunction fn, int arity) {
        environment.registerFunction(name, fn, arity);
    }

    // ===================== PARSE / EVALUATE =====================

    /** Parses a single expression. */
    public Node parse(String source) {
        return guard("parse", () -> newParser(source).parse());
    }

    /** Parses ';'-separated expressions into a Block. */
    public Node parseProgram(String source) {
        return guard("parse", () -> newParser(source).parseProgram());
    }

    /**
     * Parses and evaluates a program; returns the value of its last expression.
     * The program lives in a scratch arena dropped on return, so repeated calls do not grow {@link #arena()}.
     */
    public double evaluate(String source) {
        return guard("evaluate", () -> {
            NodeArena scratch = new NodeArena();
            Node program = newParser(source, scratch).parseProgram();
            if (Debug.get().isEnabled(DebugLevel.DEBUG)) {
                Debug.get().d(TAG, "parsed " + program + " (" + scratch.size() + " nodes)");
            }
            double value = Evaluator.evaluate(program, environment);
            Debug.get().d(TAG, "evaluated to " + value);
            return value;
        });
    }

    public double evaluate(Node node) {
        return guard("evaluate", () -> Evaluator.evaluate(node, environment));
    }

    /** Like {@link #evaluate(String)} but reports lex/parse/evaluation failures in the result. */
    public EvalResult tryEvaluate(String source) {
        try {
            return EvalResult.ok(evaluate(source));
        } catch (ScriptError e) {
            return EvalResult.failed(e);
        }
    }

    /** Parses one expression and constant-folds it; only the folded tree is kept in {@link #arena()}. */
    public Node simplify(String source) {
        Node parsed = guard("parse", () -> newParser(source, new NodeArena()).parse());
        return Nodes.simplify(arena, parsed);
    }

    private Parser newParser(String source) {
        return newParser(source, arena);
    }

    private Parser newParser(String source, NodeArena target) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        return new Parser(new Lexer(source), target, associativity);
    }

    private interface Step<T> {
        T run();
    }

    // Script errors are logged once here and rethrown; callers decide how to present them.
    private <T> T guard(String what, Step<T> step) {
        try {
            return step.run();
        } catch (ScriptError e) {
            Debug.get().w(TAG, what + " failed (" + e.stage() + "): " + e.getMessage(), e);
            throw e;
        }
    }
}
