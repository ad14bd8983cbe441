package com.numu.script.eval;

import java.util.List;

import com.numu.script.ast.BinaryOp;
import com.numu.script.ast.UnaryOp;

/**
 * Standard bindings installed into a fresh {@link Environment}.
 *
 * Constants: pi, e, inf.
 * Functions: abs(x); variadic min, max, sum, avg; and the scalar math table
 * sin, cos, tan, exp, log, sqrt, pow. The math functions go through the evaluator's
 * guarded operators, so log(0) fails the same way whether written as a call or folded from a node.
 */
public final class Builtins {

    private Builtins() {}

    public static void install(Environment env) {
        env.setVariable("pi", Math.PI);
        env.setVariable("e", Math.E);
        env.setVariable("inf", Double.POSITIVE_INFINITY);

        env.registerFunction("abs", args -> Math.abs(args.get(0)), 1);

        env.registerFunction("min", args -> {
            requireNonEmpty("min", args);
            double m = args.get(0);
            for (int i = 1; i < args.size(); i++) {
                double d = args.get(i);
                if (d < m) m = d;
            }
            return m;
        }, RegisteredFunction.VARIADIC);

        env.registerFunction("max", args -> {
            requireNonEmpty("max", args);
            double m = args.get(0);
            for (int i = 1; i < args.size(); i++) {
                double d = args.get(i);
                if (d > m) m = d;
            }
            return m;
        }, RegisteredFunction.VARIADIC);

        env.registerFunction("sum", Builtins::sum, RegisteredFunction.VARIADIC);

        env.registerFunction("avg", args -> {
            requireNonEmpty("avg", args);
            return sum(args) / args.size();
        }, RegisteredFunction.VARIADIC);

        registerUnary(env, "sin", UnaryOp.SIN);
        registerUnary(env, "cos", UnaryOp.COS);
        registerUnary(env, "tan", UnaryOp.TAN);
        registerUnary(env, "exp", UnaryOp.EXP);
        registerUnary(env, "log", UnaryOp.LOG);
        registerUnary(env, "sqrt", UnaryOp.SQRT);

        env.registerFunction("pow", args -> Evaluator.applyBinary(BinaryOp.POW, args.get(0), args.get(1)), 2);
    }

    private static void registerUnary(Environment env, String name, UnaryOp op) {
        env.registerFunction(name, args -> Evaluator.applyUnary(op, args.get(0)), 1);
    }

    private static double sum(List<Double> args) {
        double total = 0.0;
        for (double d : args) total += d;
        return total;
    }

    private static void requireNonEmpty(String name, List<Double> args) {
        if (args.isEmpty()) {
            throw new EvaluationError(name + "() expects at least 1 argument");
        }
    }
}
