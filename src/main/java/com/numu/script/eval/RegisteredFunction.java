package com.numu.script.eval;

import java.util.Collections;
import java.util.List;

/** A named function table entry: the implementation plus its arity check. */
public final class RegisteredFunction {

    public static final int VARIADIC = -1;

    public final String name;
    public final int arity;
    private final NativeFunction impl;

    RegisteredFunction(String name, int arity, NativeFunction impl) {
        this.name = name;
        this.arity = arity;
        this.impl = impl;
    }

    public boolean isVariadic() { return arity == VARIADIC; }

    public double call(List<Double> args) {
        if (arity != VARIADIC && args.size() != arity) {
            throw new EvaluationError("function " + name + " expects " + arity + " arguments, got " + args.size());
        }
        return impl.call(Collections.unmodifiableList(args));
    }
}
