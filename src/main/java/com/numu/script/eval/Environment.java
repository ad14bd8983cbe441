package com.numu.script.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Flat global bindings for evaluation: variables (name -> double) and a function table.
 *
 * Owned and passed around by the caller; nothing here is static or thread-bound, so independent
 * environments never see each other. Not thread-safe.
 */
public class Environment {

    private final Map<String, Double> variables = new LinkedHashMap<>();
    private final Map<String, RegisteredFunction> functions = new LinkedHashMap<>();

    /** Empty environment: no constants, no functions. */
    public Environment() {}

    /** Environment with the standard constants and functions installed. */
    public static Environment withBuiltins() {
        Environment env = new Environment();
        Builtins.install(env);
        return env;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Always succeeds; overwrites any previous value. */
    public void setVariable(String name, double value) {
        if (name == null) throw new IllegalArgumentException("variable name must not be null");
        variables.put(name, value);
    }

    public double getVariable(String name) {
        Double v = variables.get(name);
        if (v == null) {
            throw new EvaluationError("undefined variable: " + name);
        }
        return v;
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    /** Snapshot; later changes to the environment are not reflected. */
    public Map<String, Double> variables() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    // -------------------------
    // Functions API
    // -------------------------

    /**
     * Registers a function once. arity -1 means variadic (no count check).
     * A second registration under the same name fails.
     */
    public void registerFunction(String name, NativeFunction impl, int arity) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("function name must not be empty");
        }
        if (impl == null) throw new IllegalArgumentException("function implementation must not be null");
        if (arity < RegisteredFunction.VARIADIC) {
            throw new IllegalArgumentException("arity must be -1 (variadic) or >= 0, got " + arity);
        }
        if (functions.containsKey(name)) {
            throw new EvaluationError("function already registered: " + name);
        }
        functions.put(name, new RegisteredFunction(name, arity, impl));
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    /** Null when no function has that name. */
    public RegisteredFunction lookupFunction(String name) {
        return functions.get(name);
    }

    public Set<String> functionNames() {
        return Collections.unmodifiableSet(functions.keySet());
    }
}
