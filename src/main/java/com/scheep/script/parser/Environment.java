package com.scheep.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.scheep.script.Scheep.BuiltinFunction;

/**
 * A chain of frames, innermost first, ending in {@link #EMPTY}.
 *
 * Chain nodes are immutable; the frames they point at are shared and mutable.
 * Extending never copies or touches the parent, so several calls and closures
 * can hang off the same ancestors and all of them observe each other's
 * {@code define}/{@code set!} on shared frames.
 */
public final class Environment {

    /** The terminal environment: no frames, cannot be defined into. */
    public static final Environment EMPTY = new Environment(null, null);

    public final Frame frame;
    public final Environment enclosing;

    private Environment(Frame frame, Environment enclosing) {
        this.frame = frame;
        this.enclosing = enclosing;
    }

    /**
     * Builds the global environment: one frame holding the primitive table, plus
     * {@code true} and {@code false} bound to the boolean literals.
     */
    public static Environment makeGlobalEnvironment(Map<String, BuiltinFunction> primitives) {
        List<String> names = new ArrayList<>();
        List<Value> values = new ArrayList<>();
        if (primitives != null) {
            for (Map.Entry<String, BuiltinFunction> e : primitives.entrySet()) {
                names.add(e.getKey());
                values.add(Value.primitive(new PrimitiveProcedure(e.getKey(), e.getValue())));
            }
        }
        Environment env = EMPTY.extend(names, values);
        env.define("true", Value.TRUE);
        env.define("false", Value.FALSE);
        return env;
    }

    public boolean isEmpty() {
        return frame == null;
    }

    public Environment extend(List<String> names, List<Value> values) {
        return extend(null, names, values);
    }

    /** @param procName used only in the arity error message */
    public Environment extend(String procName, List<String> names, List<Value> values) {
        if (names.size() != values.size()) {
            throw EvaluationException.arityMismatch(procName, names.size(), values.size());
        }
        return new Environment(new Frame(names, values), this);
    }

    /** @return the innermost frame binding {@code name}, or null if no frame does */
    public Frame find(String name) {
        for (Environment e = this; !e.isEmpty(); e = e.enclosing) {
            if (e.frame.contains(name)) return e.frame;
        }
        return null;
    }

    public Value lookup(String name) {
        for (Environment e = this; !e.isEmpty(); e = e.enclosing) {
            Value v = e.frame.get(name);
            if (v != null) return v;
        }
        throw EvaluationException.unboundVariable(name);
    }

    /** {@code set!}: overwrite the nearest existing binding. */
    public void assign(String name, Value value) {
        for (Environment e = this; !e.isEmpty(); e = e.enclosing) {
            if (e.frame.replace(name, value)) return;
        }
        throw EvaluationException.unboundVariable(name);
    }

    /** {@code define}: insert or overwrite in the innermost frame, shadowing outer bindings. */
    public void define(String name, Value value) {
        if (isEmpty()) {
            throw new IllegalStateException("Cannot define variables in the empty environment");
        }
        frame.define(name, value);
    }

    /** Number of frames in the chain. */
    public int depth() {
        int n = 0;
        for (Environment e = this; !e.isEmpty(); e = e.enclosing) n++;
        return n;
    }

    /** Frames innermost first. */
    public List<Frame> frames() {
        List<Frame> out = new ArrayList<>();
        for (Environment e = this; !e.isEmpty(); e = e.enclosing) out.add(e.frame);
        return out;
    }
}
