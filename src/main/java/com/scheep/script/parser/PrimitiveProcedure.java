package com.scheep.script.parser;

import com.scheep.script.Scheep.BuiltinFunction;

/** A procedure backed by a host function. Arity checks are the function's own business. */
public final class PrimitiveProcedure {
    public final String name;
    final BuiltinFunction function;

    public PrimitiveProcedure(String name, BuiltinFunction function) {
        if (function == null) throw new IllegalArgumentException("function must not be null");
        this.name = name;
        this.function = function;
    }
}
