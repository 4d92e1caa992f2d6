package com.scheep.script.parser;

import java.util.Collections;
import java.util.List;

/** A user-defined procedure: parameters, body and the environment it closed over. */
public final class CompoundProcedure {
    public final String name;
    public final List<String> params;
    public final List<Value> body;
    public final Environment closure;

    public CompoundProcedure(String name, List<String> params, List<Value> body, Environment closure) {
        if (body == null || body.isEmpty()) {
            throw EvaluationException.malformedSyntax("procedure body must not be empty");
        }
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.body = Collections.unmodifiableList(body);
        this.closure = closure;
    }
}
