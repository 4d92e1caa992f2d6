package com.scheep.script.parser;

/** Handler for a form evaluated by its own rule instead of operator-then-apply. */
@FunctionalInterface
public interface SpecialForm {
    /**
     * @param expr the whole, unevaluated list form including its head symbol
     * @param env  the environment the form appears in
     */
    Value evaluate(Value expr, Environment env, Evaluator evaluator);
}
