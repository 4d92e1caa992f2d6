package com.scheep.script.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.scheep.script.pattern.SyntaxRules;

/**
 * The built-in special forms: quote, set!, define, if, lambda, begin and
 * define-syntax. Each one checks the shape of its form and raises
 * MALFORMED_SYNTAX when the shape is wrong.
 */
public final class CoreForms {

    private CoreForms() {}

    public static void registerAll(SpecialForms forms) {
        forms.register("quote", CoreForms::quote);
        forms.register("set!", CoreForms::assignment);
        forms.register("define", CoreForms::definition);
        forms.register("if", CoreForms::conditional);
        forms.register("lambda", CoreForms::lambda);
        forms.register("begin", CoreForms::begin);
        forms.register("define-syntax", CoreForms::defineSyntax);
    }

    static Value quote(Value expr, Environment env, Evaluator evaluator) {
        List<Value> form = shape(expr, 2, 2, "(quote datum)");
        return form.get(1);
    }

    static Value assignment(Value expr, Environment env, Evaluator evaluator) {
        List<Value> form = shape(expr, 3, 3, "(set! name expression)");
        String name = symbolName(form.get(1), "set!");
        env.assign(name, evaluator.evaluate(form.get(2), env));
        return Value.OK;
    }

    static Value definition(Value expr, Environment env, Evaluator evaluator) {
        List<Value> form = shape(expr, 3, Integer.MAX_VALUE, "(define name expression) or (define (name params...) body...)");
        Value target = form.get(1);

        if (target.isSymbol()) {
            if (form.size() != 3) {
                throw EvaluationException.malformedSyntax("(define name expression) takes exactly one expression: " + expr);
            }
            env.define(target.asSymbol(), evaluator.evaluate(form.get(2), env));
            return Value.OK;
        }

        if (target.isList() && !target.isEmptyList()) {
            List<Value> signature = target.asList();
            String name = symbolName(signature.get(0), "define");
            List<String> params = parameterNames(signature.subList(1, signature.size()), "define");
            List<Value> body = new ArrayList<>(form.subList(2, form.size()));
            env.define(name, Value.compound(new CompoundProcedure(name, params, body, env)));
            return Value.OK;
        }

        throw EvaluationException.malformedSyntax("define target must be a symbol or a signature list: " + expr);
    }

    static Value conditional(Value expr, Environment env, Evaluator evaluator) {
        List<Value> form = shape(expr, 3, 4, "(if predicate consequent [alternative])");
        if (evaluator.evaluate(form.get(1), env).isTrue()) {
            return evaluator.evaluate(form.get(2), env);
        }
        return (form.size() == 4) ? evaluator.evaluate(form.get(3), env) : Value.FALSE;
    }

    static Value lambda(Value expr, Environment env, Evaluator evaluator) {
        List<Value> form = shape(expr, 3, Integer.MAX_VALUE, "(lambda (params...) body...)");
        Value paramList = form.get(1);
        if (!paramList.isList()) {
            throw EvaluationException.malformedSyntax("lambda parameters must be a list: " + expr);
        }
        List<String> params = parameterNames(paramList.asList(), "lambda");
        List<Value> body = new ArrayList<>(form.subList(2, form.size()));
        return Value.compound(new CompoundProcedure(null, params, body, env));
    }

    static Value begin(Value expr, Environment env, Evaluator evaluator) {
        List<Value> form = shape(expr, 2, Integer.MAX_VALUE, "(begin expression...)");
        return evaluator.evaluateSequence(form.subList(1, form.size()), env);
    }

    static Value defineSyntax(Value expr, Environment env, Evaluator evaluator) {
        List<Value> form = shape(expr, 3, 3, "(define-syntax name (syntax-rules (literals...) rules...))");
        String name = symbolName(form.get(1), "define-syntax");
        env.define(name, Value.macro(SyntaxRules.parse(name, form.get(2), env)));
        return Value.OK;
    }

    // -------------------------
    // Shape helpers
    // -------------------------

    private static List<Value> shape(Value expr, int min, int max, String usage) {
        List<Value> form = expr.asList();
        if (form.size() < min || form.size() > max) {
            throw EvaluationException.malformedSyntax("expected " + usage + ", got " + expr);
        }
        return form;
    }

    private static String symbolName(Value v, String where) {
        if (!v.isSymbol()) {
            throw EvaluationException.malformedSyntax(where + " expects a symbol, got " + v);
        }
        return v.asSymbol();
    }

    private static List<String> parameterNames(List<Value> params, String where) {
        List<String> names = new ArrayList<>(params.size());
        Set<String> seen = new HashSet<>();
        for (Value p : params) {
            String name = symbolName(p, where + " parameter");
            if (!seen.add(name)) {
                throw EvaluationException.malformedSyntax(where + " has duplicate parameter " + name);
            }
            names.add(name);
        }
        return names;
    }
}
