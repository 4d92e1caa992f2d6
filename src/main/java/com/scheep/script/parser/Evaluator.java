package com.scheep.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.scheep.debug.Debug;
import com.scheep.script.pattern.SyntaxRules;

/**
 * The evaluate/apply pair.
 *
 * Compound procedure bodies are evaluated by plain recursion (no tail-call
 * elimination), so Scheme call depth maps onto JVM stack depth. A depth limit
 * on compound calls and macro expansions turns runaway recursion into a
 * {@link EvaluationException} rather than a {@link StackOverflowError}.
 */
public class Evaluator {

    private static final String TAG = "scheep.eval";

    public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

    private final SpecialForms forms;
    private final int maxDepth;
    private int depth = 0;

    public Evaluator(SpecialForms forms) {
        this(forms, DEFAULT_MAX_CALL_DEPTH);
    }

    /** Seals {@code forms}: registration is over once an evaluator exists. */
    public Evaluator(SpecialForms forms, int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.forms = forms;
        this.maxDepth = maxDepth;
        forms.seal();
    }

    public SpecialForms forms() {
        return forms;
    }

    public Value evaluate(Value expr, Environment env) {
        if (expr.isSelfEvaluating()) {
            return expr;
        }
        if (expr.isSymbol()) {
            return env.lookup(expr.asSymbol());
        }
        if (expr.isList() && !expr.isEmptyList()) {
            List<Value> form = expr.asList();
            Value head = form.get(0);

            if (head.isSymbol()) {
                SpecialForm handler = forms.get(head.asSymbol());
                if (handler != null) {
                    return handler.evaluate(expr, env, this);
                }
                if (CondRewriter.isCond(expr)) {
                    return evaluate(CondRewriter.rewrite(expr), env);
                }
            }

            Value operator = evaluate(head, env);
            if (operator.getType() == Value.Type.MACRO) {
                Value expansion = expand(operator.asMacro(), expr, env);
                enter();
                try {
                    return evaluate(expansion, env);
                } finally {
                    depth--;
                }
            }
            return apply(operator, listOfValues(form.subList(1, form.size()), env));
        }
        throw EvaluationException.unknownExpressionType(expr);
    }

    /** Operands strictly left to right, each finished before the next starts. */
    private List<Value> listOfValues(List<Value> operands, Environment env) {
        List<Value> args = new ArrayList<>(operands.size());
        for (Value operand : operands) {
            args.add(evaluate(operand, env));
        }
        return args;
    }

    public Value apply(Value procedure, List<Value> arguments) {
        switch (procedure.getType()) {
            case PRIMITIVE:
                return procedure.asPrimitive().function.call(arguments);

            case COMPOUND: {
                CompoundProcedure proc = procedure.asCompound();
                Environment callEnv = proc.closure.extend(proc.name, proc.params, arguments);
                enter();
                try {
                    return evaluateSequence(proc.body, callEnv);
                } finally {
                    depth--;
                }
            }

            default:
                throw EvaluationException.notAProcedure(procedure);
        }
    }

    /** Evaluates each expression for effect except the last, whose value is returned. */
    public Value evaluateSequence(List<Value> exprs, Environment env) {
        if (exprs.isEmpty()) {
            throw EvaluationException.malformedSyntax("empty expression sequence");
        }
        int last = exprs.size() - 1;
        for (int i = 0; i < last; i++) {
            evaluate(exprs.get(i), env);
        }
        return evaluate(exprs.get(last), env);
    }

    /** Current nesting of compound applications and macro expansions. */
    public int callDepth() {
        return depth;
    }

    private void enter() {
        if (depth >= maxDepth) {
            throw EvaluationException.recursionDepthExceeded(maxDepth);
        }
        depth++;
    }

    private Value expand(SyntaxRules macro, Value form, Environment useEnv) {
        Value expansion = macro.expand(form, useEnv);
        Debug.get().t(TAG, "expanded " + form + " => " + expansion);
        return expansion;
    }
}
