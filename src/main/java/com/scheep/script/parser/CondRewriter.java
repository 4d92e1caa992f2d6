package com.scheep.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code cond} into nested {@code if} forms. The whole clause list is
 * checked before anything is evaluated, so a misplaced {@code else} fails early.
 */
public final class CondRewriter {

    static final String COND = "cond";
    private static final String ELSE = "else";

    private CondRewriter() {}

    public static boolean isCond(Value expr) {
        return expr.isList() && !expr.isEmptyList() && expr.asList().get(0).isSymbol(COND);
    }

    public static Value rewrite(Value condExpr) {
        List<Value> form = condExpr.asList();
        return expandClauses(form.subList(1, form.size()));
    }

    private static Value expandClauses(List<Value> clauses) {
        if (clauses.isEmpty()) return Value.FALSE;

        Value first = clauses.get(0);
        if (!first.isList() || first.isEmptyList()) {
            throw EvaluationException.malformedSyntax("cond clause must be a non-empty list: " + first);
        }
        List<Value> clause = first.asList();
        Value predicate = clause.get(0);
        List<Value> actions = clause.subList(1, clause.size());
        List<Value> rest = clauses.subList(1, clauses.size());

        if (predicate.isSymbol(ELSE)) {
            if (!rest.isEmpty()) {
                throw EvaluationException.malformedSyntax("else clause isn't the last clause of cond");
            }
            return sequenceToExpression(actions);
        }
        return Value.list(Value.symbol("if"), predicate, sequenceToExpression(actions), expandClauses(rest));
    }

    /** Zero actions give the empty form, one is used as is, more are wrapped in {@code begin}. */
    public static Value sequenceToExpression(List<Value> actions) {
        if (actions.isEmpty()) return Value.EMPTY_LIST;
        if (actions.size() == 1) return actions.get(0);
        List<Value> begin = new ArrayList<>(actions.size() + 1);
        begin.add(Value.symbol("begin"));
        begin.addAll(actions);
        return Value.list(begin);
    }
}
