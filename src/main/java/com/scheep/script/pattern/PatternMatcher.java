package com.scheep.script.pattern;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.scheep.script.parser.Environment;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Frame;
import com.scheep.script.parser.Value;

/**
 * Matches a syntax-rules pattern against a candidate form.
 *
 * A failed match is an ordinary outcome ({@link Optional#empty()}): macro
 * expansion tries the next rule. Only an ill-formed pattern raises.
 *
 * Dotted patterns are not supported.
 */
public final class PatternMatcher {

    private PatternMatcher() {}

    /**
     * @param pattern  a pattern list
     * @param form     the candidate form; anything but a list never matches
     * @param literals symbols matched by binding identity instead of captured
     * @param defEnv   where the literals are resolved on the pattern side
     * @param useEnv   where identifiers in the form are resolved
     */
    public static Optional<MatchBindings> match(Value pattern, Value form, Set<String> literals,
                                                Environment defEnv, Environment useEnv) {
        if (!pattern.isList()) {
            throw EvaluationException.malformedSyntax("pattern must be a list: " + pattern);
        }
        if (!form.isList()) return Optional.empty();
        return Optional.ofNullable(
                matchList(pattern.asList(), form.asList(), MatchBindings.empty(), literals, defEnv, useEnv));
    }

    /** @return the accumulated bindings, or null when the match fails */
    private static MatchBindings matchList(List<Value> ps, List<Value> fs, MatchBindings acc,
                                           Set<String> literals, Environment defEnv, Environment useEnv) {
        PatternNode node = PatternNode.classify(ps, literals);
        switch (node.kind) {
            case EMPTY:
                return fs.isEmpty() ? acc : null;

            case VARIABLE: {
                if (fs.isEmpty()) return null;
                MatchBindings next = acc.merge(MatchBindings.empty().with(node.element.asSymbol(), List.of(fs.get(0))));
                return matchList(rest(ps, 1), rest(fs, 1), next, literals, defEnv, useEnv);
            }

            case LITERAL: {
                if (fs.isEmpty()) return null;
                if (!sameBinding(node.element.asSymbol(), fs.get(0), defEnv, useEnv)) return null;
                return matchList(rest(ps, 1), rest(fs, 1), acc, literals, defEnv, useEnv);
            }

            case ELLIPSIS:
                return matchEllipsis(node.element, ps, fs, acc, literals, defEnv, useEnv);

            case SUBLIST: {
                if (fs.isEmpty() || !fs.get(0).isList()) return null;
                MatchBindings inner = matchList(node.element.asList(), fs.get(0).asList(),
                        MatchBindings.empty(), literals, defEnv, useEnv);
                if (inner == null) return null;
                return matchList(rest(ps, 1), rest(fs, 1), acc.merge(inner), literals, defEnv, useEnv);
            }

            case DATUM: {
                if (fs.isEmpty() || !node.element.equals(fs.get(0))) return null;
                return matchList(rest(ps, 1), rest(fs, 1), acc, literals, defEnv, useEnv);
            }

            default:
                throw new IllegalStateException("Unhandled pattern kind: " + node.kind);
        }
    }

    /**
     * {@code p ... trailing}: the repetition takes every form except the ones the
     * trailing patterns need, matching each against {@code p} on its own.
     */
    private static MatchBindings matchEllipsis(Value repeated, List<Value> ps, List<Value> fs, MatchBindings acc,
                                               Set<String> literals, Environment defEnv, Environment useEnv) {
        List<Value> trailing = rest(ps, 2);
        for (Value t : trailing) {
            if (PatternNode.isEllipsis(t)) {
                throw EvaluationException.malformedSyntax("more than one ellipsis in " + Value.list(ps));
            }
        }

        int count = fs.size() - trailing.size();
        if (count < 0) return null;

        MatchBindings repetitions = MatchBindings.empty();
        if (count == 0) {
            for (String var : variables(repeated, literals)) {
                repetitions = repetitions.with(var, List.of());
            }
        }
        List<Value> single = List.of(repeated);
        for (int i = 0; i < count; i++) {
            MatchBindings one = matchList(single, List.of(fs.get(i)), MatchBindings.empty(), literals, defEnv, useEnv);
            if (one == null) return null;
            repetitions = repetitions.merge(one);
        }
        return matchList(trailing, rest(fs, count), acc.merge(repetitions), literals, defEnv, useEnv);
    }

    /**
     * A literal matches when the form's identifier resolves to the same binding
     * (same frame, same name) as the pattern's. Two unbound identifiers match by name.
     */
    static boolean sameBinding(String literal, Value candidate, Environment defEnv, Environment useEnv) {
        if (!candidate.isSymbol()) return false;
        String name = candidate.asSymbol();
        if (!literal.equals(name)) return false;

        Frame defFrame = defEnv.find(literal);
        Frame useFrame = useEnv.find(name);
        return defFrame == useFrame;
    }

    /** Pattern variables in {@code pattern}, in order of first appearance. */
    public static Set<String> variables(Value pattern, Set<String> literals) {
        Set<String> out = new LinkedHashSet<>();
        collectVariables(pattern, literals, out);
        return out;
    }

    private static void collectVariables(Value pattern, Set<String> literals, Set<String> out) {
        if (pattern.isSymbol()) {
            String name = pattern.asSymbol();
            if (!PatternNode.ELLIPSIS.equals(name) && !literals.contains(name)) out.add(name);
        } else if (pattern.isList()) {
            for (Value v : pattern.asList()) collectVariables(v, literals, out);
        }
    }

    private static List<Value> rest(List<Value> list, int from) {
        return list.subList(Math.min(from, list.size()), list.size());
    }
}
