package com.scheep.script.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.scheep.script.parser.Environment;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Value;

/**
 * A macro defined with {@code (syntax-rules (literals...) (pattern template)...)}.
 *
 * Rules are tried in order; the first whose pattern matches has its template
 * instantiated with the match bindings. Expansion is not hygienic: template
 * symbols are inserted as they are. Ellipses nest one level deep.
 */
public final class SyntaxRules {

    private static final String SYNTAX_RULES = "syntax-rules";

    public final String name;
    public final Set<String> literals;
    final List<Rule> rules;
    final Environment definitionEnv;

    static final class Rule {
        /** The pattern without its keyword position. */
        final Value pattern;
        final Value template;
        /** Variables that occur under an ellipsis in the pattern. */
        final Set<String> ellipsisVars;

        Rule(Value pattern, Value template, Set<String> ellipsisVars) {
            this.pattern = pattern;
            this.template = template;
            this.ellipsisVars = ellipsisVars;
        }
    }

    private SyntaxRules(String name, Set<String> literals, List<Rule> rules, Environment definitionEnv) {
        this.name = name;
        this.literals = Collections.unmodifiableSet(literals);
        this.rules = Collections.unmodifiableList(rules);
        this.definitionEnv = definitionEnv;
    }

    /** Parses the {@code (syntax-rules ...)} spec of a {@code define-syntax}. */
    public static SyntaxRules parse(String name, Value spec, Environment definitionEnv) {
        if (!spec.isList() || spec.asList().size() < 2 || !spec.asList().get(0).isSymbol(SYNTAX_RULES)) {
            throw EvaluationException.malformedSyntax("expected (syntax-rules (literals...) rules...), got " + spec);
        }
        List<Value> parts = spec.asList();

        Value literalList = parts.get(1);
        if (!literalList.isList()) {
            throw EvaluationException.malformedSyntax("syntax-rules literals must be a list: " + literalList);
        }
        Set<String> literals = new LinkedHashSet<>();
        for (Value lit : literalList.asList()) {
            if (!lit.isSymbol() || PatternNode.isEllipsis(lit)) {
                throw EvaluationException.malformedSyntax("syntax-rules literal must be a symbol: " + lit);
            }
            literals.add(lit.asSymbol());
        }

        List<Rule> rules = new ArrayList<>();
        for (Value r : parts.subList(2, parts.size())) {
            if (!r.isList() || r.asList().size() != 2) {
                throw EvaluationException.malformedSyntax("syntax rule must be (pattern template): " + r);
            }
            Value pattern = r.asList().get(0);
            if (!pattern.isList() || pattern.isEmptyList()) {
                throw EvaluationException.malformedSyntax("syntax rule pattern must be a non-empty list: " + pattern);
            }
            List<Value> p = pattern.asList();
            Value body = Value.list(p.subList(1, p.size()));
            Set<String> ellipsisVars = new LinkedHashSet<>();
            checkPattern(body, literals, ellipsisVars, new HashSet<>());
            rules.add(new Rule(body, r.asList().get(1), ellipsisVars));
        }
        return new SyntaxRules(name, literals, rules, definitionEnv);
    }

    /**
     * Rejects misplaced ellipses and variables bound twice up front, and records
     * which variables repeat.
     */
    private static void checkPattern(Value pattern, Set<String> literals, Set<String> ellipsisVars,
                                     Set<String> seen) {
        if (pattern.isSymbol()) {
            String var = pattern.asSymbol();
            if (!literals.contains(var) && !PatternNode.isEllipsis(pattern) && !seen.add(var)) {
                throw EvaluationException.malformedSyntax("duplicate pattern variable " + var);
            }
            return;
        }
        if (!pattern.isList()) return;
        List<Value> items = pattern.asList();
        boolean sawEllipsis = false;
        for (int i = 0; i < items.size(); i++) {
            Value item = items.get(i);
            if (PatternNode.isEllipsis(item)) {
                if (i == 0 || sawEllipsis) {
                    throw EvaluationException.malformedSyntax("misplaced ellipsis in pattern " + pattern);
                }
                sawEllipsis = true;
                ellipsisVars.addAll(PatternMatcher.variables(items.get(i - 1), literals));
            } else {
                checkPattern(item, literals, ellipsisVars, seen);
            }
        }
    }

    /**
     * Expands a use of this macro.
     *
     * @param form   the whole form, head keyword included
     * @param useEnv the environment the form appears in
     */
    public Value expand(Value form, Environment useEnv) {
        List<Value> items = form.asList();
        Value operands = Value.list(items.subList(1, items.size()));
        for (Rule rule : rules) {
            Optional<MatchBindings> bindings =
                    PatternMatcher.match(rule.pattern, operands, literals, definitionEnv, useEnv);
            if (bindings.isPresent()) {
                return instantiate(rule.template, bindings.get(), rule.ellipsisVars);
            }
        }
        throw EvaluationException.noMatchingRule(name, form);
    }

    private Value instantiate(Value template, MatchBindings b, Set<String> ellipsisVars) {
        if (template.isSymbol()) {
            List<Value> forms = b.get(template.asSymbol());
            if (forms == null) return template;
            if (forms.size() != 1) {
                throw EvaluationException.malformedSyntax(
                        "pattern variable " + template + " used without ellipsis in " + name);
            }
            return forms.get(0);
        }
        if (!template.isList()) return template;

        List<Value> items = template.asList();
        // (... ...) escapes a literal ellipsis
        if (items.size() == 2 && PatternNode.isEllipsis(items.get(0))) {
            return items.get(1);
        }

        List<Value> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Value item = items.get(i);
            if (i + 1 < items.size() && PatternNode.isEllipsis(items.get(i + 1))) {
                out.addAll(repeat(item, b, ellipsisVars));
                i++;
            } else {
                out.add(instantiate(item, b, ellipsisVars));
            }
        }
        return Value.list(out);
    }

    /** Instantiates {@code sub} once per repetition of the ellipsis variables it mentions. */
    private List<Value> repeat(Value sub, MatchBindings b, Set<String> ellipsisVars) {
        List<String> driving = new ArrayList<>();
        for (String var : PatternMatcher.variables(sub, Collections.emptySet())) {
            if (ellipsisVars.contains(var) && b.has(var)) driving.add(var);
        }
        if (driving.isEmpty()) {
            throw EvaluationException.malformedSyntax("template ellipsis follows no repeated pattern variable: " + sub);
        }

        int count = b.get(driving.get(0)).size();
        for (String var : driving) {
            if (b.get(var).size() != count) {
                throw EvaluationException.malformedSyntax("ellipsis variables of unequal length in " + sub);
            }
        }

        List<Value> out = new ArrayList<>(count);
        for (int k = 0; k < count; k++) {
            MatchBindings step = b;
            for (String var : driving) {
                step = step.with(var, List.of(b.get(var).get(k)));
            }
            out.add(instantiate(sub, step, ellipsisVars));
        }
        return out;
    }
}
