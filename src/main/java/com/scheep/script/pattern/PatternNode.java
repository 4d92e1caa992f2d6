package com.scheep.script.pattern;

import java.util.List;
import java.util.Set;

import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Value;

/**
 * Classification of the head of a pattern list. The matcher switches over
 * {@link Kind} exhaustively instead of dispatching on the runtime class of the
 * pattern element.
 */
final class PatternNode {

    static final String ELLIPSIS = "...";

    enum Kind {
        /** No pattern elements left. */
        EMPTY,
        /** A symbol that captures one form. */
        VARIABLE,
        /** A symbol from the literal set; matched by binding identity. */
        LITERAL,
        /** {@code p ...}: zero or more repetitions of {@code p}. */
        ELLIPSIS,
        /** A nested pattern list matched against a nested form. */
        SUBLIST,
        /** A number, string or boolean; matched by equality. */
        DATUM
    }

    final Kind kind;
    /** The head pattern element (for ELLIPSIS, the repeated sub-pattern); null for EMPTY. */
    final Value element;

    private PatternNode(Kind kind, Value element) {
        this.kind = kind;
        this.element = element;
    }

    static PatternNode classify(List<Value> pattern, Set<String> literals) {
        if (pattern.isEmpty()) return new PatternNode(Kind.EMPTY, null);

        Value head = pattern.get(0);
        if (isEllipsis(head)) {
            throw EvaluationException.malformedSyntax("ellipsis must follow a sub-pattern: " + Value.list(pattern));
        }
        if (pattern.size() > 1 && isEllipsis(pattern.get(1))) {
            return new PatternNode(Kind.ELLIPSIS, head);
        }
        if (head.isSymbol()) {
            return new PatternNode(literals.contains(head.asSymbol()) ? Kind.LITERAL : Kind.VARIABLE, head);
        }
        if (head.isList()) return new PatternNode(Kind.SUBLIST, head);
        return new PatternNode(Kind.DATUM, head);
    }

    static boolean isEllipsis(Value v) {
        return v.isSymbol(ELLIPSIS);
    }
}
