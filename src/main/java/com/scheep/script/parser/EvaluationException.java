package com.scheep.script.parser;

/**
 * Failure raised by the evaluator, the applier or a primitive. The evaluator never
 * recovers from these; they propagate to whoever called {@code evaluate}.
 */
public class EvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNBOUND_VARIABLE("unbound_variable"),
        NOT_A_PROCEDURE("not_a_procedure"),
        UNKNOWN_EXPRESSION_TYPE("unknown_expression_type"),
        MALFORMED_SYNTAX("malformed_syntax"),
        ARITY_MISMATCH("arity_mismatch"),
        WRONG_TYPE("wrong_type"),
        RECURSION_DEPTH_EXCEEDED("recursion_depth_exceeded"),
        NO_MATCHING_RULE("no_matching_rule");

        /** Stable name reported to error callbacks. */
        public final String tag;

        Kind(String tag) {
            this.tag = tag;
        }
    }

    private final Kind kind;

    public EvaluationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static EvaluationException unboundVariable(String name) {
        return new EvaluationException(Kind.UNBOUND_VARIABLE, "Unbound variable: " + name);
    }

    public static EvaluationException notAProcedure(Value value) {
        return new EvaluationException(Kind.NOT_A_PROCEDURE, "Not a procedure: " + value);
    }

    public static EvaluationException unknownExpressionType(Value expr) {
        return new EvaluationException(Kind.UNKNOWN_EXPRESSION_TYPE, "Unknown expression type: " + expr);
    }

    public static EvaluationException malformedSyntax(String detail) {
        return new EvaluationException(Kind.MALFORMED_SYNTAX, "Malformed syntax: " + detail);
    }

    public static EvaluationException arityMismatch(String name, int expected, int got) {
        String who = (name == null) ? "procedure" : name;
        return new EvaluationException(Kind.ARITY_MISMATCH,
                who + " expects " + expected + " arguments, got " + got);
    }

    public static EvaluationException arityAtLeast(String name, int min, int got) {
        return new EvaluationException(Kind.ARITY_MISMATCH,
                name + " expects at least " + min + " arguments, got " + got);
    }

    public static EvaluationException wrongType(String detail) {
        return new EvaluationException(Kind.WRONG_TYPE, detail);
    }

    public static EvaluationException recursionDepthExceeded(int limit) {
        return new EvaluationException(Kind.RECURSION_DEPTH_EXCEEDED,
                "Maximum call depth exceeded (" + limit + ")");
    }

    public static EvaluationException noMatchingRule(String macro, Value form) {
        return new EvaluationException(Kind.NO_MATCHING_RULE,
                "No syntax rule of " + macro + " matches " + form);
    }
}
