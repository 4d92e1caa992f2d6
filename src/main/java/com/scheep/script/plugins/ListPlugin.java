package com.scheep.script.plugins;

import java.util.ArrayList;
import java.util.List;

import com.scheep.script.Scheep;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Value;

/**
 * ListPlugin
 *
 * List primitives. Lists are proper lists only; there are no dotted pairs, so
 * consing onto a non-list wraps the tail in a one-element list.
 */
public final class ListPlugin {

    private ListPlugin() {}

    public static void register(Scheep engine) {

        engine.registerFunction("car", args -> {
            requireArgs("car", args, 1);
            List<Value> l = nonEmpty("car", args.get(0));
            return l.get(0);
        });

        engine.registerFunction("cdr", args -> {
            requireArgs("cdr", args, 1);
            List<Value> l = nonEmpty("cdr", args.get(0));
            return Value.list(l.subList(1, l.size()));
        });

        engine.registerFunction("cons", args -> {
            requireArgs("cons", args, 2);
            Value tail = args.get(1);
            List<Value> out = new ArrayList<>();
            out.add(args.get(0));
            if (tail.isList()) out.addAll(tail.asList());
            else out.add(tail);
            return Value.list(out);
        });

        engine.registerFunction("list", args -> Value.list(args));

        engine.registerFunction("null?", args -> {
            requireArgs("null?", args, 1);
            return Value.bool(args.get(0).isEmptyList());
        });

        engine.registerFunction("pair?", args -> {
            requireArgs("pair?", args, 1);
            return Value.bool(args.get(0).isList() && !args.get(0).isEmptyList());
        });

        engine.registerFunction("length", args -> {
            requireArgs("length", args, 1);
            return Value.number(list("length", args.get(0)).size());
        });

        engine.registerFunction("eq?", args -> {
            requireArgs("eq?", args, 2);
            return Value.bool(identical(args.get(0), args.get(1)));
        });

        engine.registerFunction("equal?", args -> {
            requireArgs("equal?", args, 2);
            return Value.bool(args.get(0).equals(args.get(1)));
        });
    }

    /** Atoms compare by value, lists and procedures by identity; the empty list is unique. */
    private static boolean identical(Value a, Value b) {
        if (a == b) return true;
        if (a.getType() != b.getType()) return false;
        switch (a.getType()) {
            case NUMBER:
            case BOOL:
            case STRING:
            case SYMBOL:
                return a.equals(b);
            case LIST:
                return a.isEmptyList() && b.isEmptyList();
            default:
                return a.value == b.value;
        }
    }

    private static List<Value> list(String fn, Value v) {
        if (!v.isList()) throw EvaluationException.wrongType(fn + " expects a list, got " + v.describe());
        return v.asList();
    }

    private static List<Value> nonEmpty(String fn, Value v) {
        List<Value> l = list(fn, v);
        if (l.isEmpty()) throw EvaluationException.wrongType(fn + " of the empty list");
        return l;
    }

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) throw EvaluationException.arityMismatch(fn, n, args.size());
    }
}
