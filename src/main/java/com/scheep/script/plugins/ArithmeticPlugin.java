package com.scheep.script.plugins;

import java.util.List;

import com.scheep.script.Scheep;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Value;

/**
 * ArithmeticPlugin
 *
 * Numeric primitives over doubles (no numeric tower).
 *
 * Usage:
 *   ArithmeticPlugin.register(engine);
 *
 * Then in scripts:
 *   (+ 1 2 3)      ; 6
 *   (- 10)         ; -10
 *   (< 1 2 3)      ; #t
 */
public final class ArithmeticPlugin {

    private ArithmeticPlugin() {}

    private interface Comparison {
        boolean test(double a, double b);
    }

    public static void register(Scheep engine) {

        engine.registerFunction("+", args -> {
            double sum = 0;
            for (int i = 0; i < args.size(); i++) sum += num("+", args, i);
            return Value.number(sum);
        });

        engine.registerFunction("*", args -> {
            double product = 1;
            for (int i = 0; i < args.size(); i++) product *= num("*", args, i);
            return Value.number(product);
        });

        engine.registerFunction("-", args -> {
            requireAtLeast("-", args, 1);
            double first = num("-", args, 0);
            if (args.size() == 1) return Value.number(-first);
            for (int i = 1; i < args.size(); i++) first -= num("-", args, i);
            return Value.number(first);
        });

        engine.registerFunction("/", args -> {
            requireAtLeast("/", args, 1);
            double first = num("/", args, 0);
            if (args.size() == 1) return Value.number(divide(1, first));
            for (int i = 1; i < args.size(); i++) first = divide(first, num("/", args, i));
            return Value.number(first);
        });

        compare(engine, "=", (a, b) -> a == b);
        compare(engine, "<", (a, b) -> a < b);
        compare(engine, ">", (a, b) -> a > b);
        compare(engine, "<=", (a, b) -> a <= b);
        compare(engine, ">=", (a, b) -> a >= b);

        engine.registerFunction("not", args -> {
            requireArgs("not", args, 1);
            return Value.bool(!args.get(0).isTrue());
        });
    }

    /** Chained comparison: true when every adjacent pair satisfies {@code cmp}. */
    private static void compare(Scheep engine, String name, Comparison cmp) {
        engine.registerFunction(name, args -> {
            requireAtLeast(name, args, 2);
            boolean ok = true;
            for (int i = 1; i < args.size(); i++) {
                if (!cmp.test(num(name, args, i - 1), num(name, args, i))) ok = false;
            }
            return Value.bool(ok);
        });
    }

    private static double divide(double a, double b) {
        if (b == 0) throw EvaluationException.wrongType("Division by zero");
        return a / b;
    }

    private static double num(String fn, List<Value> args, int i) {
        Value v = args.get(i);
        if (v.getType() != Value.Type.NUMBER) {
            throw EvaluationException.wrongType(fn + " expects numbers, argument " + (i + 1) + " is " + v.describe());
        }
        return v.asNumber();
    }

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) throw EvaluationException.arityMismatch(fn, n, args.size());
    }

    private static void requireAtLeast(String fn, List<Value> args, int n) {
        if (args.size() < n) throw EvaluationException.arityAtLeast(fn, n, args.size());
    }
}
