package com.scheep.script.plugins;

import java.util.List;

import com.scheep.script.Scheep;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Value;

/**
 * OutputPlugin
 *
 * display and newline, writing to the engine's output stream (see
 * {@link Scheep#setOutput}). The stream is looked up on every call.
 */
public final class OutputPlugin {

    private OutputPlugin() {}

    public static void register(Scheep engine) {

        engine.registerFunction("display", args -> {
            requireArgs("display", args, 1);
            engine.output().print(args.get(0).display());
            engine.output().flush();
            return Value.OK;
        });

        engine.registerFunction("newline", args -> {
            requireArgs("newline", args, 0);
            engine.output().println();
            engine.output().flush();
            return Value.OK;
        });
    }

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) throw EvaluationException.arityMismatch(fn, n, args.size());
    }
}
