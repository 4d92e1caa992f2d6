package com.scheep.script;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.scheep.debug.Debug;
import com.scheep.script.parser.CoreForms;
import com.scheep.script.parser.Environment;
import com.scheep.script.parser.EvaluationException;
import com.scheep.script.parser.Evaluator;
import com.scheep.script.parser.ParseException;
import com.scheep.script.parser.Parser;
import com.scheep.script.parser.PrimitiveProcedure;
import com.scheep.script.parser.SpecialForm;
import com.scheep.script.parser.SpecialForms;
import com.scheep.script.parser.Value;
import com.scheep.script.plugins.ArithmeticPlugin;
import com.scheep.script.plugins.ListPlugin;
import com.scheep.script.plugins.OutputPlugin;

/**
 * Core Scheep engine.
 *
 * - Owns the primitive table, the special-form registry and the configuration
 * - Builds the global environment on first use; from then on the special-form
 *   registry is sealed and the call-depth limit is fixed
 * - Primitives: arithmetic, list and output plugins are registered by default,
 *   more can be added with registerFunction(...)
 * - Macros: loadPrelude() defines let, let*, and, or, when, unless via syntax-rules
 */
public class Scheep {

    private static final String TAG = "scheep.engine";
    static final String PRELUDE_RESOURCE = "/scheep/prelude.scm";

    /** Functional interface for primitive procedures. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    /** Error reporter hook used to surface failing top-level forms to the host. */
    public interface ErrorReporter {
        /**
         * @param form the top-level form that failed, or null when reading failed
         * @param kind stable error name, e.g. "unbound_variable" or "parse"
         */
        void report(RuntimeException e, String kind, Value form, String message);
    }

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private final SpecialForms forms = new SpecialForms();
    private int maxCallDepth = Evaluator.DEFAULT_MAX_CALL_DEPTH;
    private PrintStream output = System.out;

    /*
     * ERROR HANDLING CONTRACT:
     *
     * - No reporter registered: failures THROW to the host.
     * - Reporter registered: each failing top-level form is reported and skipped,
     *   run(...) continues with the next form and nothing escapes.
     */
    private ErrorReporter errorReporter = null;

    private Evaluator evaluator;
    private Environment global;

    public Scheep() {
        CoreForms.registerAll(forms);
        ArithmeticPlugin.register(this);
        ListPlugin.register(this);
        OutputPlugin.register(this);
    }

    // ===================== CONFIGURATION =====================

    public void setMaxCallDepth(int depth) {
        requireNotStarted("setMaxCallDepth");
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setErrorReporter(ErrorReporter reporter) { this.errorReporter = reporter; }

    public void setOutput(PrintStream out) { this.output = (out == null) ? System.out : out; }

    /** Stream that display/newline write to. */
    public PrintStream output() { return output; }

    // ===================== REGISTRATION =====================

    /**
     * Adds a primitive. Before start-up it goes into the table the global
     * environment is built from; afterwards it is defined in the global frame.
     */
    public void registerFunction(String name, BuiltinFunction fn) {
        if (global == null) {
            functions.put(name, fn);
        } else {
            global.define(name, Value.primitive(new PrimitiveProcedure(name, fn)));
        }
    }

    /** Start-up only: the registry is sealed once the engine has started. */
    public void registerSpecialForm(String tag, SpecialForm handler) {
        forms.register(tag, handler);
    }

    // ===================== EVALUATION =====================

    public Environment globalEnvironment() {
        start();
        return global;
    }

    public Evaluator evaluator() {
        start();
        return evaluator;
    }

    /** Evaluates one already-read expression in the global environment. */
    public Value eval(Value expr) {
        start();
        return evaluator.evaluate(expr, global);
    }

    public Value apply(Value procedure, List<Value> args) {
        start();
        return evaluator.apply(procedure, args);
    }

    /**
     * Reads every top-level form of {@code source} and evaluates them in order.
     *
     * @return the value of the last form, or null when there is none (or the
     *         last one failed and was reported)
     */
    public Value run(String source) {
        start();

        List<Value> program;
        try {
            program = Parser.read(source);
        } catch (ParseException e) {
            onError(e, "parse", null);
            return null;
        } catch (StackOverflowError e) {
            onError(tooDeep(), EvaluationException.Kind.RECURSION_DEPTH_EXCEEDED.tag, null);
            return null;
        }

        Value last = null;
        for (Value form : program) {
            try {
                last = evaluator.evaluate(form, global);
            } catch (EvaluationException e) {
                onError(e, e.getKind().tag, form);
                last = null;
            } catch (RuntimeException e) {
                onError(e, "exception", form);
                last = null;
            } catch (StackOverflowError e) {
                // nesting that never passes through a counted call, e.g. a deeply nested literal form
                onError(tooDeep(), EvaluationException.Kind.RECURSION_DEPTH_EXCEEDED.tag, form);
                last = null;
            }
        }
        return last;
    }

    /** Evaluates the bundled prelude of derived forms written as macros. */
    public void loadPrelude() {
        String source = readResource(PRELUDE_RESOURCE);
        ErrorReporter saved = errorReporter;
        errorReporter = null;
        try {
            run(source);
        } finally {
            errorReporter = saved;
        }
        Debug.get().d(TAG, "prelude loaded from " + PRELUDE_RESOURCE);
    }

    private void start() {
        if (evaluator != null) return;
        global = Environment.makeGlobalEnvironment(functions);
        evaluator = new Evaluator(forms, maxCallDepth);
        Debug.get().i(TAG, "started with " + functions.size() + " primitives, max call depth " + maxCallDepth);
    }

    private EvaluationException tooDeep() {
        return EvaluationException.recursionDepthExceeded(maxCallDepth);
    }

    private void requireNotStarted(String what) {
        if (evaluator != null) throw new IllegalStateException(what + " must be called before the engine starts");
    }

    private void onError(RuntimeException e, String kind, Value form) {
        String message = (e.getMessage() == null) ? e.toString() : e.getMessage();
        if (errorReporter == null) {
            throw e;
        }
        Debug.get().w(TAG, kind + ": " + message);
        try {
            errorReporter.report(e, kind, form, message);
        } catch (RuntimeException re) {
            Debug.get().e(TAG, "error reporter failed while reporting: " + message, re);
        }
    }

    private static String readResource(String path) {
        try (InputStream in = Scheep.class.getResourceAsStream(path)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + path);
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            in.transferTo(buf);
            return buf.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
