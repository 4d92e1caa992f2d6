package com.scheep.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import com.scheep.debug.ConsoleDebugSink;
import com.scheep.debug.Debug;
import com.scheep.debug.DebugLevel;
import com.scheep.script.parser.Value;
import com.scheep.script.parser.utils.EnvironmentSnapshot;

/**
 * Interactive read-eval-print loop.
 *
 * Flags:
 *   --max-depth=N     compound call depth limit (default 1000)
 *   --no-prelude      skip the let/and/or/when/unless macros
 *   --debug=LEVEL     log to stderr at TRACE|DEBUG|INFO|WARN|ERROR
 *   path/to/file.scm  run the file first, then stay interactive unless --batch
 *   --batch           exit after running the file
 *
 * Input may span several lines; a form is evaluated once its parentheses balance.
 * A failing form is reported and the loop carries on with the same environment.
 */
public final class SchemeRepl {

    static final String INPUT_PROMPT = "scheep> ";
    static final String CONTINUATION_PROMPT = "   ...> ";
    static final String OUTPUT_PREFIX = ";= ";

    private final Scheep engine;
    private final BufferedReader in;
    private final PrintStream out;

    public SchemeRepl(Scheep engine, BufferedReader in, PrintStream out) {
        this.engine = engine;
        this.in = in;
        this.out = out;
        engine.setOutput(out);
        engine.setErrorReporter((e, kind, form, message) -> out.println(";! " + kind + ": " + message));
    }

    public static void main(String[] args) throws IOException {
        Map<String, String> flags = new HashMap<>();
        String script = null;
        for (String a : args) {
            if (a.startsWith("--") && a.indexOf('=') >= 0) {
                int i = a.indexOf('=');
                flags.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                flags.put(a.substring(2), "true");
            } else {
                script = a;
            }
        }

        if (flags.containsKey("debug")) {
            Debug.get().setSink(new ConsoleDebugSink(DebugLevel.parse(flags.get("debug"), DebugLevel.DEBUG)));
        }

        Scheep engine = new Scheep();
        if (flags.containsKey("max-depth")) {
            try {
                engine.setMaxCallDepth(Integer.parseInt(flags.get("max-depth")));
            } catch (IllegalArgumentException e) {
                System.err.println("Invalid --max-depth: " + flags.get("max-depth"));
                System.exit(2);
                return;
            }
        }

        SchemeRepl repl = new SchemeRepl(engine,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);

        if (!flags.containsKey("no-prelude")) engine.loadPrelude();

        if (script != null) {
            Path path = Paths.get(script);
            String source;
            try {
                source = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                System.err.println("Failed to read script file: " + path);
                e.printStackTrace(System.err);
                System.exit(3);
                return;
            }
            engine.run(source);
            if (flags.containsKey("batch")) return;
        }

        repl.out.println("Scheep. Type :help for commands.");
        repl.loop();
    }

    public void loop() throws IOException {
        StringBuilder pending = new StringBuilder();
        while (true) {
            out.print(pending.length() == 0 ? INPUT_PROMPT : CONTINUATION_PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) break; // EOF

            if (pending.length() == 0) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) continue;
                if (trimmed.startsWith(":")) {
                    if (!command(trimmed.substring(1).toLowerCase(Locale.ROOT))) return;
                    continue;
                }
            }

            pending.append(line).append('\n');
            if (openParens(pending) > 0) continue;

            Value result = engine.run(pending.toString());
            pending.setLength(0);
            if (result != null) out.println(OUTPUT_PREFIX + result);
        }
        out.println();
    }

    /** @return false when the loop should stop */
    private boolean command(String cmd) {
        switch (cmd) {
            case "help":
                out.println(":env   print the global bindings as JSON");
                out.println(":help  this text");
                out.println(":quit  leave");
                return true;
            case "env":
                out.println(EnvironmentSnapshot.globalsToJson(engine.globalEnvironment()));
                return true;
            case "quit":
            case "exit":
                return false;
            default:
                out.println("Unknown command :" + cmd + " (try :help)");
                return true;
        }
    }

    /** Unclosed '(' count, ignoring strings and comments. */
    public static int openParens(CharSequence text) {
        int depth = 0;
        boolean inString = false;
        boolean inComment = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inComment) {
                if (c == '\n') inComment = false;
            } else if (inString) {
                if (c == '\\') i++;
                else if (c == '"') inString = false;
            } else if (c == '"') {
                inString = true;
            } else if (c == ';') {
                inComment = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
        }
        return depth;
    }
}
