package com.scheep.debug;

import java.io.PrintStream;

/** Writes messages at or above a threshold to a stream, stderr by default. */
public final class ConsoleDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel threshold;

    public ConsoleDebugSink(DebugLevel threshold) {
        this(System.err, threshold);
    }

    public ConsoleDebugSink(PrintStream out, DebugLevel threshold) {
        this.out = out;
        this.threshold = (threshold == null) ? DebugLevel.INFO : threshold;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(threshold)) return;
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null) error.printStackTrace(out);
    }
}
