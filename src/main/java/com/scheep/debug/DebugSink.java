package com.scheep.debug;

/** Pluggable debug output target (stderr, test collector, file, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
