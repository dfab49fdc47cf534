package com.elara.debug;

import java.io.PrintStream;

/** Writes "LEVEL [tag] message" lines to a stream. */
public final class ConsoleDebugSink implements DebugSink {

    private final PrintStream out;

    public ConsoleDebugSink(PrintStream out) {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        this.out = out;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        synchronized (out) {
            out.println(level + " [" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
