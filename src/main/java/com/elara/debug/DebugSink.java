package com.elara.debug;

/** Pluggable debug output target (stderr, a test collector, a host logger). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
