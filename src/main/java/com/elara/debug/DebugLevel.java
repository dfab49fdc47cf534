package com.elara.debug;

/** Severity of a debug entry, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean isAtLeast(DebugLevel other) {
        return ordinal() >= other.ordinal();
    }
}
