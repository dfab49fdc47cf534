package com.elara.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub shared by the compiler stages and the Series runtime.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...), no-op until one is installed
 * - Entries under the minimum level never reach the sink
 */
public final class Debug {

    // must be assigned before INSTANCE is constructed
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // no sink installed
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel minLevel = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setMinLevel(DebugLevel level) {
        this.minLevel = level == null ? DebugLevel.TRACE : level;
    }

    public DebugLevel getMinLevel() {
        return minLevel;
    }

    /** True when an entry at this level would be delivered; use to skip building costly messages. */
    public boolean isLoggable(DebugLevel level) {
        return sinkRef.get() != NOOP && level.isAtLeast(minLevel);
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.isAtLeast(minLevel)) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
