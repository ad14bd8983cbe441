package com.numu.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide debug hub for the numu engine.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...); the default sink drops everything
 * - Messages below the minimum level never reach the sink; hot paths check
 *   isEnabled(...) before building a message
 */
public final class Debug {

    // must precede INSTANCE: the constructor reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // drop
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
        minLevel = (level == null) ? DebugLevel.TRACE : level;
    }

    public DebugLevel getMinLevel() {
        return minLevel;
    }

    /** False when nothing logged at this level would be seen. */
    public boolean isEnabled(DebugLevel level) {
        return sinkRef.get() != NOOP && level.ordinal() >= minLevel.ordinal();
    }

    /** Back to the no-op sink and TRACE threshold. */
    public void reset() {
        sinkRef.set(NOOP);
        minLevel = DebugLevel.TRACE;
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void w(String tag, String msg, Throwable err) { log(DebugLevel.WARN, tag, msg, err); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < minLevel.ordinal()) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
