package com.numu.debug;

/** Receives every message that passes the hub's level filter. error may be null. */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
