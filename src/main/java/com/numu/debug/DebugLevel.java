package com.numu.debug;

public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
