package com.shellbridge.core.model;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean isAtLeast(LogLevel threshold) {
        return ordinal() >= threshold.ordinal();
    }
}
