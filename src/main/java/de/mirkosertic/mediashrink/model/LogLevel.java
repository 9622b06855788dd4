package de.mirkosertic.mediashrink.model;

public enum LogLevel {
    INFO,
    WARNING,
    ERROR
}
