package org.storagelayout.junit.logging;

/**
 * Levels the log watch distinguishes. Anything below INFO is never checked.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
