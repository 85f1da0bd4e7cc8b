package com.taskledger.core.model;

/**
 * A log line that could not be decoded.
 * The line is skipped during replay; lines before and after it are still used.
 */
public record CorruptionReport(
    long lineNumber,
    String rawLine,
    String error
) {}
