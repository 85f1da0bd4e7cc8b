package com.taskledger.core.model;

/**
 * Completion counters for a workflow.
 */
public record Progress(
    int total,
    int completed,
    int skipped,
    int percentage
) {
    public static Progress of(int total, int completed, int skipped) {
        int percentage = total > 0 ? Math.round(completed * 100f / total) : 0;
        return new Progress(total, completed, skipped, percentage);
    }
}
