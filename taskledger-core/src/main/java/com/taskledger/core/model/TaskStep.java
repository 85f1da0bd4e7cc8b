package com.taskledger.core.model;

import java.time.Instant;

/**
 * A small checklist item inside a task.
 *
 * @param estimatedMinutes rough size, or null when not given
 * @param verificationCommand command that proves the step is done, or null
 * @param evidence what the completer offered as proof, or null
 */
public record TaskStep(
    String id,
    String description,
    Integer estimatedMinutes,
    String verificationCommand,
    boolean completed,
    Instant completedAt,
    String evidence
) {
    public static TaskStep create(String id, String description, Integer estimatedMinutes, String verificationCommand) {
        return new TaskStep(id, description, estimatedMinutes, verificationCommand, false, null, null);
    }

    public TaskStep complete(Instant at, String evidence) {
        return new TaskStep(id, description, estimatedMinutes, verificationCommand, true, at, evidence);
    }
}
