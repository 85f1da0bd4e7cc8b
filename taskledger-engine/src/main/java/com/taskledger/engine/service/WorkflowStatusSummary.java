package com.taskledger.engine.service;

import com.taskledger.core.model.Checkpoint;
import com.taskledger.core.model.Event;
import com.taskledger.core.model.Progress;
import com.taskledger.core.model.Task;
import com.taskledger.core.model.WorkflowStatus;
import com.taskledger.engine.scheduling.DependencyResolver.Blocker;

import java.util.List;

/**
 * Point-in-time overview of one workflow.
 *
 * @param inProgress tasks currently IN_PROGRESS, in position order
 * @param blockers tasks held back by incomplete dependencies or marked BLOCKED
 * @param nextActions the first few tasks of the next batch
 * @param recentEvents the workflow's latest events, oldest first
 * @param lastCheckpoint most recent checkpoint, or null
 * @param corruptLines corrupt lines in the whole log, not only this workflow's
 */
public record WorkflowStatusSummary(
    String workflowId,
    String title,
    WorkflowStatus status,
    Progress progress,
    List<Task> inProgress,
    List<Blocker> blockers,
    List<Task> nextActions,
    List<Event> recentEvents,
    Checkpoint lastCheckpoint,
    int corruptLines
) {
    public WorkflowStatusSummary {
        inProgress = List.copyOf(inProgress);
        blockers = List.copyOf(blockers);
        nextActions = List.copyOf(nextActions);
        recentEvents = List.copyOf(recentEvents);
    }
}
