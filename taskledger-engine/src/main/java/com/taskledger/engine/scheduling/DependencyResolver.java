package com.taskledger.engine.scheduling;

import com.taskledger.core.model.Task;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.Workflow;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the next batch of runnable tasks.
 *
 * A task is eligible when it is PENDING and every task it depends on is COMPLETED.
 * A SKIPPED dependency does not satisfy its dependents. The whole computation is one
 * pass to collect completed ids plus one pass over the tasks in position order, so
 * the work is linear in tasks plus dependency edges.
 */
public class DependencyResolver {

    /**
     * All eligible tasks, in position order.
     */
    public List<Task> nextBatch(Workflow workflow) {
        return nextBatch(workflow, 0);
    }

    /**
     * Eligible tasks in position order.
     *
     * @param limit maximum batch size; 0 or less means no limit
     * @return an empty list when the workflow is not active
     */
    public List<Task> nextBatch(Workflow workflow, int limit) {
        if (!workflow.status().allowsScheduling()) {
            return List.of();
        }

        Set<String> completed = new HashSet<>();
        for (Task task : workflow.tasks().values()) {
            if (task.status() == TaskStatus.COMPLETED) {
                completed.add(task.id());
            }
        }

        List<Task> batch = new ArrayList<>();
        for (String taskId : workflow.taskIds()) {
            Task task = workflow.tasks().get(taskId);
            if (task.status() == TaskStatus.PENDING && completed.containsAll(task.dependsOn())) {
                batch.add(task);
                if (limit > 0 && batch.size() >= limit) {
                    break;
                }
            }
        }
        return batch;
    }

    /**
     * Tasks that cannot start because a dependency is not complete, with the ids they wait on.
     * Explicitly BLOCKED tasks are included with an empty wait list.
     */
    public List<Blocker> blockers(Workflow workflow) {
        List<Blocker> blockers = new ArrayList<>();
        for (Task task : workflow.orderedTasks()) {
            if (task.status() == TaskStatus.BLOCKED) {
                blockers.add(new Blocker(task, List.of()));
                continue;
            }
            if (task.status() != TaskStatus.PENDING) {
                continue;
            }
            List<String> waitingOn = new ArrayList<>();
            for (String dependencyId : task.dependsOn()) {
                boolean done = workflow.findTask(dependencyId)
                    .map(dependency -> dependency.status() == TaskStatus.COMPLETED)
                    .orElse(false);
                if (!done) {
                    waitingOn.add(dependencyId);
                }
            }
            if (!waitingOn.isEmpty()) {
                blockers.add(new Blocker(task, waitingOn));
            }
        }
        return blockers;
    }

    /**
     * A task held back, and the dependencies it is waiting for.
     */
    public record Blocker(Task task, List<String> waitingOn) {
        public Blocker {
            waitingOn = List.copyOf(waitingOn);
        }
    }
}
