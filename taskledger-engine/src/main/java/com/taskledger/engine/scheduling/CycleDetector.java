package com.taskledger.engine.scheduling;

import com.taskledger.core.exception.CycleException;
import com.taskledger.core.model.Task;
import com.taskledger.core.model.Workflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks dependency edges before they are written.
 *
 * An edge {@code task -> dependency} closes a cycle exactly when {@code task} is
 * already reachable from {@code dependency} through existing edges. Checking at
 * insertion keeps the dependency graph of every workflow acyclic.
 */
public class CycleDetector {

    /**
     * Find the cycle that giving {@code taskId} the proposed dependencies would create.
     *
     * @return the cycle as a path starting and ending at {@code taskId}, or empty if none
     */
    public Optional<List<String>> findCycle(Workflow workflow, String taskId, Collection<String> proposedDependsOn) {
        for (String dependencyId : proposedDependsOn) {
            if (dependencyId.equals(taskId)) {
                return Optional.of(List.of(taskId, taskId));
            }
            Optional<List<String>> path = findPath(workflow, dependencyId, taskId);
            if (path.isPresent()) {
                List<String> cycle = new ArrayList<>();
                cycle.add(taskId);
                cycle.addAll(path.get());
                return Optional.of(cycle);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws CycleException if the proposed dependencies would create a cycle
     */
    public void requireAcyclic(Workflow workflow, String taskId, Collection<String> proposedDependsOn) {
        findCycle(workflow, taskId, proposedDependsOn).ifPresent(cycle -> {
            throw new CycleException(workflow.id(), cycle);
        });
    }

    /**
     * Iterative depth-first search along dependsOn edges.
     */
    private Optional<List<String>> findPath(Workflow workflow, String from, String to) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        parent.put(from, null);
        stack.push(from);

        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(to)) {
                List<String> path = new ArrayList<>();
                for (String node = current; node != null; node = parent.get(node)) {
                    path.add(node);
                }
                Collections.reverse(path);
                return Optional.of(path);
            }
            Task task = workflow.tasks().get(current);
            if (task == null) {
                continue;
            }
            for (String next : task.dependsOn()) {
                if (!parent.containsKey(next)) {
                    parent.put(next, current);
                    stack.push(next);
                }
            }
        }
        return Optional.empty();
    }
}
