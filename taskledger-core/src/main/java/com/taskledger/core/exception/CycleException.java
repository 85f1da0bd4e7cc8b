package com.taskledger.core.exception;

import java.util.List;

/**
 * Thrown when a proposed dependency edge would close a cycle in a workflow's task graph.
 */
public class CycleException extends TaskLedgerException {
    
    public static final String ERROR_CODE = "DEPENDENCY_CYCLE";
    
    private final List<String> cyclePath;
    
    public CycleException(String workflowId, List<String> cyclePath) {
        super(ERROR_CODE, String.format(
            "Dependency would create a cycle in workflow %s: %s",
            workflowId, String.join(" -> ", cyclePath)
        ));
        this.cyclePath = List.copyOf(cyclePath);
    }
    
    /**
     * Task ids along the cycle, starting and ending with the same task.
     */
    public List<String> getCyclePath() {
        return cyclePath;
    }
}
