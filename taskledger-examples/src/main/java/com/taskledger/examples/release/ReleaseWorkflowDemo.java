package com.taskledger.examples.release;

import com.taskledger.core.exception.CycleException;
import com.taskledger.core.model.*;
import com.taskledger.engine.config.TaskLedgerProperties;
import com.taskledger.engine.config.TaskLedgers;
import com.taskledger.engine.coordinator.WorkflowCoordinator;
import com.taskledger.engine.service.WorkflowService.AddTaskRequest;
import com.taskledger.engine.service.WorkflowService.CreateWorkflowRequest;
import com.taskledger.engine.service.WorkflowService.StepRequest;
import com.taskledger.engine.service.WorkflowStatusSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Demonstration runner for a small release workflow kept in a file-backed ledger.
 *
 * Shows:
 * 1. Batch scheduling over a diamond of dependencies
 * 2. Checkpoint and restore
 * 3. Cycle rejection
 * 4. Ledger restart (state rebuilt from the event log)
 *
 * Pass a directory as the first argument to keep the ledger; otherwise a temp directory is used.
 */
public class ReleaseWorkflowDemo {

    private static final Logger log = LoggerFactory.getLogger(ReleaseWorkflowDemo.class);

    private final TaskLedgerProperties properties;

    private String workflowId;
    private String buildTaskId;
    private String publishTaskId;

    ReleaseWorkflowDemo(TaskLedgerProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) throws Exception {
        Path root = args.length > 0 ? Path.of(args[0]) : Files.createTempDirectory("taskledger-demo");
        ReleaseWorkflowDemo demo = new ReleaseWorkflowDemo(TaskLedgerProperties.forRoot(root));

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║          TASK LEDGER - RELEASE WORKFLOW DEMONSTRATION                ║");
        log.info("╠══════════════════════════════════════════════════════════════════════╣");
        log.info("║  Event-sourced tasks, dependency batches and checkpoints             ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
        log.info("Ledger directory: {}", root);

        try (WorkflowCoordinator ledger = TaskLedgers.open(demo.properties)) {
            demo.runScenario1_BatchScheduling(ledger);
            demo.runScenario2_CheckpointRestore(ledger);
            demo.runScenario3_CycleRejection(ledger);
        }
        demo.runScenario4_Restart();

        log.info("");
        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    ALL DEMONSTRATIONS COMPLETE                       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
    }

    /**
     * SCENARIO 1: build, then test and docs in parallel, then publish.
     */
    void runScenario1_BatchScheduling(WorkflowCoordinator ledger) {
        banner("SCENARIO 1: Batch Scheduling");

        Workflow workflow = ledger.createWorkflow(
            new CreateWorkflowRequest("Release 2.4", "Cut and publish the 2.4 release", "taskledger", Set.of("release")));
        workflowId = workflow.id();

        Task build = ledger.addTask(workflowId, AddTaskRequest.of("Build artifacts").withSteps(
            new StepRequest("Compile modules", 5, "mvn -q compile"),
            new StepRequest("Package jars", 2, "mvn -q package -DskipTests")));
        Task test = ledger.addTask(workflowId, AddTaskRequest.of("Run test suite", build.id()));
        Task docs = ledger.addTask(workflowId, AddTaskRequest.of("Update docs", build.id()));
        Task publish = ledger.addTask(workflowId, AddTaskRequest.of("Publish", test.id(), docs.id()));
        buildTaskId = build.id();
        publishTaskId = publish.id();

        int batch = 0;
        List<Task> started = ledger.startNextBatch(workflowId, 0);
        while (!started.isEmpty()) {
            batch++;
            log.info("Batch {}: {}", batch, titles(started));
            for (Task task : started) {
                for (TaskStep step : task.steps()) {
                    ledger.completeStep(workflowId, task.id(), step.id(), "exit 0: " + step.verificationCommand());
                }
                ledger.setTaskStatus(workflowId, task.id(), TaskStatus.COMPLETED, "done in batch " + batch);
            }
            started = ledger.startNextBatch(workflowId, 0);
        }

        Progress progress = ledger.getWorkflow(workflowId).progress();
        log.info("✓ {} batches, {}/{} tasks completed ({}%)",
            batch, progress.completed(), progress.total(), progress.percentage());
    }

    /**
     * SCENARIO 2: checkpoint, keep working, restore the earlier view.
     */
    void runScenario2_CheckpointRestore(WorkflowCoordinator ledger) {
        banner("SCENARIO 2: Checkpoint and Restore");

        Checkpoint checkpoint = ledger.createCheckpoint(workflowId, "release published", CheckpointReason.PHASE_COMPLETE);
        log.info("Checkpoint {} at log position {}", checkpoint.id(), checkpoint.logPosition());

        ledger.setTaskStatus(workflowId, publishTaskId, TaskStatus.BLOCKED, "registry rejected the upload");
        log.info("Publish is now {}", ledger.getWorkflow(workflowId).findTask(publishTaskId)
            .map(Task::status).orElseThrow());

        Workflow restored = ledger.restoreCheckpoint(checkpoint.id());
        log.info("✓ Restored view: publish was {}, live ledger still has {} checkpoint(s)",
            restored.findTask(publishTaskId).map(Task::status).orElseThrow(),
            ledger.listCheckpoints(workflowId).size());
    }

    /**
     * SCENARIO 3: a dependency that would close a loop is refused.
     */
    void runScenario3_CycleRejection(WorkflowCoordinator ledger) {
        banner("SCENARIO 3: Cycle Rejection");

        try {
            ledger.addDependency(workflowId, buildTaskId, publishTaskId);
            log.error("✗ Cycle was accepted");
        } catch (CycleException e) {
            log.info("✓ Rejected: {}", String.join(" -> ", e.getCyclePath()));
        }
    }

    /**
     * SCENARIO 4: reopen the ledger and compare.
     */
    void runScenario4_Restart() {
        banner("SCENARIO 4: Restart");

        try (WorkflowCoordinator reopened = TaskLedgers.open(properties)) {
            WorkflowStatusSummary status = reopened.getWorkflowStatus(workflowId);
            log.info("✓ Rebuilt '{}' ({}): {}/{} completed, {} recent event(s), last checkpoint {}",
                status.title(), status.status().value(),
                status.progress().completed(), status.progress().total(),
                status.recentEvents().size(),
                status.lastCheckpoint() == null ? "none" : status.lastCheckpoint().id());
        }
    }

    private static void banner(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════════════");
    }

    private static String titles(List<Task> tasks) {
        return tasks.stream().map(Task::title).collect(Collectors.joining(", "));
    }
}
