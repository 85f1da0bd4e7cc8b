package com.taskledger.engine.coordinator;

import com.taskledger.core.model.Task;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.Workflow;
import com.taskledger.engine.config.TaskLedgerProperties;
import com.taskledger.engine.config.TaskLedgers;
import com.taskledger.engine.persistence.JsonlEventLogStore;
import com.taskledger.engine.persistence.SnapshotIndex;
import com.taskledger.engine.service.WorkflowService.AddTaskRequest;
import com.taskledger.engine.service.WorkflowService.CreateWorkflowRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Recovery of a file-backed ledger: everything the log holds survives a restart,
 * and damage to the log or the snapshot index costs only the damaged part.
 */
@DisplayName("File Ledger Recovery Tests")
class FileLedgerRecoveryTest {

    @TempDir
    Path root;

    private final List<WorkflowCoordinator> opened = new ArrayList<>();

    @AfterEach
    void closeAll() {
        opened.forEach(WorkflowCoordinator::close);
    }

    private WorkflowCoordinator open(TaskLedgerProperties properties) {
        WorkflowCoordinator ledger = TaskLedgers.open(properties);
        opened.add(ledger);
        return ledger;
    }

    private WorkflowCoordinator open() {
        return open(TaskLedgerProperties.forRoot(root));
    }

    private Path logFile() {
        return root.resolve(JsonlEventLogStore.LOG_FILE_NAME);
    }

    @Test
    @DisplayName("State is rebuilt from the log after a restart")
    void stateSurvivesRestart() {
        WorkflowCoordinator ledger = open();
        String id = ledger.createWorkflow(CreateWorkflowRequest.of("Release")).id();
        Task build = ledger.addTask(id, AddTaskRequest.of("Build"));
        ledger.addTask(id, AddTaskRequest.of("Test", build.id()));
        ledger.setTaskStatus(id, build.id(), TaskStatus.COMPLETED, "green");
        Workflow before = ledger.getWorkflow(id);
        ledger.close();

        Workflow after = open().getWorkflow(id);

        assertThat(after).isEqualTo(before);
    }

    @Test
    @DisplayName("A corrupt line is skipped and reported; the rest of the log still loads")
    void corruptLineIsTolerated() throws Exception {
        WorkflowCoordinator ledger = open(TaskLedgerProperties.forRoot(root).withSnapshotInterval(0));
        String id = ledger.createWorkflow(CreateWorkflowRequest.of("Release")).id();
        ledger.addTask(id, AddTaskRequest.of("Build"));
        ledger.close();
        Files.deleteIfExists(root.resolve(SnapshotIndex.FILE_NAME));

        Files.writeString(logFile(), "this is not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        WorkflowCoordinator reopened = open();
        reopened.addTask(id, AddTaskRequest.of("Test"));

        assertThat(reopened.getWorkflow(id).orderedTasks()).extracting(Task::title).containsExactly("Build", "Test");
        assertThat(reopened.getCorruptionReports()).singleElement()
            .satisfies(report -> {
                assertThat(report.lineNumber()).isEqualTo(3);
                assertThat(report.rawLine()).isEqualTo("this is not json");
            });
        assertThat(reopened.getWorkflowStatus(id).corruptLines()).isEqualTo(1);
    }

    @Test
    @DisplayName("Deleting the snapshot index yields the same state")
    void snapshotIndexIsDiscardable() throws Exception {
        WorkflowCoordinator ledger = open(TaskLedgerProperties.forRoot(root).withSnapshotInterval(2));
        String id = ledger.createWorkflow(CreateWorkflowRequest.of("Release")).id();
        for (int i = 0; i < 5; i++) {
            ledger.addTask(id, AddTaskRequest.of("Task " + i));
        }
        ledger.close();
        assertThat(root.resolve(SnapshotIndex.FILE_NAME)).exists();

        Workflow fromSnapshot = open().getWorkflow(id);
        opened.forEach(WorkflowCoordinator::close);
        opened.clear();
        Files.delete(root.resolve(SnapshotIndex.FILE_NAME));
        Workflow fromLog = open().getWorkflow(id);

        assertThat(fromLog).isEqualTo(fromSnapshot);
    }

    @Test
    @DisplayName("Concurrent mutations each append one whole line")
    void concurrentMutations() throws Exception {
        WorkflowCoordinator ledger = open();
        String id = ledger.createWorkflow(CreateWorkflowRequest.of("Busy")).id();
        int writers = 50;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<Task>> results = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            String title = "Task " + i;
            results.add(pool.submit(() -> {
                start.await();
                return ledger.addTask(id, AddTaskRequest.of(title));
            }));
        }
        start.countDown();
        for (Future<Task> result : results) {
            result.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(Files.readAllLines(logFile())).hasSize(writers + 1);
        assertThat(ledger.getCorruptionReports()).isEmpty();
        Workflow workflow = ledger.getWorkflow(id);
        assertThat(workflow.taskIds()).hasSize(writers);
        assertThat(workflow.orderedTasks()).extracting(Task::position)
            .containsExactlyElementsOf(IntStream.range(0, writers).boxed().toList());

        ledger.rebuild();
        assertThat(ledger.getWorkflow(id)).isEqualTo(workflow);
    }
}
