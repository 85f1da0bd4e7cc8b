package com.taskledger.engine.coordinator;

import com.taskledger.core.exception.CycleException;
import com.taskledger.core.exception.NotFoundException;
import com.taskledger.core.exception.ValidationException;
import com.taskledger.core.model.Checkpoint;
import com.taskledger.core.model.CheckpointReason;
import com.taskledger.core.model.Event;
import com.taskledger.core.model.Task;
import com.taskledger.core.model.TaskPriority;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskStep;
import com.taskledger.core.model.Workflow;
import com.taskledger.core.model.WorkflowStatus;
import com.taskledger.engine.config.TaskLedgerProperties;
import com.taskledger.engine.metrics.LedgerMetrics;
import com.taskledger.engine.persistence.EventCodec;
import com.taskledger.engine.persistence.InMemoryEventLogStore;
import com.taskledger.engine.service.WorkflowService.AddTaskRequest;
import com.taskledger.engine.service.WorkflowService.CreateWorkflowRequest;
import com.taskledger.engine.service.WorkflowService.StepRequest;
import com.taskledger.engine.service.WorkflowService.TaskFilter;
import com.taskledger.engine.service.WorkflowService.TaskPatch;
import com.taskledger.engine.service.WorkflowService.WorkflowFilter;
import com.taskledger.engine.service.WorkflowService.WorkflowPatch;
import com.taskledger.engine.service.WorkflowStatusSummary;
import com.taskledger.engine.test.TimeController;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Workflow Coordinator Tests")
class WorkflowCoordinatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryEventLogStore store;
    private TimeController time;
    private SimpleMeterRegistry registry;
    private WorkflowCoordinator ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventLogStore();
        time = TimeController.frozenAt(T0);
        registry = new SimpleMeterRegistry();
        LedgerMetrics metrics = new LedgerMetrics();
        metrics.bindTo(registry);
        ledger = new WorkflowCoordinator(store, null, EventCodec.createObjectMapper(),
            TaskLedgerProperties.forRoot(Path.of("unused")), metrics, time);
    }

    private Workflow createWorkflow(String title) {
        return ledger.createWorkflow(CreateWorkflowRequest.of(title));
    }

    private Task addTask(String workflowId, String title, String... dependsOn) {
        time.advanceSeconds(1);
        return ledger.addTask(workflowId, AddTaskRequest.of(title, dependsOn));
    }

    private List<String> titles(List<Task> tasks) {
        return tasks.stream().map(Task::title).toList();
    }

    // ========== Workflows ==========

    @Nested
    @DisplayName("Workflows")
    class Workflows {

        @Test
        @DisplayName("Creating a workflow appends one event and yields an active, empty workflow")
        void createsActiveWorkflow() {
            Workflow workflow = ledger.createWorkflow(
                new CreateWorkflowRequest("  Release 1.0 ", "Ship it", null, Set.of("ops")));

            assertThat(workflow.id()).startsWith("wf_");
            assertThat(workflow.title()).isEqualTo("Release 1.0");
            assertThat(workflow.project()).isEqualTo(Workflow.DEFAULT_PROJECT);
            assertThat(workflow.status()).isEqualTo(WorkflowStatus.ACTIVE);
            assertThat(workflow.tags()).containsExactly("ops");
            assertThat(workflow.createdAt()).isEqualTo(T0);
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("A blank title is rejected and nothing is appended")
        void blankTitleRejected() {
            assertThatThrownBy(() -> ledger.createWorkflow(CreateWorkflowRequest.of("   ")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("title");
            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("Unknown workflows are reported as not found")
        void unknownWorkflow() {
            assertThatThrownBy(() -> ledger.getWorkflow("wf_missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Workflow not found: wf_missing");
        }

        @Test
        @DisplayName("Listing filters by status, project, tag and text, newest update first")
        void listWorkflows() {
            Workflow alpha = ledger.createWorkflow(new CreateWorkflowRequest("Alpha launch", null, "web", Set.of("ops")));
            time.advanceSeconds(10);
            Workflow beta = ledger.createWorkflow(new CreateWorkflowRequest("Beta", "database migration", "db", Set.of()));
            time.advanceSeconds(10);
            Workflow gamma = createWorkflow("Gamma");
            time.advanceSeconds(10);
            ledger.updateWorkflow(alpha.id(), WorkflowPatch.status(WorkflowStatus.COMPLETED));

            assertThat(ledger.listWorkflows(WorkflowFilter.all()))
                .extracting(Workflow::id).containsExactly(alpha.id(), gamma.id(), beta.id());
            assertThat(ledger.listWorkflows(WorkflowFilter.byStatus(WorkflowStatus.ACTIVE)))
                .extracting(Workflow::id).containsExactly(gamma.id(), beta.id());
            assertThat(ledger.listWorkflows(new WorkflowFilter(null, "db", null, null)))
                .extracting(Workflow::id).containsExactly(beta.id());
            assertThat(ledger.listWorkflows(new WorkflowFilter(null, null, Set.of("ops"), null)))
                .extracting(Workflow::id).containsExactly(alpha.id());
            assertThat(ledger.listWorkflows(new WorkflowFilter(null, null, null, "MIGRATION")))
                .extracting(Workflow::id).containsExactly(beta.id());
        }

        @Test
        @DisplayName("A completed workflow can be reopened")
        void reopenCompleted() {
            Workflow workflow = createWorkflow("Lifecycle");
            ledger.updateWorkflow(workflow.id(), WorkflowPatch.status(WorkflowStatus.COMPLETED));
            ledger.updateWorkflow(workflow.id(), WorkflowPatch.status(WorkflowStatus.ACTIVE));

            assertThat(ledger.getWorkflow(workflow.id()).status()).isEqualTo(WorkflowStatus.ACTIVE);
            assertThat(store.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("An update that changes nothing appends nothing")
        void noOpUpdate() {
            Workflow workflow = createWorkflow("Same");

            ledger.updateWorkflow(workflow.id(), WorkflowPatch.status(WorkflowStatus.ACTIVE));

            assertThat(store.size()).isEqualTo(1);
        }
    }

    // ========== Tasks ==========

    @Nested
    @DisplayName("Tasks")
    class Tasks {

        @Test
        @DisplayName("Added tasks get dense positions in insertion order")
        void addTasks() {
            Workflow workflow = createWorkflow("Release");
            Task build = addTask(workflow.id(), "Build");
            Task test = addTask(workflow.id(), "Test", build.id());

            assertThat(build.id()).startsWith("task_");
            assertThat(build.position()).isZero();
            assertThat(test.position()).isEqualTo(1);
            assertThat(test.dependsOn()).containsExactly(build.id());
            assertThat(test.priority()).isEqualTo(TaskPriority.MEDIUM);
            assertThat(store.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("Dependencies on unknown tasks are rejected")
        void unknownDependencyRejected() {
            Workflow workflow = createWorkflow("Release");

            assertThatThrownBy(() -> addTask(workflow.id(), "Test", "task_nope"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("task_nope");
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Unknown priority and status values are rejected")
        void invalidEnumValuesRejected() {
            Workflow workflow = createWorkflow("Release");
            Task task = addTask(workflow.id(), "Build");

            assertThatThrownBy(() -> ledger.addTask(workflow.id(),
                    new AddTaskRequest("Urgent", null, "urgent", List.of(), Set.of(), Set.of(), List.of())))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> ledger.updateTask(workflow.id(), task.id(), TaskPatch.status("done", null)))
                .isInstanceOf(ValidationException.class);
            assertThat(store.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("Status changes record the note; repeating the current status is a no-op")
        void setTaskStatus() {
            Workflow workflow = createWorkflow("Release");
            Task task = addTask(workflow.id(), "Build");

            Task started = ledger.setTaskStatus(workflow.id(), task.id(), TaskStatus.IN_PROGRESS, "picked up");
            ledger.setTaskStatus(workflow.id(), task.id(), TaskStatus.IN_PROGRESS, "again");

            assertThat(started.status()).isEqualTo(TaskStatus.IN_PROGRESS);
            assertThat(started.history()).singleElement()
                .satisfies(change -> assertThat(change.note()).isEqualTo("picked up"));
            assertThat(store.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("Patching a task changes only the given fields")
        void updateTask() {
            Workflow workflow = createWorkflow("Release");
            Task task = addTask(workflow.id(), "Build");

            Task updated = ledger.updateTask(workflow.id(), task.id(), new TaskPatch(
                "Build artifacts", null, "critical", "completed", "green", null, null, Set.of("ci")));

            assertThat(updated.title()).isEqualTo("Build artifacts");
            assertThat(updated.priority()).isEqualTo(TaskPriority.CRITICAL);
            assertThat(updated.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(updated.completedAt()).isNotNull();
            assertThat(updated.tags()).containsExactly("ci");
            assertThat(store.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("An empty patch is rejected")
        void emptyPatchRejected() {
            Workflow workflow = createWorkflow("Release");
            Task task = addTask(workflow.id(), "Build");

            assertThatThrownBy(() -> ledger.updateTask(workflow.id(), task.id(),
                    new TaskPatch(null, null, null, null, null, null, null, null)))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("A patch that only repeats the current status writes nothing")
        void updateTaskNoOp() {
            Workflow workflow = createWorkflow("Release");
            Task task = addTask(workflow.id(), "Build");
            int before = store.size();

            Task unchanged = ledger.updateTask(workflow.id(), task.id(), TaskPatch.status("pending", null));

            assertThat(unchanged.status()).isEqualTo(TaskStatus.PENDING);
            assertThat(store.size()).isEqualTo(before);
        }

        @Test
        @DisplayName("Unknown tasks are reported as not found")
        void unknownTask() {
            Workflow workflow = createWorkflow("Release");

            assertThatThrownBy(() -> ledger.setTaskStatus(workflow.id(), "task_missing", TaskStatus.COMPLETED, null))
                .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Linking notes updates the task and the workflow's related notes")
        void linkArtifacts() {
            Workflow workflow = createWorkflow("Release");
            Task build = addTask(workflow.id(), "Build");
            Task test = addTask(workflow.id(), "Test");

            ledger.linkArtifact(workflow.id(), build.id(), "note-1");
            ledger.linkArtifact(workflow.id(), build.id(), "note-1");
            ledger.linkArtifact(workflow.id(), test.id(), "note-2");
            int eventsAfterLinking = store.size();
            ledger.unlinkArtifact(workflow.id(), build.id(), "note-1");

            assertThat(eventsAfterLinking).isEqualTo(5);
            assertThat(ledger.getWorkflow(workflow.id()).relatedNoteIds()).containsExactly("note-2");
        }
    }

    // ========== Steps ==========

    @Nested
    @DisplayName("Task steps")
    class Steps {

        private Task taskWithSteps(String workflowId) {
            time.advanceSeconds(1);
            return ledger.addTask(workflowId, AddTaskRequest.of("Build").withSteps(
                new StepRequest("Compile", 5, "mvn -q compile"),
                StepRequest.of("Package")));
        }

        @Test
        @DisplayName("Steps are created with generated ids, open, in the given order")
        void addTaskWithSteps() {
            Workflow workflow = createWorkflow("Release");

            Task build = taskWithSteps(workflow.id());

            assertThat(build.steps()).extracting(TaskStep::description).containsExactly("Compile", "Package");
            assertThat(build.steps()).allSatisfy(step -> {
                assertThat(step.id()).startsWith("step_").hasSize(11);
                assertThat(step.completed()).isFalse();
            });
            assertThat(build.steps().get(0).estimatedMinutes()).isEqualTo(5);
            assertThat(build.steps().get(0).verificationCommand()).isEqualTo("mvn -q compile");
            assertThat(build.steps().get(1).estimatedMinutes()).isNull();
        }

        @Test
        @DisplayName("Completing a step records evidence and time; repeating it appends nothing")
        void completeStep() {
            Workflow workflow = createWorkflow("Release");
            Task build = taskWithSteps(workflow.id());
            String stepId = build.steps().get(1).id();
            time.advanceSeconds(30);

            TaskStep done = ledger.completeStep(workflow.id(), build.id(), stepId, " target/app.jar ");
            int before = store.size();
            ledger.completeStep(workflow.id(), build.id(), stepId, "again");

            assertThat(done.completed()).isTrue();
            assertThat(done.completedAt()).isEqualTo(T0.plusSeconds(31));
            assertThat(done.evidence()).isEqualTo("target/app.jar");
            assertThat(store.size()).isEqualTo(before);
            assertThat(store.events().get(before - 1).type()).isEqualTo("StepCompleted");
            Task reloaded = ledger.getWorkflow(workflow.id()).findTask(build.id()).orElseThrow();
            assertThat(reloaded.steps().get(0).completed()).isFalse();
            assertThat(reloaded.findStep(stepId).orElseThrow().evidence()).isEqualTo("target/app.jar");
        }

        @Test
        @DisplayName("Unknown steps are reported as not found and nothing is appended")
        void unknownStep() {
            Workflow workflow = createWorkflow("Release");
            Task build = taskWithSteps(workflow.id());
            int before = store.size();

            assertThatThrownBy(() -> ledger.completeStep(workflow.id(), build.id(), "step_nope00", null))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("step_nope00");
            assertThat(store.size()).isEqualTo(before);
        }

        @Test
        @DisplayName("A step without a description is rejected")
        void blankStepRejected() {
            Workflow workflow = createWorkflow("Release");

            assertThatThrownBy(() -> ledger.addTask(workflow.id(),
                    AddTaskRequest.of("Build").withSteps(StepRequest.of("  "))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("steps.description");
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Completed steps survive a rebuild from the log")
        void stepsSurviveRebuild() {
            Workflow workflow = createWorkflow("Release");
            Task build = taskWithSteps(workflow.id());
            ledger.completeStep(workflow.id(), build.id(), build.steps().get(0).id(), "ok");

            ledger.rebuild();

            Task reloaded = ledger.getWorkflow(workflow.id()).findTask(build.id()).orElseThrow();
            assertThat(reloaded.steps()).extracting(TaskStep::completed).containsExactly(true, false);
        }
    }

    // ========== Task queries ==========

    @Nested
    @DisplayName("Task queries")
    class TaskQueries {

        @Test
        @DisplayName("Tasks filter by status, priority, blockers and text, in position order")
        void getTasksFiltered() {
            Workflow workflow = createWorkflow("Release");
            Task build = addTask(workflow.id(), "Build artifacts");
            Task test = addTask(workflow.id(), "Run tests", build.id());
            time.advanceSeconds(1);
            Task docs = ledger.addTask(workflow.id(),
                new AddTaskRequest("Docs", "Update the BUILD guide", "high", List.of(), Set.of(), Set.of(), List.of()));
            ledger.setTaskStatus(workflow.id(), docs.id(), TaskStatus.BLOCKED, "waiting on review");
            ledger.reorderTasks(workflow.id(), List.of(docs.id(), build.id(), test.id()));

            assertThat(titles(ledger.getTasks(workflow.id(), TaskFilter.all())))
                .containsExactly("Docs", "Build artifacts", "Run tests");
            assertThat(titles(ledger.getTasks(workflow.id(), TaskFilter.byStatus(TaskStatus.PENDING))))
                .containsExactly("Build artifacts", "Run tests");
            assertThat(titles(ledger.getTasks(workflow.id(),
                    new TaskFilter(null, Set.of(TaskPriority.HIGH), null, null))))
                .containsExactly("Docs");
            assertThat(titles(ledger.getTasks(workflow.id(), new TaskFilter(null, null, true, null))))
                .containsExactly("Docs", "Run tests");
            assertThat(titles(ledger.getTasks(workflow.id(), new TaskFilter(null, null, false, null))))
                .containsExactly("Build artifacts");
            assertThat(titles(ledger.getTasks(workflow.id(), new TaskFilter(null, null, null, "build"))))
                .containsExactly("Docs", "Build artifacts");
        }

        @Test
        @DisplayName("Querying tasks of an unknown workflow is reported as not found")
        void getTasksUnknownWorkflow() {
            assertThatThrownBy(() -> ledger.getTasks("wf_missing", TaskFilter.all()))
                .isInstanceOf(NotFoundException.class);
        }
    }

    // ========== Dependencies ==========

    @Nested
    @DisplayName("Dependencies")
    class Dependencies {

        @Test
        @DisplayName("An edge that would close a cycle is rejected and the log is unchanged")
        void cycleRejected() {
            Workflow workflow = createWorkflow("Release");
            Task a = addTask(workflow.id(), "A");
            Task b = addTask(workflow.id(), "B", a.id());
            Task c = addTask(workflow.id(), "C", b.id());
            int before = store.size();

            assertThatThrownBy(() -> ledger.addDependency(workflow.id(), a.id(), c.id()))
                .isInstanceOf(CycleException.class)
                .satisfies(e -> assertThat(((CycleException) e).getCyclePath())
                    .containsExactly(a.id(), c.id(), b.id(), a.id()));
            assertThatThrownBy(() -> ledger.updateTask(workflow.id(), a.id(), TaskPatch.dependsOn(Set.of(b.id()))))
                .isInstanceOf(CycleException.class);

            assertThat(store.size()).isEqualTo(before);
            assertThat(registry.get("taskledger.dependencies.cycles_rejected").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("A task cannot depend on itself")
        void selfDependencyRejected() {
            Workflow workflow = createWorkflow("Release");
            Task a = addTask(workflow.id(), "A");

            assertThatThrownBy(() -> ledger.addDependency(workflow.id(), a.id(), a.id()))
                .isInstanceOf(CycleException.class);
        }

        @Test
        @DisplayName("Dependencies can be added and removed one edge at a time")
        void addAndRemoveDependency() {
            Workflow workflow = createWorkflow("Release");
            Task a = addTask(workflow.id(), "A");
            Task b = addTask(workflow.id(), "B");

            assertThat(ledger.addDependency(workflow.id(), b.id(), a.id()).dependsOn()).containsExactly(a.id());
            assertThat(ledger.getNextBatch(workflow.id())).extracting(Task::id).containsExactly(a.id());

            assertThat(ledger.removeDependency(workflow.id(), b.id(), a.id()).dependsOn()).isEmpty();
            assertThat(ledger.getNextBatch(workflow.id())).extracting(Task::id).containsExactly(a.id(), b.id());
        }
    }

    // ========== Ordering and Batches ==========

    @Nested
    @DisplayName("Ordering and batches")
    class OrderingAndBatches {

        @Test
        @DisplayName("Reordering is a single event that rewrites every position")
        void reorderIsAtomic() {
            Workflow workflow = createWorkflow("Release");
            Task a = addTask(workflow.id(), "A");
            Task b = addTask(workflow.id(), "B");
            Task c = addTask(workflow.id(), "C");
            int before = store.size();

            Workflow reordered = ledger.reorderTasks(workflow.id(), List.of(c.id(), a.id(), b.id()));

            assertThat(store.size()).isEqualTo(before + 1);
            assertThat(store.events().get(before).type()).isEqualTo("TasksReordered");
            assertThat(reordered.taskIds()).containsExactly(c.id(), a.id(), b.id());
            assertThat(reordered.orderedTasks()).extracting(Task::position).containsExactly(0, 1, 2);
        }

        @Test
        @DisplayName("A reorder that is not a permutation is rejected")
        void reorderMustBePermutation() {
            Workflow workflow = createWorkflow("Release");
            Task a = addTask(workflow.id(), "A");
            Task b = addTask(workflow.id(), "B");

            assertThatThrownBy(() -> ledger.reorderTasks(workflow.id(), List.of(a.id())))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> ledger.reorderTasks(workflow.id(), List.of(a.id(), a.id())))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> ledger.reorderTasks(workflow.id(), List.of(a.id(), "task_other")))
                .isInstanceOf(ValidationException.class);
            assertThat(ledger.getWorkflow(workflow.id()).taskIds()).containsExactly(a.id(), b.id());
        }

        @Test
        @DisplayName("Batches follow the diamond A -> (B, C) -> D")
        void diamondBatches() {
            Workflow workflow = createWorkflow("Diamond");
            Task a = addTask(workflow.id(), "A");
            Task b = addTask(workflow.id(), "B", a.id());
            Task c = addTask(workflow.id(), "C", a.id());
            addTask(workflow.id(), "D", b.id(), c.id());
            String id = workflow.id();

            assertThat(titles(ledger.getNextBatch(id))).containsExactly("A");
            ledger.setTaskStatus(id, a.id(), TaskStatus.COMPLETED, null);
            assertThat(titles(ledger.getNextBatch(id))).containsExactly("B", "C");
            ledger.setTaskStatus(id, b.id(), TaskStatus.COMPLETED, null);
            assertThat(titles(ledger.getNextBatch(id))).containsExactly("C");
            ledger.setTaskStatus(id, c.id(), TaskStatus.COMPLETED, null);
            assertThat(titles(ledger.getNextBatch(id))).containsExactly("D");
        }

        @Test
        @DisplayName("Starting a batch moves its tasks to in progress with one event")
        void startNextBatch() {
            Workflow workflow = createWorkflow("Parallel");
            addTask(workflow.id(), "A");
            addTask(workflow.id(), "B");
            addTask(workflow.id(), "C");
            int before = store.size();

            List<Task> started = ledger.startNextBatch(workflow.id(), 2);

            assertThat(titles(started)).containsExactly("A", "B");
            assertThat(started).allSatisfy(task -> assertThat(task.status()).isEqualTo(TaskStatus.IN_PROGRESS));
            assertThat(store.size()).isEqualTo(before + 1);
            assertThat(ledger.getWorkflow(workflow.id()).batchNumber()).isEqualTo(1);

            assertThat(titles(ledger.startNextBatch(workflow.id(), 0))).containsExactly("C");
            assertThat(ledger.startNextBatch(workflow.id(), 0)).isEmpty();
            assertThat(store.size()).isEqualTo(before + 2);
        }

        @Test
        @DisplayName("A negative batch limit is rejected")
        void negativeLimitRejected() {
            Workflow workflow = createWorkflow("Release");

            assertThatThrownBy(() -> ledger.getNextBatch(workflow.id(), -1))
                .isInstanceOf(ValidationException.class);
        }
    }

    // ========== Lifecycle ==========

    @Nested
    @DisplayName("Workflow lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Archived workflows are frozen except for checkpoints")
        void archivedIsFrozen() {
            Workflow workflow = createWorkflow("Old");
            Task task = addTask(workflow.id(), "Leftover");
            ledger.updateWorkflow(workflow.id(), WorkflowPatch.status(WorkflowStatus.ARCHIVED));
            int before = store.size();

            assertThat(ledger.getNextBatch(workflow.id())).isEmpty();
            assertThatThrownBy(() -> addTask(workflow.id(), "More"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("archived");
            assertThatThrownBy(() -> ledger.setTaskStatus(workflow.id(), task.id(), TaskStatus.COMPLETED, null))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> ledger.updateWorkflow(workflow.id(), WorkflowPatch.status(WorkflowStatus.ACTIVE)))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> ledger.startNextBatch(workflow.id(), 0))
                .isInstanceOf(ValidationException.class);
            assertThat(store.size()).isEqualTo(before);

            Checkpoint checkpoint = ledger.createCheckpoint(workflow.id(), "final state", CheckpointReason.SESSION_END);
            assertThat(checkpoint.workflowId()).isEqualTo(workflow.id());
        }

        @Test
        @DisplayName("Completed workflows offer no batch but still accept changes")
        void completedHasNoBatch() {
            Workflow workflow = createWorkflow("Done");
            addTask(workflow.id(), "A");
            ledger.updateWorkflow(workflow.id(), WorkflowPatch.status(WorkflowStatus.COMPLETED));

            assertThat(ledger.getNextBatch(workflow.id())).isEmpty();
            addTask(workflow.id(), "Follow-up");
            assertThat(ledger.startNextBatch(workflow.id(), 0)).isEmpty();
            assertThat(ledger.getWorkflow(workflow.id()).taskIds()).hasSize(2);
        }

        @Test
        @DisplayName("Every applied event moves updatedAt forward to its timestamp")
        void updatedAtFollowsEvents() {
            Workflow workflow = createWorkflow("Timing");
            time.advanceSeconds(30);
            ledger.createCheckpoint(workflow.id(), null, null);

            assertThat(ledger.getWorkflow(workflow.id()).updatedAt()).isEqualTo(T0.plusSeconds(30));
        }
    }

    // ========== Status ==========

    @Test
    @DisplayName("The status summary reports progress, blockers, next actions and recent events")
    void workflowStatusSummary() {
        Workflow workflow = createWorkflow("Status");
        Task a = addTask(workflow.id(), "A");
        Task b = addTask(workflow.id(), "B", a.id());
        addTask(workflow.id(), "C");
        addTask(workflow.id(), "D");
        addTask(workflow.id(), "E");
        ledger.setTaskStatus(workflow.id(), a.id(), TaskStatus.IN_PROGRESS, null);
        Checkpoint checkpoint = ledger.createCheckpoint(workflow.id(), "midway", CheckpointReason.MANUAL);

        WorkflowStatusSummary summary = ledger.getWorkflowStatus(workflow.id());

        assertThat(summary.progress().total()).isEqualTo(5);
        assertThat(summary.progress().percentage()).isZero();
        assertThat(titles(summary.inProgress())).containsExactly("A");
        assertThat(summary.blockers()).singleElement()
            .satisfies(blocker -> {
                assertThat(blocker.task().id()).isEqualTo(b.id());
                assertThat(blocker.waitingOn()).containsExactly(a.id());
            });
        assertThat(titles(summary.nextActions())).containsExactly("C", "D", "E");
        assertThat(summary.recentEvents()).hasSize(WorkflowCoordinator.STATUS_RECENT_EVENTS);
        assertThat(summary.recentEvents()).last().extracting(Event::type).isEqualTo("CheckpointCreated");
        assertThat(summary.lastCheckpoint()).isEqualTo(checkpoint);
        assertThat(summary.corruptLines()).isZero();
    }
}
