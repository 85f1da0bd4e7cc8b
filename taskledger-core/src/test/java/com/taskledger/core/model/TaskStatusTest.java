package com.taskledger.core.model;

import com.taskledger.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TaskStatusTest {

    @Test
    void fromValue_shouldParseEveryWireValue() {
        for (TaskStatus status : TaskStatus.values()) {
            assertThat(TaskStatus.fromValue(status.value())).isEqualTo(status);
        }
        assertThat(TaskStatus.fromValue("in_progress")).isEqualTo(TaskStatus.IN_PROGRESS);
    }

    @Test
    void fromValue_shouldRejectMalformedStatus() {
        assertThatThrownBy(() -> TaskStatus.fromValue("done"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("done");
        assertThatThrownBy(() -> TaskStatus.fromValue("IN_PROGRESS"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void isTerminal_shouldIdentifyCompletedAndSkipped() {
        assertThat(TaskStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(TaskStatus.SKIPPED.isTerminal()).isTrue();

        assertThat(TaskStatus.PENDING.isTerminal()).isFalse();
        assertThat(TaskStatus.IN_PROGRESS.isTerminal()).isFalse();
        assertThat(TaskStatus.BLOCKED.isTerminal()).isFalse();
    }

    @Test
    void eventType_shouldResolveWireNames() {
        assertThat(EventType.fromWireName("TasksReordered")).contains(EventType.TASKS_REORDERED);
        assertThat(EventType.fromWireName("CheckpointCreated")).contains(EventType.CHECKPOINT_CREATED);
        assertThat(EventType.fromWireName("SomethingFromTheFuture")).isEmpty();
    }
}
