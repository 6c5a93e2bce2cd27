package com.pmagents.core.scheduler;

import com.pmagents.core.graph.TaskGraph;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskStateTrackerTest {

    private TaskStateTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new TaskStateTracker(TaskGraph.of(List.of(
                Task.of("A", "code-generator", Set.of()),
                Task.of("B", "code-generator", Set.of("A")))));
    }

    @Nested
    @DisplayName("legal transitions")
    class Legal {

        @Test
        @DisplayName("pending -> running -> completed")
        void happyPath() {
            tracker.markRunning("A");
            tracker.markCompleted("A");

            assertEquals(TaskStatus.COMPLETED, tracker.statusOf("A"));
            assertEquals(List.of("A"), tracker.idsWithStatus(TaskStatus.COMPLETED));
            assertEquals(1, tracker.count(TaskStatus.PENDING));
        }

        @Test
        @DisplayName("pending -> skipped")
        void skip() {
            tracker.markSkipped("B");

            assertEquals(TaskStatus.SKIPPED, tracker.statusOf("B"));
            assertFalse(tracker.isDispatchable("B"));
        }
    }

    @Nested
    @DisplayName("illegal transitions")
    class Illegal {

        @Test
        @DisplayName("completed task cannot run again")
        void completedIsFinal() {
            tracker.markRunning("A");
            tracker.markCompleted("A");

            assertThrows(IllegalStateException.class, () -> tracker.markRunning("A"));
            assertThrows(IllegalStateException.class, () -> tracker.markFailed("A"));
        }

        @Test
        @DisplayName("pending task cannot complete or fail directly")
        void pendingCannotFinish() {
            assertThrows(IllegalStateException.class, () -> tracker.markCompleted("A"));
            assertThrows(IllegalStateException.class, () -> tracker.markFailed("A"));
        }

        @Test
        @DisplayName("failed task cannot run again without reopen")
        void failedNeedsReopen() {
            tracker.markRunning("A");
            tracker.markFailed("A");

            assertThrows(IllegalStateException.class, () -> tracker.markRunning("A"));
        }

        @Test
        @DisplayName("unknown task is rejected")
        void unknownTask() {
            assertThrows(IllegalArgumentException.class, () -> tracker.statusOf("Z"));
        }
    }

    @Nested
    @DisplayName("retry and abort")
    class RetryAndAbort {

        @Test
        @DisplayName("reopened failed task may run exactly once more")
        void reopenFailed() {
            tracker.markRunning("A");
            tracker.markFailed("A");
            tracker.reopen("A");

            assertTrue(tracker.isDispatchable("A"));
            tracker.markRunning("A");
            tracker.markFailed("A");
            assertThrows(IllegalStateException.class, () -> tracker.markRunning("A"));
        }

        @Test
        @DisplayName("reopened skipped task returns to pending")
        void reopenSkipped() {
            tracker.markSkipped("B");
            tracker.reopen("B");

            assertEquals(TaskStatus.PENDING, tracker.statusOf("B"));
        }

        @Test
        @DisplayName("completed task cannot be reopened")
        void reopenCompleted() {
            tracker.markRunning("A");
            tracker.markCompleted("A");

            assertThrows(IllegalStateException.class, () -> tracker.reopen("A"));
        }

        @Test
        @DisplayName("abandon fails running tasks, skips pending ones and keeps terminal ones")
        void abandon() {
            tracker.markRunning("A");

            assertEquals(TaskStatus.FAILED, tracker.abandon("A"));
            assertEquals(TaskStatus.SKIPPED, tracker.abandon("B"));
            assertEquals(TaskStatus.SKIPPED, tracker.abandon("B"));
        }

        @Test
        @DisplayName("abandoning a reopened failed task withdraws the reopen")
        void abandonReopened() {
            tracker.markRunning("A");
            tracker.markFailed("A");
            tracker.reopen("A");

            assertEquals(TaskStatus.FAILED, tracker.abandon("A"));
            assertFalse(tracker.isDispatchable("A"));
        }
    }
}
