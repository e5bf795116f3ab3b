package com.auditlead.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskRecordTest {

    @Nested
    @DisplayName("TaskStatus")
    class TaskStatusTests {

        @Test
        @DisplayName("only COMPLETED and FAILED are terminal")
        void terminalStatuses() {
            assertFalse(TaskStatus.PENDING.isTerminal());
            assertFalse(TaskStatus.RUNNING.isTerminal());
            assertTrue(TaskStatus.COMPLETED.isTerminal());
            assertTrue(TaskStatus.FAILED.isTerminal());
        }

        @Test
        @DisplayName("allows only forward transitions")
        void forwardTransitions() {
            assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.RUNNING));
            assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.COMPLETED));
            assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILED));

            assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED));
            assertFalse(TaskStatus.RUNNING.canTransitionTo(TaskStatus.PENDING));
            assertFalse(TaskStatus.COMPLETED.canTransitionTo(TaskStatus.RUNNING));
            assertFalse(TaskStatus.FAILED.canTransitionTo(TaskStatus.COMPLETED));
        }

        @Test
        @DisplayName("wire names are lower case")
        void wireNames() {
            assertEquals("pending", TaskStatus.PENDING.wireName());
            assertEquals("completed", TaskStatus.COMPLETED.wireName());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("pending record starts at zero progress with no output")
        void pendingRecord() {
            var record = TaskRecord.pending("seo");

            assertEquals(TaskStatus.PENDING, record.status());
            assertEquals(0, record.progressPercent());
            assertNull(record.resultPayload());
            assertNull(record.errorDetail());
            assertEquals(0, record.attempts());
        }

        @Test
        @DisplayName("completed record carries payload at 100 percent")
        void completedRecord() {
            Instant now = Instant.now();
            var record = TaskRecord.pending("seo")
                    .running("Starting", now)
                    .withProgress(40, "Scoring")
                    .completed(Map.of("score", 82), now);

            assertEquals(TaskStatus.COMPLETED, record.status());
            assertEquals(100, record.progressPercent());
            assertEquals("Complete", record.currentTaskLabel());
            assertEquals(82, record.resultPayload().get("score"));
            assertEquals(now, record.startedAt());
            assertEquals(now, record.finishedAt());
        }

        @Test
        @DisplayName("payload is a frozen copy")
        void payloadIsFrozen() {
            var source = new HashMap<String, Object>();
            source.put("score", 1);
            var record = TaskRecord.pending("seo").running("", Instant.now()).completed(source, Instant.now());

            source.put("score", 2);

            assertEquals(1, record.resultPayload().get("score"));
            assertThrows(UnsupportedOperationException.class, () -> record.resultPayload().put("x", 1));
        }

        @Test
        @DisplayName("failed record keeps progress and error")
        void failedRecord() {
            var record = TaskRecord.pending("seo")
                    .running("", Instant.now())
                    .withProgress(30, "Fetching")
                    .failed("timeout", Instant.now());

            assertEquals(TaskStatus.FAILED, record.status());
            assertEquals(30, record.progressPercent());
            assertEquals("timeout", record.errorDetail());
            assertNull(record.resultPayload());
            assertFalse(record.isCancelled());
        }

        @Test
        @DisplayName("cancelled failures are distinguishable")
        void cancelledFailure() {
            var record = TaskRecord.pending("seo")
                    .running("", Instant.now())
                    .failed(TaskRecord.CANCELLED + ": deadline", Instant.now());

            assertTrue(record.isCancelled());
        }

        @Test
        @DisplayName("rejects skipping RUNNING")
        void rejectsPendingToCompleted() {
            var pending = TaskRecord.pending("seo");

            assertThrows(IllegalStateException.class, () -> pending.completed(Map.of(), Instant.now()));
        }

        @Test
        @DisplayName("terminal records cannot change")
        void terminalIsFinal() {
            var done = TaskRecord.pending("seo").running("", Instant.now()).completed(Map.of(), Instant.now());

            assertThrows(IllegalStateException.class, () -> done.withProgress(50, "again"));
            assertThrows(IllegalStateException.class, () -> done.failed("late", Instant.now()));
        }
    }
}
