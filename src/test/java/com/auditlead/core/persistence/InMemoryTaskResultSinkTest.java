package com.auditlead.core.persistence;

import com.auditlead.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskResultSinkTest {

    private InMemoryTaskResultSink sink;

    @BeforeEach
    void setUp() {
        sink = new InMemoryTaskResultSink();
    }

    @Test
    @DisplayName("registerTasks creates pending rows without overwriting existing ones")
    void registerTasks() {
        sink.registerTasks("AUD-1", List.of("web_scraper", "seo"));
        sink.saveProgress("AUD-1", "seo", 40, "Scoring", TaskStatus.RUNNING);
        sink.registerTasks("AUD-1", List.of("seo"));

        assertEquals(2, sink.findByRun("AUD-1").size());
        assertEquals(40, sink.find("AUD-1", "seo").orElseThrow().progressPercent());
        assertEquals(TaskStatus.PENDING, sink.find("AUD-1", "web_scraper").orElseThrow().status());
    }

    @Test
    @DisplayName("writes are last-write-wins per run and task")
    void lastWriteWins() {
        Instant started = Instant.parse("2026-01-01T10:00:00Z");
        sink.saveStarted("AUD-1", "seo", started);
        sink.saveProgress("AUD-1", "seo", 10, "a", TaskStatus.RUNNING);
        sink.saveProgress("AUD-1", "seo", 60, "b", TaskStatus.RUNNING);
        sink.saveResult("AUD-1", "seo", TaskStatus.COMPLETED, Map.of("score", 9), null);
        sink.saveResult("AUD-1", "seo", TaskStatus.COMPLETED, Map.of("score", 9), null);

        var row = sink.find("AUD-1", "seo").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, row.status());
        assertEquals(100, row.progressPercent());
        assertEquals(started, row.startedAt());
        assertNotNull(row.completedAt());
        assertEquals(9, row.resultData().get("score"));
    }

    @Test
    @DisplayName("failed results keep progress and record the error")
    void failedResult() {
        sink.saveProgress("AUD-1", "seo", 30, "Fetching", TaskStatus.RUNNING);
        sink.saveResult("AUD-1", "seo", TaskStatus.FAILED, null, "timeout");

        var row = sink.find("AUD-1", "seo").orElseThrow();
        assertEquals(TaskStatus.FAILED, row.status());
        assertEquals(30, row.progressPercent());
        assertEquals("timeout", row.errorMessage());
    }

    @Test
    @DisplayName("rows of different runs are kept apart")
    void runsIsolated() {
        sink.registerTasks("AUD-1", List.of("seo"));
        sink.registerTasks("AUD-2", List.of("seo", "social"));

        assertEquals(1, sink.findByRun("AUD-1").size());
        assertEquals(2, sink.findByRun("AUD-2").size());
        assertTrue(sink.find("AUD-3", "seo").isEmpty());
    }
}
