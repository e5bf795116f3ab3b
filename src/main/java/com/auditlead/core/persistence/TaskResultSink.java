package com.auditlead.core.persistence;

import com.auditlead.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable store for per-agent progress and results.
 * <p>
 * Every write is keyed by {@code (runId, taskName)} and is last-write-wins, so callers
 * may repeat a write safely. Implementations may throw {@link PersistenceException};
 * {@code AgentRunner} logs such failures and carries on with the in-memory state.
 */
public interface TaskResultSink {

    /** Create one PENDING row per agent taking part in the run. */
    void registerTasks(String runId, List<String> taskNames);

    void saveStarted(String runId, String taskName, Instant startedAt);

    void saveProgress(String runId, String taskName, int percent, String label, TaskStatus status);

    void saveResult(String runId, String taskName, TaskStatus status,
                    Map<String, Object> payload, String errorDetail);
}
