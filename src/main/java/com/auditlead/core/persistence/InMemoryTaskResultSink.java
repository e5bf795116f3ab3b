package com.auditlead.core.persistence;

import com.auditlead.core.model.TaskStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TaskResultSink} that keeps rows in memory. Used when no DataSource is configured;
 * contents are lost on restart.
 */
public class InMemoryTaskResultSink implements TaskResultSink {

    private final ConcurrentHashMap<String, StoredTaskResult> rows = new ConcurrentHashMap<>();

    @Override
    public void registerTasks(String runId, List<String> taskNames) {
        for (String name : taskNames) {
            rows.putIfAbsent(key(runId, name), StoredTaskResult.pending(runId, name));
        }
    }

    @Override
    public void saveStarted(String runId, String taskName, Instant startedAt) {
        rows.compute(key(runId, taskName), (k, row) -> orPending(row, runId, taskName).started(startedAt));
    }

    @Override
    public void saveProgress(String runId, String taskName, int percent, String label, TaskStatus status) {
        rows.compute(key(runId, taskName),
                (k, row) -> orPending(row, runId, taskName).progress(percent, label, status));
    }

    @Override
    public void saveResult(String runId, String taskName, TaskStatus status,
                           Map<String, Object> payload, String errorDetail) {
        rows.compute(key(runId, taskName),
                (k, row) -> orPending(row, runId, taskName).result(status, payload, errorDetail, Instant.now()));
    }

    public Optional<StoredTaskResult> find(String runId, String taskName) {
        return Optional.ofNullable(rows.get(key(runId, taskName)));
    }

    public List<StoredTaskResult> findByRun(String runId) {
        return rows.values().stream()
                .filter(r -> r.runId().equals(runId))
                .sorted(Comparator.comparing(StoredTaskResult::taskName))
                .toList();
    }

    private static StoredTaskResult orPending(StoredTaskResult row, String runId, String taskName) {
        return row != null ? row : StoredTaskResult.pending(runId, taskName);
    }

    private static String key(String runId, String taskName) {
        return runId + "/" + taskName;
    }
}
