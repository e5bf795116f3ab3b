package com.auditlead.core.persistence;

import com.auditlead.core.model.TaskStatus;

import java.time.Instant;
import java.util.Map;

/**
 * One persisted agent row.
 */
public record StoredTaskResult(
    String runId,
    String taskName,
    TaskStatus status,
    int progressPercent,
    String currentTask,
    Map<String, Object> resultData,
    String errorMessage,
    Instant startedAt,
    Instant completedAt
) {

    static StoredTaskResult pending(String runId, String taskName) {
        return new StoredTaskResult(runId, taskName, TaskStatus.PENDING, 0, "", null, null, null, null);
    }

    StoredTaskResult started(Instant at) {
        return new StoredTaskResult(runId, taskName, TaskStatus.RUNNING, progressPercent, currentTask,
                resultData, errorMessage, at, completedAt);
    }

    StoredTaskResult progress(int percent, String label, TaskStatus newStatus) {
        return new StoredTaskResult(runId, taskName, newStatus, percent, label,
                resultData, errorMessage, startedAt, completedAt);
    }

    StoredTaskResult result(TaskStatus newStatus, Map<String, Object> payload, String error, Instant at) {
        int percent = newStatus == TaskStatus.COMPLETED ? 100 : progressPercent;
        return new StoredTaskResult(runId, taskName, newStatus, percent, currentTask,
                payload, error, startedAt, at);
    }
}
