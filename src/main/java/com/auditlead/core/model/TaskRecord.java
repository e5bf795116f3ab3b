package com.auditlead.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Observable status and output of one agent within one run.
 * <p>
 * Instances are immutable; every state change produces a new record that the owning
 * {@code AgentRunner} writes back to the context store in a single call, so status and
 * payload are always published together.
 *
 * @param name             unique agent name within the run
 * @param status           current lifecycle status
 * @param progressPercent  0-100, never decreases within a run
 * @param currentTaskLabel free-text description of what the agent is doing
 * @param resultPayload    structured output, present only when COMPLETED
 * @param errorDetail      last error message, present only when FAILED
 * @param attempts         number of work-function invocations so far
 * @param startedAt        when the agent entered RUNNING (nullable)
 * @param finishedAt       when the agent reached a terminal status (nullable)
 */
public record TaskRecord(
    String name,
    TaskStatus status,
    int progressPercent,
    String currentTaskLabel,
    Map<String, Object> resultPayload,
    String errorDetail,
    int attempts,
    Instant startedAt,
    Instant finishedAt
) implements Serializable {

    /** Prefix of {@link #errorDetail()} for agents stopped by run cancellation. */
    public static final String CANCELLED = "cancelled";

    public static TaskRecord pending(String name) {
        return new TaskRecord(name, TaskStatus.PENDING, 0, "", null, null, 0, null, null);
    }

    public TaskRecord running(String label, Instant now) {
        return transition(TaskStatus.RUNNING, 0, label, null, null, attempts, now, null);
    }

    public TaskRecord withProgress(int percent, String label) {
        return transition(status, percent, label, resultPayload, errorDetail, attempts, startedAt, finishedAt);
    }

    public TaskRecord withAttempts(int attemptCount) {
        return transition(status, progressPercent, currentTaskLabel, resultPayload, errorDetail,
                attemptCount, startedAt, finishedAt);
    }

    public TaskRecord completed(Map<String, Object> payload, Instant now) {
        Map<String, Object> frozen = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        return transition(TaskStatus.COMPLETED, 100, "Complete", frozen, null, attempts, startedAt, now);
    }

    public TaskRecord failed(String error, Instant now) {
        return transition(TaskStatus.FAILED, progressPercent, currentTaskLabel, null,
                error, attempts, startedAt, now);
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    public boolean isCancelled() {
        return status == TaskStatus.FAILED && errorDetail != null && errorDetail.startsWith(CANCELLED);
    }

    private TaskRecord transition(TaskStatus next, int percent, String label, Map<String, Object> payload,
                                  String error, int attemptCount, Instant started, Instant finished) {
        if (next != status && !status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal status transition for " + name + ": " + status + " -> " + next);
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Record for " + name + " is terminal (" + status + ")");
        }
        return new TaskRecord(name, next, percent, label == null ? "" : label, payload, error,
                attemptCount, started, finished);
    }
}
