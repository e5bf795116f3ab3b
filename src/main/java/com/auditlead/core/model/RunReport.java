package com.auditlead.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Summary of one finished run.
 *
 * @param runId          run identifier
 * @param targetId       audited target (opaque to the core)
 * @param mode           run mode
 * @param records        terminal or still-pending records, in registration order
 * @param artifactCounts number of shared artifacts per kind at the end of the run
 * @param cancelled      whether the run was cancelled or hit its deadline
 * @param elapsed        wall-clock time of the run
 */
public record RunReport(
    String runId,
    String targetId,
    RunMode mode,
    List<TaskRecord> records,
    Map<String, Integer> artifactCounts,
    boolean cancelled,
    Duration elapsed
) implements Serializable {

    public long count(TaskStatus status) {
        return records.stream().filter(r -> r.status() == status).count();
    }

    public RunOutcome outcome() {
        long completed = count(TaskStatus.COMPLETED);
        if (completed == 0) {
            return RunOutcome.NO_OUTPUT;
        }
        return completed == records.size() ? RunOutcome.SUCCEEDED : RunOutcome.PARTIAL;
    }

    public List<TaskRecord> failed() {
        return records.stream().filter(r -> r.status() == TaskStatus.FAILED).toList();
    }

    /** Agents that never started because a dependency was not met. */
    public List<TaskRecord> skipped() {
        return records.stream().filter(r -> r.status() == TaskStatus.PENDING).toList();
    }
}
