package com.auditlead.core.engine;

import com.auditlead.core.model.RunMode;

import java.time.Duration;
import java.util.Objects;

/**
 * What to audit and how.
 *
 * @param runId    unique run identifier
 * @param targetId the audited target, opaque to the core
 * @param mode     which agents take part
 * @param timeout  run deadline, or {@code null} for the configured default
 */
public record RunRequest(String runId, String targetId, RunMode mode, Duration timeout) {

    public RunRequest {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(targetId, "targetId");
        mode = mode == null ? RunMode.FULL : mode;
    }
}
