package com.auditlead.core.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one invocation of an agent's work function.
 *
 * @param payload structured output on success, {@code null} on failure
 * @param error   failure message, {@code null} on success
 */
public record WorkOutcome(Map<String, Object> payload, String error) {

    public static WorkOutcome success(Map<String, Object> payload) {
        return new WorkOutcome(
                payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload)),
                null);
    }

    public static WorkOutcome failure(String error) {
        return new WorkOutcome(null, error == null || error.isBlank() ? "unknown error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
