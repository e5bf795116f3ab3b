package com.auditlead.core.agent;

import com.auditlead.core.model.AgentName;

import java.util.List;
import java.util.Optional;

/**
 * A specialist analysis task. Implementations hold the task-specific logic only; retry,
 * progress, status and persistence are applied uniformly by {@link AgentRunner}.
 * <p>
 * Implementations are expected to be stateless: {@link #doWork} is invoked from scratch
 * on every attempt and may run concurrently for different runs.
 */
public interface Agent {

    /** Unique name, e.g. {@code "web_scraper"}. */
    String name();

    default String displayName() {
        return AgentName.displayNameOf(name());
    }

    /** Names of agents that must have COMPLETED in the same run before this one may start. */
    default List<String> dependencies() {
        return List.of();
    }

    /** Per-agent override of the configured retry policy. */
    default Optional<RetryPolicy> retryPolicy() {
        return Optional.empty();
    }

    /**
     * Perform one attempt.
     *
     * @param context run state, progress reporting and cancellation for this attempt
     * @return success with a payload, or failure with a message
     * @throws Exception any error; treated like a returned failure
     */
    WorkOutcome doWork(AgentContext context) throws Exception;
}
