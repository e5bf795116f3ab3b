package com.auditlead.core.agent;

import com.auditlead.core.context.ContextStore;

import java.util.concurrent.CancellationException;

/**
 * What an agent's work function can see and do during one attempt.
 */
public interface AgentContext {

    String runId();

    /** The shared store of the current run. */
    ContextStore store();

    /** 1-based attempt number. */
    int attempt();

    /**
     * Report progress. Values are clamped to 0-100 and never move backwards.
     *
     * @param percent completion percentage
     * @param label   what the agent is doing now; blank keeps the previous label
     */
    void updateProgress(int percent, String label);

    boolean isCancelled();

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("run cancelled");
        }
    }
}
