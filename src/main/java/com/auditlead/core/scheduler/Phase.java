package com.auditlead.core.scheduler;

import java.util.List;
import java.util.Objects;

/**
 * A named group of agents that run concurrently and settle together.
 */
public record Phase(String name, List<String> agentNames) {

    public Phase {
        Objects.requireNonNull(name, "name");
        agentNames = List.copyOf(agentNames);
    }

    public static Phase of(String name, String... agentNames) {
        return new Phase(name, List.of(agentNames));
    }
}
