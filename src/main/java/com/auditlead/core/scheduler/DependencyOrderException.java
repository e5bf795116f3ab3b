package com.auditlead.core.scheduler;

/**
 * A phase contains an agent whose dependency is registered for the run but has not been
 * scheduled by any earlier phase. Indicates a misordered phase plan.
 */
public class DependencyOrderException extends IllegalStateException {

    private final String agentName;
    private final String dependency;

    public DependencyOrderException(String phase, String agentName, String dependency) {
        super("Agent " + agentName + " in phase " + phase + " depends on " + dependency
                + ", which no earlier phase has run");
        this.agentName = agentName;
        this.dependency = dependency;
    }

    public String agentName() {
        return agentName;
    }

    public String dependency() {
        return dependency;
    }
}
