package com.auditlead.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * Selects which agents take part in a run.
 */
public enum RunMode {
    /** Every registered agent. */
    FULL(null),
    /** Reduced subset for a fast first look. */
    QUICK(Set.of(
            AgentName.WEB_SCRAPER.wireName(),
            AgentName.SCREENSHOT.wireName(),
            AgentName.COMPANY_RESEARCH.wireName(),
            AgentName.SEO.wireName(),
            AgentName.MESSAGING.wireName(),
            AgentName.COMPETITOR.wireName(),
            AgentName.REPORT.wireName()));

    private final Set<String> agentNames;

    RunMode(Set<String> agentNames) {
        this.agentNames = agentNames;
    }

    public boolean includes(String agentName) {
        return agentNames == null || agentNames.contains(agentName);
    }

    public static RunMode parse(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
