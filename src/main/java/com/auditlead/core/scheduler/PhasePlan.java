package com.auditlead.core.scheduler;

import com.auditlead.core.model.AgentName;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed, hand-ordered sequence of phases of an audit run.
 */
public record PhasePlan(List<Phase> phases) {

    public PhasePlan {
        phases = List.copyOf(phases);
        Map<String, String> seen = new HashMap<>();
        for (Phase phase : phases) {
            for (String agent : phase.agentNames()) {
                String previous = seen.putIfAbsent(agent, phase.name());
                if (previous != null) {
                    throw new IllegalArgumentException("Agent " + agent + " appears in phases "
                            + previous + " and " + phase.name());
                }
            }
        }
    }

    /**
     * Collection, auxiliary capture, enrichment, parallel analysis, dependent synthesis
     * and final aggregation.
     */
    public static PhasePlan standard() {
        return new PhasePlan(List.of(
                Phase.of("Crawling", AgentName.WEB_SCRAPER.wireName()),
                Phase.of("Screenshots", AgentName.SCREENSHOT.wireName()),
                Phase.of("Research", AgentName.COMPANY_RESEARCH.wireName()),
                Phase.of("Analysis",
                        AgentName.COMPETITOR.wireName(),
                        AgentName.REVIEW_SENTIMENT.wireName(),
                        AgentName.SEO.wireName(),
                        AgentName.MESSAGING.wireName(),
                        AgentName.VISUAL_DESIGN.wireName(),
                        AgentName.CONVERSION.wireName(),
                        AgentName.SOCIAL.wireName()),
                Phase.of("Segmentation", AgentName.ICP.wireName()),
                Phase.of("Reporting", AgentName.REPORT.wireName())));
    }

    public Optional<String> phaseOf(String agentName) {
        return phases.stream()
                .filter(p -> p.agentNames().contains(agentName))
                .map(Phase::name)
                .findFirst();
    }

    public boolean contains(String agentName) {
        return phaseOf(agentName).isPresent();
    }
}
