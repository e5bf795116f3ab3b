package com.auditlead.core.metrics;

import com.auditlead.core.model.RunOutcome;
import com.auditlead.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for audit runs.
 */
@Service
public class AuditleadMetrics {

    private final MeterRegistry registry;

    public AuditleadMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAgentExecution(String agentName, long ms) {
        Timer.builder("auditlead.agent.duration")
                .tag("agent", agentName)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAgentOutcome(String agentName, TaskStatus status) {
        Counter.builder("auditlead.agent.outcomes")
                .tag("agent", agentName)
                .tag("status", status.wireName())
                .register(registry)
                .increment();
    }

    /**
     * Records one retry after a failed attempt.
     *
     * @param agentName the agent being retried
     */
    public void recordRetry(String agentName) {
        Counter.builder("auditlead.agent.retries")
                .description("Agent attempts retried after a failure")
                .tag("agent", agentName)
                .register(registry)
                .increment();
    }

    /**
     * Records an agent left pending because its dependencies were not met.
     *
     * @param agentName the skipped agent
     * @param reason    "dependencies" or "cancelled"
     */
    public void recordSkipped(String agentName, String reason) {
        Counter.builder("auditlead.agent.skipped")
                .description("Agents skipped by the scheduler")
                .tag("agent", agentName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPhase(String phase, int agentCount) {
        DistributionSummary.builder("auditlead.phase.size")
                .description("Number of agents launched per phase")
                .tag("phase", phase)
                .register(registry)
                .record(agentCount);
    }

    public void recordRunResult(RunOutcome outcome) {
        Counter.builder("auditlead.runs.total")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
