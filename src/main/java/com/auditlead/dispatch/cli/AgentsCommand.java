package com.auditlead.dispatch.cli;

import com.auditlead.core.agent.Agent;
import com.auditlead.core.agent.AgentRegistry;
import com.auditlead.core.model.AgentName;
import com.auditlead.core.model.RunMode;
import com.auditlead.core.scheduler.PhasePlan;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: auditlead agents
 * <p>
 * Lists the agent catalog with each agent's phase, whether an implementation is
 * registered and whether the selected mode includes it.
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List known agents")
@Component
public class AgentsCommand implements Callable<Integer> {

    @Option(names = {"--mode", "-m"}, description = "Run mode: quick or full", defaultValue = "full")
    private String mode;

    private final AgentRegistry registry;

    public AgentsCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        RunMode runMode;
        try {
            runMode = RunMode.parse(mode);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid mode: " + mode + ". Valid modes: quick, full");
            return 1;
        }

        Set<String> names = new LinkedHashSet<>(AgentName.allWireNames());
        registry.agents().stream().map(Agent::name).forEach(names::add);
        PhasePlan plan = PhasePlan.standard();

        String format = "%-18s %-28s %-14s %-12s %s%n";
        System.out.printf(format, "NAME", "DISPLAY NAME", "PHASE", "IMPLEMENTED", "IN MODE");
        for (String name : names) {
            System.out.printf(format,
                    name,
                    AgentName.displayNameOf(name),
                    plan.phaseOf(name).orElse("-"),
                    registry.isImplemented(name) ? "yes" : "no",
                    runMode.includes(name) ? "yes" : "no");
        }
        ConsoleOutput.info(registry.agents().size() + " of " + names.size() + " agents implemented");
        if (registry.agents().isEmpty()) {
            ConsoleOutput.warn(ConsoleOutput.NO_AGENTS_HINT);
        }
        return 0;
    }
}
