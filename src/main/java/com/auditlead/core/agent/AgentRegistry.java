package com.auditlead.core.agent;

import com.auditlead.core.model.AgentName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All {@link Agent} implementations known to the application, in catalog order followed
 * by any agents outside the catalog. Catalog entries without an implementation are
 * reported once at startup and left out of runs.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Agent> agents;

    @Autowired
    public AgentRegistry(ObjectProvider<Agent> agentBeans) {
        this(agentBeans.orderedStream().toList());
    }

    public AgentRegistry(List<Agent> implementations) {
        var byName = new LinkedHashMap<String, Agent>();
        for (Agent agent : implementations) {
            Agent previous = byName.putIfAbsent(agent.name(), agent);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate agent name: " + agent.name());
            }
        }

        var ordered = new LinkedHashMap<String, Agent>();
        List<String> missing = new ArrayList<>();
        for (String name : AgentName.allWireNames()) {
            Agent agent = byName.remove(name);
            if (agent != null) {
                ordered.put(name, agent);
            } else {
                missing.add(name);
            }
        }
        ordered.putAll(byName);
        this.agents = Collections.unmodifiableMap(ordered);

        if (!missing.isEmpty()) {
            log.warn("No implementation for agent(s) {}; they will be left out of runs", missing);
        }
        log.info("Agent registry initialised with {} agent(s): {}", agents.size(), agents.keySet());
    }

    public List<Agent> agents() {
        return List.copyOf(agents.values());
    }

    public Optional<Agent> find(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public boolean isImplemented(String name) {
        return agents.containsKey(name);
    }
}
