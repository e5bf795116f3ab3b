package com.auditlead.core.scheduler;

import com.auditlead.core.agent.Agent;
import com.auditlead.core.agent.AgentRunner;
import com.auditlead.core.agent.RetryPolicy;
import com.auditlead.core.context.ContextStore;
import com.auditlead.core.events.EventBus;
import com.auditlead.core.logging.MdcContext;
import com.auditlead.core.metrics.AuditleadMetrics;
import com.auditlead.core.model.TaskRecord;
import com.auditlead.core.model.TaskStatus;
import com.auditlead.core.persistence.TaskResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the agents of one audit run phase by phase.
 * <p>
 * Each phase fans its ready agents out onto the run's executor and waits until every one
 * of them is terminal before the next phase starts. An agent whose dependencies are not
 * all COMPLETED is skipped with a warning and stays PENDING. Agent failures never abort
 * the run; only scheduler-level errors ({@link DependencyOrderException},
 * {@link OrchestrationException}) propagate.
 */
public class PhaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PhaseOrchestrator.class);

    /** Phase name used for registered agents that the plan does not mention. */
    static final String UNPLANNED_PHASE = "Additional";

    private final ContextStore store;
    private final EventBus eventBus;
    private final TaskResultSink sink;
    private final Executor executor;
    private final CancellationSignal signal;
    private final PhasePlan plan;
    private final RetryPolicy defaultPolicy;
    private final AuditleadMetrics metrics;

    private final Map<String, AgentRunner> runners = new LinkedHashMap<>();
    private final Set<String> considered = ConcurrentHashMap.newKeySet();

    public PhaseOrchestrator(ContextStore store, EventBus eventBus, TaskResultSink sink, Executor executor,
                             CancellationSignal signal, PhasePlan plan, RetryPolicy defaultPolicy,
                             AuditleadMetrics metrics) {
        this.store = store;
        this.eventBus = eventBus;
        this.sink = sink;
        this.executor = executor;
        this.signal = signal;
        this.plan = plan;
        this.defaultPolicy = defaultPolicy;
        this.metrics = metrics;
    }

    /**
     * Create one runner per agent included by the run mode and pre-register its record.
     *
     * @return names of the registered agents, in registration order
     */
    public List<String> registerAll(Collection<Agent> agents) {
        List<String> registered = new ArrayList<>();
        for (Agent agent : agents) {
            String name = agent.name();
            if (!store.runMode().includes(name)) {
                log.debug("Agent {} not included in {} mode", name, store.runMode());
                continue;
            }
            if (runners.containsKey(name)) {
                throw new IllegalArgumentException("Agent " + name + " registered twice");
            }
            store.registerTask(name);
            runners.put(name, new AgentRunner(agent, store, eventBus, sink, defaultPolicy, signal, metrics));
            registered.add(name);
            if (!plan.contains(name)) {
                log.warn("Agent {} is not part of any planned phase; it will run in phase '{}'",
                        name, UNPLANNED_PHASE);
            }
        }

        try {
            sink.registerTasks(store.runId(), List.copyOf(registered));
        } catch (Exception e) {
            log.warn("Failed to pre-register results for run {}: {}", store.runId(), e.getMessage());
        }
        log.info("Registered {} agent(s) for {} run: {}", registered.size(), store.runMode(), registered);
        return registered;
    }

    public boolean isRegistered(String name) {
        return runners.containsKey(name);
    }

    /**
     * Run every ready agent of a phase concurrently and wait until all are terminal.
     * Names that are not registered for this run are ignored.
     *
     * @return the records of the agents this phase scheduled, after they settled
     * @throws DependencyOrderException if an agent depends on a registered agent no earlier phase has run
     * @throws OrchestrationException   if an agent wrapper failed unexpectedly
     */
    public List<TaskRecord> runPhase(String phaseName, List<String> agentNames) {
        MdcContext.setPhase(store.runId(), phaseName);
        try {
            List<AgentRunner> members = new ArrayList<>();
            for (String name : agentNames) {
                AgentRunner runner = runners.get(name);
                if (runner == null) {
                    log.debug("  {} not registered for this run, ignoring", name);
                    continue;
                }
                members.add(runner);
            }

            for (AgentRunner runner : members) {
                for (String dep : runner.dependencies()) {
                    if (runners.containsKey(dep) && !considered.contains(dep)) {
                        throw new DependencyOrderException(phaseName, runner.name(), dep);
                    }
                }
            }
            members.forEach(r -> considered.add(r.name()));

            List<AgentRunner> ready = new ArrayList<>();
            for (AgentRunner runner : members) {
                if (runner.record().status() != TaskStatus.PENDING) {
                    log.debug("  {} already {}, not rescheduling", runner.name(), runner.record().status());
                } else if (signal.isCancelled()) {
                    log.warn("  {} skipped: run cancelled ({})", runner.name(), signal.reason());
                    recordSkipped(runner.name(), "cancelled");
                } else if (!runner.canRun()) {
                    log.warn("  {} skipped: dependencies not met {}", runner.name(), runner.unmetDependencies());
                    recordSkipped(runner.name(), "dependencies");
                } else {
                    ready.add(runner);
                }
            }

            log.info("Phase '{}': launching {} of {} agent(s)", phaseName, ready.size(), members.size());
            if (metrics != null) {
                metrics.recordPhase(phaseName, ready.size());
            }
            return awaitAll(phaseName, launch(phaseName, ready));
        } finally {
            MdcContext.clearPhase();
        }
    }

    /**
     * Run the planned phases in order, then any registered agents the plan does not
     * mention, one extra phase per dependency layer. Phases without registered agents
     * are not run.
     *
     * @return all records of the run, in registration order
     */
    public List<TaskRecord> runAll() {
        for (Phase phase : plan.phases()) {
            List<String> names = phase.agentNames().stream().filter(runners::containsKey).toList();
            if (names.isEmpty()) {
                log.debug("Phase '{}' has no registered agents, skipping", phase.name());
                continue;
            }
            runPhase(phase.name(), names);
        }

        List<String> unplanned = runners.keySet().stream().filter(n -> !plan.contains(n)).toList();
        List<List<String>> layers = unplannedLayers(unplanned);
        for (int i = 0; i < layers.size(); i++) {
            runPhase(i == 0 ? UNPLANNED_PHASE : UNPLANNED_PHASE + " " + (i + 1), layers.get(i));
        }
        return store.records();
    }

    /**
     * Split agents the plan does not mention into layers so that each agent comes after
     * every unplanned agent it depends on. Agents caught in a dependency cycle can never
     * become ready; they are skipped and stay PENDING.
     */
    private List<List<String>> unplannedLayers(List<String> unplanned) {
        List<List<String>> layers = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        List<String> remaining = new ArrayList<>(unplanned);
        while (!remaining.isEmpty()) {
            List<String> layer = remaining.stream()
                    .filter(name -> runners.get(name).dependencies().stream()
                            .allMatch(dep -> placed.contains(dep) || !unplanned.contains(dep)))
                    .toList();
            if (layer.isEmpty()) {
                log.warn("Agents {} depend on each other in a cycle; skipping them", remaining);
                remaining.forEach(name -> {
                    considered.add(name);
                    recordSkipped(name, "dependencies");
                });
                break;
            }
            layers.add(layer);
            placed.addAll(layer);
            remaining.removeAll(layer);
        }
        return layers;
    }

    private List<CompletableFuture<TaskRecord>> launch(String phaseName, List<AgentRunner> ready) {
        String runId = store.runId();
        List<CompletableFuture<TaskRecord>> futures = new ArrayList<>();
        for (AgentRunner runner : ready) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    MdcContext.setAgent(runId, runner.name(), phaseName);
                    try {
                        return runner.execute();
                    } finally {
                        MdcContext.clear();
                    }
                }, executor));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.failedFuture(e));
            }
        }
        return futures;
    }

    private List<TaskRecord> awaitAll(String phaseName, List<CompletableFuture<TaskRecord>> futures) {
        List<TaskRecord> settled = new ArrayList<>();
        List<Throwable> errors = new ArrayList<>();
        for (CompletableFuture<TaskRecord> future : futures) {
            try {
                settled.add(future.join());
            } catch (CompletionException e) {
                errors.add(e.getCause() != null ? e.getCause() : e);
            }
        }

        if (!errors.isEmpty()) {
            var failure = new OrchestrationException(
                    "Phase '" + phaseName + "': " + errors.size() + " agent wrapper(s) failed", errors.get(0));
            errors.stream().skip(1).forEach(failure::addSuppressed);
            log.error("Phase '{}' aborted: {}", phaseName, failure.getMessage(), errors.get(0));
            throw failure;
        }

        long completed = settled.stream().filter(TaskRecord::isCompleted).count();
        log.info("Phase '{}' settled: {} completed, {} failed", phaseName, completed, settled.size() - completed);
        return settled;
    }

    private void recordSkipped(String agentName, String reason) {
        if (metrics != null) {
            metrics.recordSkipped(agentName, reason);
        }
    }
}
