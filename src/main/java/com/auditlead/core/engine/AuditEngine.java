package com.auditlead.core.engine;

import com.auditlead.core.agent.AgentRegistry;
import com.auditlead.core.context.ContextStore;
import com.auditlead.core.events.AuditEvent;
import com.auditlead.core.events.EventBus;
import com.auditlead.core.logging.MdcContext;
import com.auditlead.core.metrics.AuditleadMetrics;
import com.auditlead.core.model.RunMode;
import com.auditlead.core.model.RunReport;
import com.auditlead.core.model.TaskRecord;
import com.auditlead.core.model.TaskStatus;
import com.auditlead.core.persistence.TaskResultSink;
import com.auditlead.core.scheduler.CancellationSignal;
import com.auditlead.core.scheduler.PhaseOrchestrator;
import com.auditlead.core.scheduler.PhasePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Entry point for audit runs.
 * <p>
 * Builds the per-run context store, event bus, worker pool and cancellation deadline,
 * registers the available agents and drives the standard phase plan to completion.
 * Nothing here outlives the run: every run gets its own store and bus.
 */
@Service
public class AuditEngine {

    private static final Logger log = LoggerFactory.getLogger(AuditEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final AgentRegistry registry;
    private final TaskResultSink sink;
    private final OrchestrationProperties properties;
    private final PhasePlan plan;
    private final AuditleadMetrics metrics;

    @Autowired
    public AuditEngine(AgentRegistry registry, TaskResultSink sink, OrchestrationProperties properties,
                       AuditleadMetrics metrics) {
        this(registry, sink, properties, PhasePlan.standard(), metrics);
    }

    /** Package-private constructor for tests with a custom plan and no metrics. */
    AuditEngine(AgentRegistry registry, TaskResultSink sink, OrchestrationProperties properties,
                PhasePlan plan, AuditleadMetrics metrics) {
        this.registry = registry;
        this.sink = sink;
        this.properties = properties;
        this.plan = plan;
        this.metrics = metrics;
    }

    public RunReport runAudit(String targetId, RunMode mode) {
        return runAudit(new RunRequest(generateRunId(), targetId, mode, null), new CancellationSignal(), List.of());
    }

    /**
     * Run one audit to completion.
     *
     * @param request   what to audit
     * @param signal    cancellation token; also fired when the deadline passes
     * @param listeners bus subscribers that receive every event of the run
     * @return the run summary; agent failures are reported in it, never thrown
     */
    public RunReport runAudit(RunRequest request, CancellationSignal signal, List<Consumer<AuditEvent>> listeners) {
        MdcContext.setRun(request.runId());
        long startMs = System.currentTimeMillis();
        Duration timeout = request.timeout() != null ? request.timeout() : properties.getRunTimeout();
        log.info("Starting audit {} of {} in {} mode (timeout {})",
                request.runId(), request.targetId(), request.mode(), timeout);

        var store = new ContextStore(request.runId(), request.targetId(), request.mode(), properties.getTextBudget());
        var eventBus = new EventBus(ForkJoinPool.commonPool(), properties.getHistoryLimit());
        listeners.forEach(eventBus::subscribeAll);

        var workerCounter = new AtomicInteger(0);
        ExecutorService workers = Executors.newFixedThreadPool(Math.max(1, properties.getMaxParallel()), r -> {
            Thread t = new Thread(r, "auditlead-worker-" + workerCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ScheduledExecutorService deadline = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "auditlead-deadline-" + request.runId());
            t.setDaemon(true);
            return t;
        });

        try {
            if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
                signal.cancelAfter(timeout, deadline);
            }

            var orchestrator = new PhaseOrchestrator(store, eventBus, sink, workers, signal, plan,
                    properties.defaultRetryPolicy(), metrics);
            orchestrator.registerAll(registry.agents());
            List<TaskRecord> records = orchestrator.runAll();

            var report = new RunReport(request.runId(), request.targetId(), request.mode(), records,
                    store.artifactCounts(), signal.isCancelled(),
                    Duration.ofMillis(System.currentTimeMillis() - startMs));
            if (metrics != null) {
                metrics.recordRunResult(report.outcome());
            }
            log.info("Audit {} finished: {} ({} completed, {} failed, {} skipped) in {}ms",
                    request.runId(), report.outcome(), report.count(TaskStatus.COMPLETED),
                    report.failed().size(), report.skipped().size(), report.elapsed().toMillis());
            return report;
        } finally {
            deadline.shutdownNow();
            workers.shutdownNow();
            MdcContext.clear();
        }
    }

    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("AUD-%d-%04d", year, count);
    }
}
