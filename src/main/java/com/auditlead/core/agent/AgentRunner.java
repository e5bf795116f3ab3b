package com.auditlead.core.agent;

import com.auditlead.core.context.ContextStore;
import com.auditlead.core.events.AuditEvent;
import com.auditlead.core.events.EventBus;
import com.auditlead.core.events.EventType;
import com.auditlead.core.metrics.AuditleadMetrics;
import com.auditlead.core.model.TaskRecord;
import com.auditlead.core.model.TaskStatus;
import com.auditlead.core.persistence.TaskResultSink;
import com.auditlead.core.scheduler.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Executes one {@link Agent} within one run.
 * <p>
 * Applies the uniform execution contract around the agent's work function: the record
 * moves PENDING to RUNNING to COMPLETED or FAILED, progress is monotone and ends at 100
 * on success, failed attempts are retried with exponential backoff, and every state
 * change is written to the context store, published on the event bus and handed to the
 * result sink. Sink failures are logged and never change the outcome.
 */
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final Agent agent;
    private final ContextStore store;
    private final EventBus eventBus;
    private final TaskResultSink sink;
    private final RetryPolicy retryPolicy;
    private final CancellationSignal signal;
    private final AuditleadMetrics metrics;

    private final Object progressLock = new Object();

    public AgentRunner(Agent agent, ContextStore store, EventBus eventBus, TaskResultSink sink,
                       RetryPolicy defaultPolicy, CancellationSignal signal, AuditleadMetrics metrics) {
        this.agent = agent;
        this.store = store;
        this.eventBus = eventBus;
        this.sink = sink;
        this.retryPolicy = agent.retryPolicy().orElse(defaultPolicy);
        this.signal = signal;
        this.metrics = metrics;
    }

    public String name() {
        return agent.name();
    }

    public List<String> dependencies() {
        return agent.dependencies();
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /** True when every dependency has COMPLETED in this run. */
    public boolean canRun() {
        return agent.dependencies().stream().allMatch(store::isCompleted);
    }

    public List<String> unmetDependencies() {
        return agent.dependencies().stream().filter(dep -> !store.isCompleted(dep)).toList();
    }

    public TaskRecord record() {
        return store.record(agent.name())
                .orElseThrow(() -> new IllegalStateException("Task " + agent.name() + " is not registered"));
    }

    /**
     * Run the agent to a terminal status. Never throws for failures of the work function;
     * those end in FAILED.
     *
     * @return the terminal record
     */
    public TaskRecord execute() {
        String name = agent.name();
        String display = agent.displayName();
        long startMs = System.currentTimeMillis();
        Instant startedAt = Instant.now();

        store.setResult(record().running("Starting " + display, startedAt));
        persistSafely("start", () -> sink.saveStarted(store.runId(), name, startedAt));
        updateProgress(0, "Starting " + display);
        log.info("[{}] Starting {}", name, display);

        String lastError = null;
        int maxAttempts = retryPolicy.maxRetries();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (signal.isCancelled()) {
                lastError = cancelledDetail();
                break;
            }
            setRecord(record().withAttempts(attempt));

            WorkOutcome outcome;
            try (var attachment = signal.attach(Thread.currentThread())) {
                outcome = agent.doWork(new RunnerContext(attempt));
            } catch (InterruptedException e) {
                if (signal.isCancelled()) {
                    lastError = cancelledDetail();
                    break;
                }
                // Interrupted by something other than this run's signal
                Thread.currentThread().interrupt();
                outcome = WorkOutcome.failure(errorMessage(e));
            } catch (CancellationException e) {
                if (signal.isCancelled()) {
                    lastError = cancelledDetail();
                    break;
                }
                outcome = WorkOutcome.failure(errorMessage(e));
            } catch (Exception e) {
                outcome = WorkOutcome.failure(errorMessage(e));
            }

            if (outcome == null) {
                outcome = WorkOutcome.failure("work function returned no outcome");
            }
            if (outcome.isSuccess()) {
                return complete(outcome.payload(), startMs);
            }

            lastError = outcome.error();
            if (signal.isCancelled()) {
                lastError = cancelledDetail();
                break;
            }
            log.warn("[{}] Attempt {}/{} failed: {}", name, attempt, maxAttempts, lastError);

            if (attempt < maxAttempts) {
                if (metrics != null) {
                    metrics.recordRetry(name);
                }
                Duration backoff = retryPolicy.backoffAfter(attempt);
                try {
                    if (signal.sleep(backoff)) {
                        lastError = cancelledDetail();
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    if (signal.isCancelled()) {
                        lastError = cancelledDetail();
                    }
                    break;
                }
            }
        }
        return fail(lastError, startMs);
    }

    private TaskRecord complete(Map<String, Object> payload, long startMs) {
        String name = agent.name();
        updateProgress(100, "Complete");
        TaskRecord done;
        synchronized (progressLock) {
            done = record().completed(payload, Instant.now());
            store.setResult(done);
        }
        persistSafely("result", () -> sink.saveResult(store.runId(), name, TaskStatus.COMPLETED,
                done.resultPayload(), null));

        var eventPayload = new LinkedHashMap<String, Object>();
        eventPayload.put("status", TaskStatus.COMPLETED.wireName());
        eventPayload.putAll(done.resultPayload());
        eventBus.publish(AuditEvent.of(store.runId(), name, EventType.COMPLETED, eventPayload));

        long elapsed = System.currentTimeMillis() - startMs;
        recordMetrics(TaskStatus.COMPLETED, elapsed);
        log.info("[{}] Completed in {}ms after {} attempt(s)", name, elapsed, done.attempts());
        return done;
    }

    private TaskRecord fail(String error, long startMs) {
        String name = agent.name();
        String detail = error != null ? error : "unknown error";
        TaskRecord failed;
        synchronized (progressLock) {
            failed = record().failed(detail, Instant.now());
            store.setResult(failed);
        }
        persistSafely("result", () -> sink.saveResult(store.runId(), name, TaskStatus.FAILED, null, detail));

        var eventPayload = new LinkedHashMap<String, Object>();
        eventPayload.put("status", TaskStatus.FAILED.wireName());
        eventPayload.put("error", detail);
        eventBus.publish(AuditEvent.of(store.runId(), name, EventType.FAILED, eventPayload));

        long elapsed = System.currentTimeMillis() - startMs;
        recordMetrics(TaskStatus.FAILED, elapsed);
        log.error("[{}] Failed after {} attempt(s): {}", name, failed.attempts(), detail);
        return failed;
    }

    /**
     * Record progress for the running agent. Ignored once the record is no longer
     * RUNNING; lower percentages than already reported keep the higher value.
     */
    void updateProgress(int percent, String label) {
        TaskRecord updated;
        synchronized (progressLock) {
            TaskRecord current = record();
            if (current.status() != TaskStatus.RUNNING) {
                return;
            }
            int clamped = Math.max(current.progressPercent(), Math.max(0, Math.min(100, percent)));
            String nextLabel = label == null || label.isBlank() ? current.currentTaskLabel() : label;
            updated = current.withProgress(clamped, nextLabel);
            store.setResult(updated);

            var payload = new LinkedHashMap<String, Object>();
            payload.put("progress", updated.progressPercent());
            payload.put("task", updated.currentTaskLabel());
            eventBus.publish(AuditEvent.of(store.runId(), agent.name(), EventType.PROGRESS, payload));
        }
        persistSafely("progress", () -> sink.saveProgress(store.runId(), agent.name(),
                updated.progressPercent(), updated.currentTaskLabel(), TaskStatus.RUNNING));
    }

    private void setRecord(TaskRecord record) {
        synchronized (progressLock) {
            store.setResult(record);
        }
    }

    private static String errorMessage(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private String cancelledDetail() {
        String reason = signal.reason();
        return TaskRecord.CANCELLED + (reason != null ? ": " + reason : "");
    }

    private void recordMetrics(TaskStatus status, long elapsedMs) {
        if (metrics != null) {
            metrics.recordAgentExecution(agent.name(), elapsedMs);
            metrics.recordAgentOutcome(agent.name(), status);
        }
    }

    private void persistSafely(String what, Runnable write) {
        try {
            write.run();
        } catch (Exception e) {
            log.warn("[{}] Failed to persist {}: {}", agent.name(), what, e.getMessage());
        }
    }

    private final class RunnerContext implements AgentContext {

        private final int attempt;

        RunnerContext(int attempt) {
            this.attempt = attempt;
        }

        @Override
        public String runId() {
            return store.runId();
        }

        @Override
        public ContextStore store() {
            return store;
        }

        @Override
        public int attempt() {
            return attempt;
        }

        @Override
        public void updateProgress(int percent, String label) {
            AgentRunner.this.updateProgress(percent, label);
        }

        @Override
        public boolean isCancelled() {
            return signal.isCancelled();
        }
    }
}
