package com.auditlead.core.context;

import com.auditlead.core.model.RunMode;
import com.auditlead.core.model.SharedArtifact;
import com.auditlead.core.model.TaskRecord;
import com.auditlead.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared state for all agents of a single run.
 * <p>
 * All writes go through one exclusive lock. Artifacts are published as immutable
 * snapshots through a volatile reference, and task records live in a concurrent map,
 * so readers never take the lock and never observe a half-applied write. A record's
 * status and payload travel in the same {@link TaskRecord}, so a reader that sees
 * COMPLETED also sees the full payload.
 */
public class ContextStore {

    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);

    /** Per-artifact cap applied by {@link #concatenatedText}. */
    public static final int MAX_CHARS_PER_ARTIFACT = 5000;

    public static final int DEFAULT_TEXT_BUDGET = 50_000;

    private final String runId;
    private final String targetId;
    private final RunMode runMode;
    private final int textBudget;
    private volatile String targetName = "";

    private final ReentrantLock writeLock = new ReentrantLock();

    /** kind -> (key -> artifact); both levels are immutable snapshots replaced on write. */
    private volatile Map<String, Map<String, SharedArtifact>> artifacts = Map.of();

    private final ConcurrentHashMap<String, TaskRecord> records = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> registrationOrder = new CopyOnWriteArrayList<>();

    public ContextStore(String runId, String targetId, RunMode runMode) {
        this(runId, targetId, runMode, DEFAULT_TEXT_BUDGET);
    }

    public ContextStore(String runId, String targetId, RunMode runMode, int textBudget) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.runMode = Objects.requireNonNull(runMode, "runMode");
        if (textBudget < 1) {
            throw new IllegalArgumentException("textBudget must be positive: " + textBudget);
        }
        this.textBudget = textBudget;
    }

    // -- Run-scoped scalars ---------------------------------------------------

    public String runId() {
        return runId;
    }

    public String targetId() {
        return targetId;
    }

    public RunMode runMode() {
        return runMode;
    }

    public String targetName() {
        return targetName;
    }

    public void setTargetName(String name) {
        writeLock.lock();
        try {
            this.targetName = name == null ? "" : name;
        } finally {
            writeLock.unlock();
        }
    }

    // -- Artifacts ------------------------------------------------------------

    /**
     * Store an artifact, replacing any previous artifact with the same kind and key.
     */
    public void setArtifact(SharedArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact");
        writeLock.lock();
        try {
            var current = artifacts;
            var byKey = new LinkedHashMap<>(current.getOrDefault(artifact.kind(), Map.of()));
            byKey.put(artifact.key(), artifact);
            var next = new LinkedHashMap<>(current);
            next.put(artifact.kind(), Collections.unmodifiableMap(byKey));
            artifacts = Collections.unmodifiableMap(next);
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<SharedArtifact> artifact(String kind, String key) {
        return Optional.ofNullable(artifacts.getOrDefault(kind, Map.of()).get(key));
    }

    /** All artifacts of a kind, in first-insertion order. */
    public List<SharedArtifact> artifacts(String kind) {
        return List.copyOf(artifacts.getOrDefault(kind, Map.of()).values());
    }

    public List<SharedArtifact> artifactsWhere(String kind, String attribute, Object value) {
        return artifacts.getOrDefault(kind, Map.of()).values().stream()
                .filter(a -> Objects.equals(a.attribute(attribute), value))
                .toList();
    }

    public List<SharedArtifact> artifactsWithKeyPrefix(String kind, String prefix) {
        return artifacts.getOrDefault(kind, Map.of()).values().stream()
                .filter(a -> a.key().startsWith(prefix))
                .toList();
    }

    /**
     * The artifact whose key is the run target (ignoring a trailing slash), falling back
     * to the first artifact of the kind.
     */
    public Optional<SharedArtifact> primaryArtifact(String kind) {
        var byKey = artifacts.getOrDefault(kind, Map.of());
        String normalized = stripTrailingSlash(targetId);
        for (var artifact : byKey.values()) {
            if (stripTrailingSlash(artifact.key()).equals(normalized)) {
                return Optional.of(artifact);
            }
        }
        return byKey.values().stream().findFirst();
    }

    /** {@link #concatenatedText(String, int)} with the run's default budget. */
    public String concatenatedText(String kind) {
        return concatenatedText(kind, textBudget);
    }

    /**
     * Aggregate the text of all artifacts of a kind into one block, each artifact capped at
     * {@link #MAX_CHARS_PER_ARTIFACT} characters. Stops before the first artifact that would
     * push the total past {@code maxChars}.
     */
    public String concatenatedText(String kind, int maxChars) {
        var parts = new StringBuilder();
        for (var artifact : artifacts.getOrDefault(kind, Map.of()).values()) {
            var chunk = new StringBuilder();
            chunk.append("\n--- ").append(kind.toUpperCase(Locale.ROOT)).append(": ").append(artifact.key()).append(" ---\n");
            Object title = artifact.attribute("title");
            if (title != null) {
                chunk.append("Title: ").append(title).append('\n');
            }
            String text = artifact.text();
            chunk.append("Content:\n")
                    .append(text, 0, Math.min(text.length(), MAX_CHARS_PER_ARTIFACT))
                    .append('\n');
            int separator = parts.length() > 0 ? 1 : 0;
            if (parts.length() + separator + chunk.length() > maxChars) {
                break;
            }
            if (separator > 0) {
                parts.append('\n');
            }
            parts.append(chunk);
        }
        return parts.toString();
    }

    public Map<String, Integer> artifactCounts() {
        var counts = new LinkedHashMap<String, Integer>();
        artifacts.forEach((kind, byKey) -> counts.put(kind, byKey.size()));
        return Collections.unmodifiableMap(counts);
    }

    // -- Task records ---------------------------------------------------------

    /**
     * Pre-register a PENDING record for an agent taking part in this run. Idempotent.
     */
    public void registerTask(String name) {
        writeLock.lock();
        try {
            if (records.putIfAbsent(name, TaskRecord.pending(name)) == null) {
                registrationOrder.add(name);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replace an agent's record. Status and payload are written together.
     *
     * @throws IllegalStateException if the agent was never registered or its current record is terminal
     */
    public void setResult(TaskRecord record) {
        Objects.requireNonNull(record, "record");
        writeLock.lock();
        try {
            TaskRecord current = records.get(record.name());
            if (current == null) {
                throw new IllegalStateException("Task " + record.name() + " is not registered in run " + runId);
            }
            if (current.status().isTerminal()) {
                throw new IllegalStateException("Task " + record.name() + " is already " + current.status());
            }
            if (current.status() != record.status() && !current.status().canTransitionTo(record.status())) {
                throw new IllegalStateException("Illegal status transition for " + record.name()
                        + ": " + current.status() + " -> " + record.status());
            }
            records.put(record.name(), record);
            log.debug("Record {} -> {} ({}%)", record.name(), record.status(), record.progressPercent());
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<TaskRecord> record(String name) {
        return Optional.ofNullable(records.get(name));
    }

    /** Result payload of a COMPLETED agent. */
    public Optional<Map<String, Object>> getResult(String name) {
        TaskRecord record = records.get(name);
        if (record == null || record.status() != TaskStatus.COMPLETED) {
            return Optional.empty();
        }
        return Optional.of(record.resultPayload());
    }

    public boolean isCompleted(String name) {
        TaskRecord record = records.get(name);
        return record != null && record.isCompleted();
    }

    /** All records in registration order. */
    public List<TaskRecord> records() {
        return registrationOrder.stream().map(records::get).toList();
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
