package com.auditlead.dispatch.cli;

import com.auditlead.core.events.AuditEvent;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Live-status subscriber that prints agent progress to the terminal.
 * Progress lines are printed only when an agent's percentage changes.
 */
public class ConsoleProgressReporter implements Consumer<AuditEvent> {

    private final Map<String, Object> lastPercent = new ConcurrentHashMap<>();

    @Override
    public void accept(AuditEvent event) {
        switch (event.eventType()) {
            case PROGRESS -> {
                Object percent = event.payload().getOrDefault("progress", 0);
                Object previous = lastPercent.put(event.sender(), percent);
                if (!percent.equals(previous)) {
                    ConsoleOutput.agentProgress(event.sender(), percent, event.payload().getOrDefault("task", ""));
                }
            }
            case COMPLETED -> ConsoleOutput.agentCompleted(event.sender());
            case FAILED -> ConsoleOutput.agentFailed(event.sender(), event.payload().get("error"));
        }
    }
}
