package com.auditlead.core.events;

/**
 * Kinds of events agents publish on the {@link EventBus}.
 */
public enum EventType {
    PROGRESS("progress_update"),
    COMPLETED("task_completed"),
    FAILED("task_failed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
