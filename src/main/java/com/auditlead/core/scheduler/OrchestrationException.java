package com.auditlead.core.scheduler;

/**
 * An agent wrapper failed unexpectedly while a phase was running.
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
