package com.auditlead.core.persistence;

/**
 * A {@link TaskResultSink} write that could not be completed.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
