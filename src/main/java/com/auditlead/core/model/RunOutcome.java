package com.auditlead.core.model;

/**
 * Overall verdict for a finished run, derived from its terminal task records.
 */
public enum RunOutcome {
    /** Every registered agent completed. */
    SUCCEEDED,
    /** At least one agent completed, but some failed or were skipped. */
    PARTIAL,
    /** No agent produced usable output. More severe than PARTIAL. */
    NO_OUTPUT
}
