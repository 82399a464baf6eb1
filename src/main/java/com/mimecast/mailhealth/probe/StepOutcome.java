package com.mimecast.mailhealth.probe;

/**
 * Outcome of a send or receive step.
 */
public enum StepOutcome {
    SUCCESS,
    FAILURE,

    /**
     * Step skipped because an earlier step failed.
     */
    NOT_ATTEMPTED
}
