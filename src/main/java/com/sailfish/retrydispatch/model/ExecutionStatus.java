package com.sailfish.retrydispatch.model;

/**
 * Represents the possible statuses of an integration execution.
 */
public enum ExecutionStatus {
    /**
     * Execution has been created but no worker has picked it up yet.
     */
    PENDING,
    /**
     * A worker is currently performing the callouts for this execution.
     */
    RUNNING,
    /**
     * Every record of the execution was delivered.
     */
    SUCCEEDED,
    /**
     * At least one record failed; the failed ids are kept in {@code retryIds} for a later attempt.
     */
    FAILED,
    /**
     * Records are still failing but the policy's retry limit has been reached.
     */
    EXHAUSTED
}
