package com.sailfish.retrydispatch.worker;

/**
 * Lifecycle of a {@link com.sailfish.retrydispatch.RetryableWorker}.
 * {@code INITIALIZED -> RUNNING -> COMPLETED | FAILED}.
 */
public enum WorkerState {
    INITIALIZED,
    RUNNING,
    /**
     * Every record was delivered.
     */
    COMPLETED,
    /**
     * At least one record failed, or the worker itself failed.
     */
    FAILED
}
