package com.sailfish.retrydispatch.worker;

/**
 * How a worker was created.
 */
public enum WorkerMode {
    /**
     * A brand-new run of the integration.
     */
    FRESH,
    /**
     * A retry of a failed run, created by the dispatcher with a parent execution.
     */
    RETRY
}
