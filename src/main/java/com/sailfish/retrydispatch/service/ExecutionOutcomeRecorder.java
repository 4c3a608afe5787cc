package com.sailfish.retrydispatch.service;

import com.sailfish.retrydispatch.worker.WorkerContext;
import com.sailfish.retrydispatch.worker.WorkerOutcome;

/**
 * Post-processing step that makes a worker's outcome durable. Called by the worker after every external
 * call has returned, never while callouts are in flight.
 */
public interface ExecutionOutcomeRecorder {

    /**
     * Persists the outcome of the context's execution and, for a retry, the updated state of the parent.
     *
     * @param context The worker's context.
     * @param outcome The outcome of all its callouts.
     */
    void recordOutcome(WorkerContext context, WorkerOutcome outcome);

}
