package com.sailfish.retrydispatch;

import com.sailfish.retrydispatch.worker.WorkerContext;
import com.sailfish.retrydispatch.worker.WorkerState;

/**
 * Represents one unit of integration work that can be scheduled asynchronously.
 * Instances are created per run by a {@link com.sailfish.retrydispatch.handler.RetryableWorkerFactory},
 * already carrying everything they need, and are executed at most once.
 *
 * @see com.sailfish.retrydispatch.worker.AbstractRetryableWorker
 */
public interface RetryableWorker extends Runnable {

    /**
     * @return The context captured when the worker was created: fresh or retry mode, the execution record
     * to report on, the record ids to process and, for retries, the parent execution.
     */
    WorkerContext getContext();

    /**
     * @return The current lifecycle state.
     */
    WorkerState getState();

    /**
     * Performs the integration-specific work. Must not throw: failures are recorded, never propagated.
     */
    @Override
    void run();
}
