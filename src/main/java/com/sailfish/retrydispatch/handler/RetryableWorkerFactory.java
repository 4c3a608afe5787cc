package com.sailfish.retrydispatch.handler;

import com.sailfish.retrydispatch.RetryableWorker;
import com.sailfish.retrydispatch.worker.WorkerContext;

/**
 * Creates a new worker for one run of a handler. Registered under a handler name in a {@link HandlerRegistry}.
 */
@FunctionalInterface
public interface RetryableWorkerFactory {

    /**
     * @param context The fresh or retry context the worker must be bound to.
     * @return A new worker in the {@code INITIALIZED} state whose {@code getContext()} is {@code context}.
     */
    RetryableWorker create(WorkerContext context);

}
