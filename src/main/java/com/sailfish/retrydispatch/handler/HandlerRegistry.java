package com.sailfish.retrydispatch.handler;

import com.sailfish.retrydispatch.RetryableWorker;
import com.sailfish.retrydispatch.model.ExecutionRecord;

import java.util.Collection;

/**
 * Resolves a handler name from configuration into a new worker instance.
 * <p>
 * Fresh runs and retries are created through two separate methods so that callers state which kind of run
 * they start.
 */
public interface HandlerRegistry {

    /**
     * Creates a worker for a brand-new run.
     *
     * @param handlerName The configured handler name.
     * @param execution The execution record of the run.
     * @param recordIds The ids of the records to deliver.
     * @return A new worker, not yet scheduled.
     * @throws HandlerNotFoundException if no handler is registered under the name.
     * @throws HandlerNotCompatibleException if the name is bound to something that cannot produce a worker.
     */
    RetryableWorker newFreshWorker(String handlerName, ExecutionRecord execution, Collection<String> recordIds);

    /**
     * Creates a worker for a retry attempt.
     *
     * @param handlerName The configured handler name.
     * @param child The child execution record of the attempt.
     * @param recordIds The failed ids to retry.
     * @param parent The execution being retried.
     * @return A new worker, not yet scheduled.
     * @throws HandlerNotFoundException if no handler is registered under the name.
     * @throws HandlerNotCompatibleException if the name is bound to something that cannot produce a worker.
     */
    RetryableWorker newRetryWorker(String handlerName, ExecutionRecord child, Collection<String> recordIds,
                                   ExecutionRecord parent);

    boolean isRegistered(String handlerName);

}
