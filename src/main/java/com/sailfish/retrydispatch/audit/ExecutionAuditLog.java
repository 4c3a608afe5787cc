package com.sailfish.retrydispatch.audit;

import com.sailfish.retrydispatch.worker.CalloutExchange;
import com.sailfish.retrydispatch.worker.WorkerContext;
import com.sailfish.retrydispatch.worker.WorkerExecutionException;
import com.sailfish.retrydispatch.worker.WorkerOutcome;

/**
 * Audit trail of worker activity. Workers call it for every terminal per-record outcome, whether the record
 * succeeded, failed, or its callout threw.
 */
public interface ExecutionAuditLog {

    /**
     * Records a completed exchange, successful or not, including the raw request and response.
     */
    void recordExchange(WorkerContext context, String recordId, CalloutExchange exchange);

    /**
     * Records a callout that threw instead of returning an exchange.
     */
    void recordError(WorkerContext context, String recordId, Exception error);

    /**
     * Records a failure of the worker as a whole.
     */
    void recordWorkerFailure(WorkerContext context, WorkerExecutionException failure);

    /**
     * Records the final outcome of a worker.
     */
    void recordCompletion(WorkerContext context, WorkerOutcome outcome);

}
