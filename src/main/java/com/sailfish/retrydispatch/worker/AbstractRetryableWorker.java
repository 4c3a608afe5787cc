package com.sailfish.retrydispatch.worker;

import com.sailfish.retrydispatch.RetryableWorker;
import com.sailfish.retrydispatch.audit.ExecutionAuditLog;
import com.sailfish.retrydispatch.service.ExecutionOutcomeRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for handlers that deliver records one callout at a time.
 * <p>
 * Subclasses implement {@link #callout(String)} and optionally {@link #beforeCallouts()}. This class owns the
 * lifecycle: it performs every callout, audits each result, contains every exception, moves to a terminal
 * state only after the last callout has returned, and only then hands the outcome to the
 * {@link ExecutionOutcomeRecorder}.
 */
public abstract class AbstractRetryableWorker implements RetryableWorker {

    private static final Logger log = LoggerFactory.getLogger(AbstractRetryableWorker.class);

    private final WorkerContext context;
    private final ExecutionOutcomeRecorder outcomeRecorder;
    private final ExecutionAuditLog auditLog;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.INITIALIZED);
    private volatile WorkerOutcome outcome;

    protected AbstractRetryableWorker(WorkerContext context,
                                      ExecutionOutcomeRecorder outcomeRecorder,
                                      ExecutionAuditLog auditLog) {
        this.context = Objects.requireNonNull(context, "context cannot be null");
        this.outcomeRecorder = Objects.requireNonNull(outcomeRecorder, "outcomeRecorder cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog cannot be null");
    }

    /**
     * Delivers one record.
     *
     * @param recordId The id of the record to deliver.
     * @return The exchange, successful or not.
     * @throws Exception if the callout could not be completed; the record is counted as failed.
     */
    protected abstract CalloutExchange callout(String recordId) throws Exception;

    /**
     * Hook run once before the first callout, e.g. to authenticate. A failure here fails every record.
     *
     * @throws Exception if the worker cannot proceed.
     */
    protected void beforeCallouts() throws Exception {
    }

    @Override
    public final void run() {
        if (!state.compareAndSet(WorkerState.INITIALIZED, WorkerState.RUNNING)) {
            log.warn("Worker for execution {} already ran (state {}). Skipping.", context.getExecution().getId(), state.get());
            return;
        }
        log.debug("Worker '{}' started: {}", context.getHandlerName(), context);

        WorkerOutcome result;
        try {
            result = performCallouts();
        } catch (Exception e) {
            WorkerExecutionException failure = new WorkerExecutionException(context, e);
            log.error(failure.getMessage(), e);
            auditLog.recordWorkerFailure(context, failure);
            result = WorkerOutcome.allFailed(context.getRecordIds(), failure.getMessage());
        }

        outcome = result;
        state.set(result.isSuccess() ? WorkerState.COMPLETED : WorkerState.FAILED);
        auditLog.recordCompletion(context, result);

        try {
            outcomeRecorder.recordOutcome(context, result);
        } catch (RuntimeException e) {
            log.error("Failed to record outcome of execution {} ({}): {}", context.getExecution().getId(), result, e.getMessage(), e);
        }
        log.debug("Worker '{}' finished in state {}: {}", context.getHandlerName(), state.get(), result);
    }

    private WorkerOutcome performCallouts() throws Exception {
        beforeCallouts();

        WorkerOutcome.Builder builder = WorkerOutcome.builder();
        boolean interrupted = false;
        for (String recordId : context.getRecordIds()) {
            if (interrupted) {
                builder.failed(recordId, "Worker interrupted before callout", null);
                continue;
            }
            try {
                CalloutExchange exchange = callout(recordId);
                if (exchange == null) {
                    exchange = CalloutExchange.failure(null, null, null, "Handler returned no exchange");
                }
                auditLog.recordExchange(context, recordId, exchange);
                if (exchange.isSuccess()) {
                    builder.succeeded(recordId, exchange.getStatusCode());
                } else {
                    builder.failed(recordId, exchange.getError(), exchange.getStatusCode());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                auditLog.recordError(context, recordId, e);
                builder.failed(recordId, "Interrupted", null);
            } catch (Exception e) {
                auditLog.recordError(context, recordId, e);
                builder.failed(recordId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), null);
            }
        }
        return builder.build();
    }

    @Override
    public WorkerContext getContext() {
        return context;
    }

    @Override
    public WorkerState getState() {
        return state.get();
    }

    /**
     * @return The outcome once the worker reached a terminal state, null before that.
     */
    public WorkerOutcome getOutcome() {
        return outcome;
    }
}
