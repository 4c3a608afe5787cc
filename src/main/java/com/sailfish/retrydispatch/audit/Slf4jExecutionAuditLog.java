package com.sailfish.retrydispatch.audit;

import com.sailfish.retrydispatch.worker.CalloutExchange;
import com.sailfish.retrydispatch.worker.WorkerContext;
import com.sailfish.retrydispatch.worker.WorkerExecutionException;
import com.sailfish.retrydispatch.worker.WorkerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the audit trail to the {@code retry.dispatch.audit} logger category.
 * Payloads are logged at DEBUG so they can be enabled separately from the outcome lines.
 */
public class Slf4jExecutionAuditLog implements ExecutionAuditLog {

    public static final String AUDIT_LOGGER_NAME = "retry.dispatch.audit";

    private static final int MAX_PAYLOAD_LENGTH = 2000;

    private final Logger audit;

    public Slf4jExecutionAuditLog() {
        this(LoggerFactory.getLogger(AUDIT_LOGGER_NAME));
    }

    Slf4jExecutionAuditLog(Logger audit) {
        this.audit = audit;
    }

    @Override
    public void recordExchange(WorkerContext context, String recordId, CalloutExchange exchange) {
        if (exchange.isSuccess()) {
            audit.info("[{}] execution={} mode={} record={} status={} outcome=SUCCESS",
                    context.getHandlerName(), context.getExecution().getId(), context.getMode(), recordId,
                    exchange.getStatusCode());
        } else {
            audit.warn("[{}] execution={} mode={} record={} status={} outcome=FAILURE error={}",
                    context.getHandlerName(), context.getExecution().getId(), context.getMode(), recordId,
                    exchange.getStatusCode(), exchange.getError());
        }
        if (audit.isDebugEnabled()) {
            audit.debug("[{}] record={} request={} response={}", context.getHandlerName(), recordId,
                    truncate(exchange.getRequest()), truncate(exchange.getResponse()));
        }
    }

    @Override
    public void recordError(WorkerContext context, String recordId, Exception error) {
        audit.error("[{}] execution={} mode={} record={} outcome=EXCEPTION error={}",
                context.getHandlerName(), context.getExecution().getId(), context.getMode(), recordId,
                error.getMessage(), error);
    }

    @Override
    public void recordWorkerFailure(WorkerContext context, WorkerExecutionException failure) {
        audit.error("[{}] execution={} mode={} records={} outcome=WORKER_FAILURE error={}",
                context.getHandlerName(), context.getExecution().getId(), context.getMode(),
                context.getRecordIds().size(), failure.getMessage(), failure);
    }

    @Override
    public void recordCompletion(WorkerContext context, WorkerOutcome outcome) {
        audit.info("[{}] execution={} mode={} parent={} succeeded={} failed={}",
                context.getHandlerName(), context.getExecution().getId(), context.getMode(),
                context.getParent().map(p -> p.getId()).orElse(null),
                outcome.getSucceededIds().size(), outcome.getFailedIds().size());
    }

    private String truncate(String payload) {
        if (payload == null) return null;
        if (payload.length() > MAX_PAYLOAD_LENGTH) {
            return payload.substring(0, MAX_PAYLOAD_LENGTH - 3) + "...";
        }
        return payload;
    }
}
