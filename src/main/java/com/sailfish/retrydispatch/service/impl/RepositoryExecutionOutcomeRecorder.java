package com.sailfish.retrydispatch.service.impl;

import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.model.ExecutionStatus;
import com.sailfish.retrydispatch.repository.ExecutionRecordRepository;
import com.sailfish.retrydispatch.retry.RetryStrategy;
import com.sailfish.retrydispatch.service.ExecutionOutcomeRecorder;
import com.sailfish.retrydispatch.worker.WorkerContext;
import com.sailfish.retrydispatch.worker.WorkerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.transaction.Transactional;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Persists worker outcomes through the {@link ExecutionRecordRepository}.
 * <p>
 * For a retry this is also where the parent's attempt counter, incremented in memory by the dispatcher,
 * becomes durable, together with the ids that still fail.
 */
public class RepositoryExecutionOutcomeRecorder implements ExecutionOutcomeRecorder {

    private static final Logger log = LoggerFactory.getLogger(RepositoryExecutionOutcomeRecorder.class);

    private static final int MAX_ERROR_LENGTH = 2000; // Matches the lastError column

    private final ExecutionRecordRepository recordRepository;
    private final RetryStrategy retryStrategy;
    private final Clock clock;

    public RepositoryExecutionOutcomeRecorder(ExecutionRecordRepository recordRepository, RetryStrategy retryStrategy) {
        this(recordRepository, retryStrategy, Clock.systemDefaultZone());
    }

    public RepositoryExecutionOutcomeRecorder(ExecutionRecordRepository recordRepository, RetryStrategy retryStrategy, Clock clock) {
        this.recordRepository = Objects.requireNonNull(recordRepository, "recordRepository cannot be null");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    @Transactional
    public void recordOutcome(WorkerContext context, WorkerOutcome outcome) {
        LocalDateTime now = LocalDateTime.now(clock);
        ExecutionRecord execution = context.getExecution();
        applyOutcome(execution, outcome, now);

        if (!context.isRetry()) {
            execution.setStatus(terminalStatus(execution, outcome));
            ExecutionRecord saved = recordRepository.save(execution);
            log.info("Execution {} finished with status {} ({} succeeded, {} failed).",
                    saved.getId(), saved.getStatus(), outcome.getSucceededIds().size(), outcome.getFailedIds().size());
            return;
        }

        // Child records never become candidates themselves; retries always continue from the parent
        execution.setStatus(outcome.isSuccess() ? ExecutionStatus.SUCCEEDED : ExecutionStatus.FAILED);
        ExecutionRecord savedChild = recordRepository.save(execution);

        ExecutionRecord parent = context.getParent()
                .orElseThrow(() -> new IllegalStateException("Retry context without parent: " + context));
        applyOutcome(parent, outcome, now);
        parent.setStatus(terminalStatus(parent, outcome));
        ExecutionRecord savedParent = recordRepository.save(parent);

        log.info("Retry {} of execution {} (child {}) finished: parent now {} with {} ids pending.",
                savedParent.getRetriesAttempted(), savedParent.getId(), savedChild.getId(),
                savedParent.getStatus(), savedParent.getRetryIds().size());
    }

    private ExecutionStatus terminalStatus(ExecutionRecord record, WorkerOutcome outcome) {
        if (outcome.isSuccess()) {
            return ExecutionStatus.SUCCEEDED;
        }
        return retryStrategy.shouldRetry(record) ? ExecutionStatus.FAILED : ExecutionStatus.EXHAUSTED;
    }

    private void applyOutcome(ExecutionRecord record, WorkerOutcome outcome, LocalDateTime now) {
        record.setRetryIds(outcome.getFailedIds());
        record.setLastStatusCode(outcome.getLastStatusCode());
        record.setLastError(truncateError(outcome.firstError()));
        record.setLastAttemptAt(now);
    }

    private String truncateError(String error) {
        if (error == null) return null;
        if (error.length() > MAX_ERROR_LENGTH) {
            return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
        }
        return error;
    }
}
