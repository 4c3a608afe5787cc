package com.sailfish.retrydispatch.service.impl;

import com.sailfish.retrydispatch.RetryableWorker;
import com.sailfish.retrydispatch.budget.DispatchBudget;
import com.sailfish.retrydispatch.handler.HandlerRegistry;
import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.model.ExecutionStatus;
import com.sailfish.retrydispatch.model.IntegrationPolicy;
import com.sailfish.retrydispatch.model.RecordKind;
import com.sailfish.retrydispatch.repository.ExecutionRecordRepository;
import com.sailfish.retrydispatch.repository.IntegrationPolicyRepository;
import com.sailfish.retrydispatch.service.IntegrationRunService;
import com.sailfish.retrydispatch.worker.WorkerExecutionWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import jakarta.transaction.Transactional;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of the IntegrationRunService.
 * Fresh runs go through the same handler registry and dispatch budget as retries.
 */
public class IntegrationRunServiceImpl implements IntegrationRunService {

    private static final Logger log = LoggerFactory.getLogger(IntegrationRunServiceImpl.class);

    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    static final String BUDGET_EXHAUSTED_ERROR = "Dispatch budget exhausted; run deferred to the retry cycle";

    private final IntegrationPolicyRepository policyRepository;
    private final ExecutionRecordRepository recordRepository;
    private final HandlerRegistry handlerRegistry;
    private final DispatchBudget budget;
    private final ExecutorService workerExecutor;
    private final Clock clock;

    public IntegrationRunServiceImpl(IntegrationPolicyRepository policyRepository,
                                     ExecutionRecordRepository recordRepository,
                                     HandlerRegistry handlerRegistry,
                                     DispatchBudget budget,
                                     ExecutorService workerExecutor) {
        this(policyRepository, recordRepository, handlerRegistry, budget, workerExecutor, Clock.systemDefaultZone());
    }

    public IntegrationRunServiceImpl(IntegrationPolicyRepository policyRepository,
                                     ExecutionRecordRepository recordRepository,
                                     HandlerRegistry handlerRegistry,
                                     DispatchBudget budget,
                                     ExecutorService workerExecutor,
                                     Clock clock) {
        this.policyRepository = Objects.requireNonNull(policyRepository, "policyRepository cannot be null");
        this.recordRepository = Objects.requireNonNull(recordRepository, "recordRepository cannot be null");
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry cannot be null");
        this.budget = Objects.requireNonNull(budget, "budget cannot be null");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        log.info("IntegrationRunService initialized.");
    }

    /**
     * {@inheritDoc}
     * <p>
     * Runs outside any caller transaction so the {@code RUNNING} row is committed by the repository before the
     * worker is submitted. The worker gets its own copy of the record; the returned instance is never touched
     * by the worker thread.
     */
    @Override
    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public ExecutionRecord startRun(String policyName, Collection<String> recordIds) {
        if (policyName == null || policyName.trim().isEmpty()) {
            throw new IllegalArgumentException("policyName cannot be blank");
        }
        if (recordIds == null || recordIds.isEmpty()) {
            throw new IllegalArgumentException("recordIds cannot be empty");
        }
        IntegrationPolicy policy = policyRepository.findByName(policyName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown integration policy: " + policyName));
        if (!policy.isEnabled()) {
            throw new IllegalStateException("Integration policy '" + policyName + "' is disabled");
        }

        Set<String> ids = new LinkedHashSet<>(recordIds);
        ExecutionRecord execution = new ExecutionRecord();
        execution.setPolicy(policy);
        execution.setKind(RecordKind.EGRESS);
        execution.setRetryIds(ids); // Everything is pending until the worker reports back

        // Resolve before persisting so an unknown handler leaves nothing behind
        ExecutionRecord workerExecution = ExecutionRecord.copyOf(execution);
        RetryableWorker worker = handlerRegistry.newFreshWorker(policy.getHandlerName(), workerExecution, ids);

        if (!budget.tryAcquire()) {
            return defer(execution, BUDGET_EXHAUSTED_ERROR);
        }

        execution.setStatus(ExecutionStatus.RUNNING);
        ExecutionRecord saved = recordRepository.save(execution);
        copyPersistentState(saved, workerExecution);
        try {
            workerExecutor.submit(new WorkerExecutionWrapper(worker, budget));
        } catch (RejectedExecutionException e) {
            budget.release();
            log.error("Worker executor rejected fresh run of '{}' (execution {}). Deferring to the retry cycle.", policyName, saved.getId(), e);
            return defer(saved, "Worker executor rejected the run: " + e.getMessage());
        }
        log.info("Execution {} of '{}' started with {} records.", saved.getId(), policyName, ids.size());
        return saved;
    }

    private static void copyPersistentState(ExecutionRecord saved, ExecutionRecord target) {
        target.setId(saved.getId());
        target.setStatus(saved.getStatus());
        target.setCreatedAt(saved.getCreatedAt());
        target.setUpdatedAt(saved.getUpdatedAt());
    }

    private ExecutionRecord defer(ExecutionRecord execution, String reason) {
        execution.setStatus(ExecutionStatus.FAILED);
        execution.setLastError(reason);
        // Counts as an attempt, so the selector waits one interval before picking it up
        execution.setLastAttemptAt(LocalDateTime.now(clock));
        ExecutionRecord saved = recordRepository.save(execution);
        log.warn("Execution {} of '{}' not started: {}. {} records left for retry.",
                saved.getId(), saved.getPolicy().getName(), reason, saved.getRetryIds().size());
        return saved;
    }

    @Override
    public void shutdown(long timeoutSeconds) {
        shutdownExecutor("Worker Executor", workerExecutor, timeoutSeconds);
    }

    @PreDestroy
    public void close() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    /** Helper method to shutdown an executor service */
    static void shutdownExecutor(String name, ExecutorService executor, long timeoutSeconds) {
        if (executor.isShutdown()) {
            return;
        }
        log.info("Shutting down {}...", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate in {} seconds.", name, timeoutSeconds);
                List<Runnable> droppedTasks = executor.shutdownNow();
                log.warn("Forcefully shutting down {}. {} workers were dropped.", name, droppedTasks.size());
                if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.error("{} did not terminate even after forceful shutdown.", name);
                }
            } else {
                log.info("{} terminated gracefully.", name);
            }
        } catch (InterruptedException ie) {
            log.warn("{} shutdown interrupted. Forcing shutdown now.", name);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
