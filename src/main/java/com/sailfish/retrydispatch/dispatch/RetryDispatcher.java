package com.sailfish.retrydispatch.dispatch;

import com.sailfish.retrydispatch.RetryableWorker;
import com.sailfish.retrydispatch.budget.DispatchBudget;
import com.sailfish.retrydispatch.handler.HandlerRegistry;
import com.sailfish.retrydispatch.handler.HandlerResolutionException;
import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.repository.ExecutionRecordRepository;
import com.sailfish.retrydispatch.worker.WorkerExecutionWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns dispatch messages into scheduled retry workers without ever exceeding the dispatch budget.
 * <p>
 * One call is one dispatch cycle and runs on the caller's thread. Candidates are handled strictly in message
 * order. When the budget runs out the cycle stops and every remaining candidate goes to the
 * {@link OverflowRepublisher}; budget exhaustion is not an error. A candidate whose handler cannot be resolved
 * is logged and abandoned without affecting the rest of the cycle.
 * <p>
 * The dispatcher increments the parent's attempt counter and builds the child record in memory only; making
 * either durable is left to the worker's outcome recorder once its callouts have returned.
 */
public class RetryDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RetryDispatcher.class);

    private final ExecutionRecordRepository recordRepository;
    private final HandlerRegistry handlerRegistry;
    private final DispatchBudget budget;
    private final ExecutorService workerExecutor;
    private final OverflowRepublisher overflowRepublisher;

    private enum CandidateOutcome { SCHEDULED, ABANDONED, REJECTED }

    public RetryDispatcher(ExecutionRecordRepository recordRepository,
                           HandlerRegistry handlerRegistry,
                           DispatchBudget budget,
                           ExecutorService workerExecutor,
                           OverflowRepublisher overflowRepublisher) {
        this.recordRepository = Objects.requireNonNull(recordRepository, "recordRepository cannot be null");
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry cannot be null");
        this.budget = Objects.requireNonNull(budget, "budget cannot be null");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor cannot be null");
        this.overflowRepublisher = Objects.requireNonNull(overflowRepublisher, "overflowRepublisher cannot be null");
    }

    public DispatchResult dispatch(DispatchMessage message) {
        return dispatch(Collections.singletonList(message));
    }

    /**
     * Runs one dispatch cycle over the union of the messages' ids.
     *
     * @param messages Messages received together; their ids are merged in order, duplicates collapsed.
     * @return What happened to each id.
     */
    public DispatchResult dispatch(Collection<DispatchMessage> messages) {
        Objects.requireNonNull(messages, "messages cannot be null");

        List<String> malformed = new ArrayList<>();
        Set<Long> ids = parseIds(messages, malformed);

        List<Long> skipped = new ArrayList<>();
        List<ExecutionRecord> candidates = loadCandidates(ids, skipped);

        int allowance = budget.availableSlots();
        List<Long> scheduled = new ArrayList<>();
        List<Long> abandoned = new ArrayList<>();

        int index = 0;
        for (; index < candidates.size(); index++) {
            if (scheduled.size() >= allowance || !budget.tryAcquire()) {
                break;
            }
            ExecutionRecord candidate = candidates.get(index);
            CandidateOutcome outcome = dispatchCandidate(candidate);
            if (outcome == CandidateOutcome.REJECTED) {
                break;
            }
            if (outcome == CandidateOutcome.SCHEDULED) {
                scheduled.add(candidate.getId());
            } else {
                abandoned.add(candidate.getId());
            }
        }

        List<Long> overflow = new ArrayList<>(candidates.size() - index);
        for (int i = index; i < candidates.size(); i++) {
            overflow.add(candidates.get(i).getId());
        }
        if (!overflow.isEmpty()) {
            log.info("Dispatch budget exhausted after {} workers (snapshot {}). Re-queueing {} candidates.",
                    scheduled.size(), allowance, overflow.size());
            overflowRepublisher.republish(overflow);
        }

        DispatchResult result = new DispatchResult(scheduled, abandoned, skipped, overflow, malformed, allowance);
        log.info("Dispatch cycle done: {}", result);
        return result;
    }

    private Set<Long> parseIds(Collection<DispatchMessage> messages, List<String> malformed) {
        Set<Long> ids = new LinkedHashSet<>();
        for (DispatchMessage message : messages) {
            for (String token : message.idTokens()) {
                try {
                    ids.add(DispatchMessage.parseId(token));
                } catch (MalformedIdException e) {
                    log.warn("Dropping candidate: {}", e.getMessage());
                    malformed.add(token);
                }
            }
        }
        return ids;
    }

    private List<ExecutionRecord> loadCandidates(Set<Long> ids, List<Long> skipped) {
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }
        Map<Long, ExecutionRecord> loaded = new HashMap<>();
        for (ExecutionRecord record : recordRepository.findAllById(ids)) {
            loaded.put(record.getId(), record);
        }

        List<ExecutionRecord> candidates = new ArrayList<>(loaded.size());
        for (Long id : ids) {
            ExecutionRecord record = loaded.get(id);
            if (record == null) {
                log.debug("Execution record {} not found. Skipping.", id);
                skipped.add(id);
            } else if (!record.hasRetryIds()) {
                log.debug("Execution record {} has no retry ids. Skipping.", id);
                skipped.add(id);
            } else {
                candidates.add(record);
            }
        }
        return candidates;
    }

    /**
     * Called with one budget slot already taken. The slot is given back unless the worker was scheduled.
     */
    private CandidateOutcome dispatchCandidate(ExecutionRecord candidate) {
        candidate.incrementRetriesAttempted();
        ExecutionRecord child = ExecutionRecord.newRetryChild(candidate);
        Set<String> retryIds = new LinkedHashSet<>(candidate.getRetryIds());
        String handlerName = candidate.getPolicy() != null ? candidate.getPolicy().getHandlerName() : null;

        RetryableWorker worker;
        try {
            worker = handlerRegistry.newRetryWorker(handlerName, child, retryIds, candidate);
        } catch (HandlerResolutionException e) {
            budget.release();
            log.error("Abandoning retry of execution {}: {}", candidate.getId(), e.getMessage());
            return CandidateOutcome.ABANDONED;
        } catch (RuntimeException e) {
            budget.release();
            log.error("Abandoning retry of execution {}: handler '{}' failed to initialize: {}",
                    candidate.getId(), handlerName, e.getMessage(), e);
            return CandidateOutcome.ABANDONED;
        }

        try {
            workerExecutor.submit(new WorkerExecutionWrapper(worker, budget));
        } catch (RejectedExecutionException e) {
            budget.release();
            candidate.setRetriesAttempted(candidate.getRetriesAttempted() - 1);
            log.warn("Worker executor rejected retry of execution {}; treating it and the rest of the cycle as overflow.", candidate.getId(), e);
            return CandidateOutcome.REJECTED;
        }
        log.debug("Scheduled retry {} of execution {} with handler '{}' ({} record ids)",
                candidate.getRetriesAttempted(), candidate.getId(), handlerName, retryIds.size());
        return CandidateOutcome.SCHEDULED;
    }
}
