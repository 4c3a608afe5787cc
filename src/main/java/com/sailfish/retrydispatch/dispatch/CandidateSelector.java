package com.sailfish.retrydispatch.dispatch;

import com.sailfish.retrydispatch.model.IntegrationPolicy;
import com.sailfish.retrydispatch.repository.ExecutionRecordRepository;
import com.sailfish.retrydispatch.repository.IntegrationPolicyRepository;
import com.sailfish.retrydispatch.retry.RetryCriteria;
import com.sailfish.retrydispatch.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Finds execution records eligible for retry and packs their ids into dispatch messages.
 * Selection only reads; publishing the messages is the one side effect of {@link #publishCandidates()}.
 */
public class CandidateSelector {

    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    private final IntegrationPolicyRepository policyRepository;
    private final ExecutionRecordRepository recordRepository;
    private final RetryStrategy retryStrategy;
    private final DispatchMessageChunker chunker;
    private final DispatchQueue dispatchQueue;
    private final Clock clock;

    public CandidateSelector(IntegrationPolicyRepository policyRepository,
                             ExecutionRecordRepository recordRepository,
                             RetryStrategy retryStrategy,
                             DispatchMessageChunker chunker,
                             DispatchQueue dispatchQueue) {
        this(policyRepository, recordRepository, retryStrategy, chunker, dispatchQueue, Clock.systemDefaultZone());
    }

    public CandidateSelector(IntegrationPolicyRepository policyRepository,
                             ExecutionRecordRepository recordRepository,
                             RetryStrategy retryStrategy,
                             DispatchMessageChunker chunker,
                             DispatchQueue dispatchQueue,
                             Clock clock) {
        this.policyRepository = Objects.requireNonNull(policyRepository, "policyRepository cannot be null");
        this.recordRepository = Objects.requireNonNull(recordRepository, "recordRepository cannot be null");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy cannot be null");
        this.chunker = Objects.requireNonNull(chunker, "chunker cannot be null");
        this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Queries the candidate ids of every enabled policy in {@code policies}.
     *
     * @return Ids in policy order, ascending within a policy, without duplicates.
     */
    public List<Long> findCandidateIds(Collection<IntegrationPolicy> policies) {
        LocalDateTime now = LocalDateTime.now(clock);
        Set<Long> ids = new LinkedHashSet<>();
        for (IntegrationPolicy policy : policies) {
            if (!policy.isEnabled()) {
                log.debug("Skipping disabled policy '{}'", policy.getName());
                continue;
            }
            RetryCriteria criteria = retryStrategy.criteriaFor(policy, now);
            List<Long> policyIds = recordRepository.findRetryCandidateIds(criteria);
            log.debug("Policy '{}' has {} retry candidates", policy.getName(), policyIds.size());
            ids.addAll(policyIds);
        }
        return new ArrayList<>(ids);
    }

    /**
     * Selects the candidates of {@code policies}. The query runs eagerly; the messages are built as the stream
     * is consumed.
     */
    public Stream<DispatchMessage> select(Collection<IntegrationPolicy> policies) {
        return chunker.chunk(findCandidateIds(policies));
    }

    /**
     * Selects the candidates of all enabled policies and publishes them onto the dispatch queue.
     *
     * @return The number of messages published.
     */
    public int publishCandidates() {
        List<IntegrationPolicy> policies = policyRepository.findEnabled();
        if (policies.isEmpty()) {
            log.debug("No enabled integration policies.");
            return 0;
        }

        List<Long> ids = findCandidateIds(policies);
        if (ids.isEmpty()) {
            log.debug("No retry candidates found at this time.");
            return 0;
        }

        int published = 0;
        Iterator<DispatchMessage> messages = chunker.chunk(ids).iterator();
        while (messages.hasNext()) {
            DispatchMessage message = messages.next();
            try {
                dispatchQueue.publish(message);
                published++;
            } catch (DispatchQueueFullException e) {
                log.error("Dispatch queue refused a selection message after {} published; the rest will be reselected next cycle. {}",
                        published, e.getMessage(), e);
                break;
            }
        }
        log.info("Found {} retry candidates across {} policies; published {} dispatch messages.", ids.size(), policies.size(), published);
        return published;
    }
}
