package com.sailfish.retrydispatch.retry;

import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.model.IntegrationPolicy;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A retry strategy driven entirely by each record's {@link IntegrationPolicy}: fixed interval, bounded attempts,
 * optional status-code filter.
 */
public class PolicyRetryStrategy implements RetryStrategy {

    private final Duration minimumInterval;

    public static final Duration DEFAULT_MINIMUM_INTERVAL = Duration.ZERO;

    public PolicyRetryStrategy() {
        this(DEFAULT_MINIMUM_INTERVAL);
    }

    /**
     * @param minimumInterval Lower bound applied to every policy's interval, e.g. the selection tick length.
     */
    public PolicyRetryStrategy(Duration minimumInterval) {
        if (minimumInterval == null || minimumInterval.isNegative()) {
            throw new IllegalArgumentException("minimumInterval must be zero or positive");
        }
        this.minimumInterval = minimumInterval;
    }

    @Override
    public boolean shouldRetry(ExecutionRecord record) {
        Objects.requireNonNull(record, "record cannot be null");
        IntegrationPolicy policy = record.getPolicy();
        if (policy == null || !policy.isEnabled()) {
            return false;
        }
        return record.hasRetryIds() && record.getRetriesAttempted() < policy.getMaxRetries();
    }

    @Override
    public RetryCriteria criteriaFor(IntegrationPolicy policy, LocalDateTime now) {
        Objects.requireNonNull(policy, "policy cannot be null");
        Objects.requireNonNull(now, "now cannot be null");
        Duration interval = policy.getRetryInterval();
        if (interval.compareTo(minimumInterval) < 0) {
            interval = minimumInterval;
        }
        return new RetryCriteria(policy.getId(), policy.getMaxRetries(), now.minus(interval), policy.getRetryableStatusCodes());
    }
}
