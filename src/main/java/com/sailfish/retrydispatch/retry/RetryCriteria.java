package com.sailfish.retrydispatch.retry;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thresholds handed to the candidate query for one integration policy.
 */
public final class RetryCriteria {

    private final Long policyId;
    private final int maxRetries;
    private final LocalDateTime lastAttemptNotAfter;
    private final Set<Integer> retryableStatusCodes;

    public RetryCriteria(Long policyId, int maxRetries, LocalDateTime lastAttemptNotAfter, Set<Integer> retryableStatusCodes) {
        this.policyId = Objects.requireNonNull(policyId, "policyId cannot be null");
        this.lastAttemptNotAfter = Objects.requireNonNull(lastAttemptNotAfter, "lastAttemptNotAfter cannot be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        this.maxRetries = maxRetries;
        this.retryableStatusCodes = retryableStatusCodes == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new TreeSet<>(retryableStatusCodes));
    }

    public Long getPolicyId() {
        return policyId;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Records whose last attempt happened after this instant are still inside their retry interval.
     */
    public LocalDateTime getLastAttemptNotAfter() {
        return lastAttemptNotAfter;
    }

    /**
     * Empty when every status code is retryable.
     */
    public Set<Integer> getRetryableStatusCodes() {
        return retryableStatusCodes;
    }

    public boolean restrictsStatusCodes() {
        return !retryableStatusCodes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryCriteria that = (RetryCriteria) o;
        return maxRetries == that.maxRetries
                && policyId.equals(that.policyId)
                && lastAttemptNotAfter.equals(that.lastAttemptNotAfter)
                && retryableStatusCodes.equals(that.retryableStatusCodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(policyId, maxRetries, lastAttemptNotAfter, retryableStatusCodes);
    }

    @Override
    public String toString() {
        return "RetryCriteria{" +
               "policyId=" + policyId +
               ", maxRetries=" + maxRetries +
               ", lastAttemptNotAfter=" + lastAttemptNotAfter +
               ", retryableStatusCodes=" + retryableStatusCodes +
               '}';
    }
}
