package com.sailfish.retrydispatch.retry;

import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.model.IntegrationPolicy;

import java.time.LocalDateTime;

/**
 * Defines when a failed execution is eligible for another attempt.
 */
public interface RetryStrategy {

    /**
     * Determines if an execution may be retried again based on its current state.
     *
     * @param record The execution record, usually the parent of a finished retry attempt.
     * @return true if the record still has failed ids and its policy's retry limit is not reached.
     */
    boolean shouldRetry(ExecutionRecord record);

    /**
     * Builds the selection thresholds for one policy.
     *
     * @param policy The integration policy.
     * @param now The time of the selection cycle, used to compute the retry interval cutoff.
     * @return The criteria to pass to the candidate query.
     */
    RetryCriteria criteriaFor(IntegrationPolicy policy, LocalDateTime now);

}
