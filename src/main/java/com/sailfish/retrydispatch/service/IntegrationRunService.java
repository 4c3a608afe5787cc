package com.sailfish.retrydispatch.service;

import com.sailfish.retrydispatch.model.ExecutionRecord;

import java.util.Collection;

/**
 * Service interface for starting brand-new integration runs.
 */
public interface IntegrationRunService {

    /**
     * Starts a fresh run of an integration for the given records.
     * The execution record is persisted first, then a worker is scheduled if the dispatch budget allows.
     * When it does not, the execution is stored as FAILED with every record id pending retry, so the retry
     * selector picks it up on its next cycle.
     *
     * @param policyName The name of the integration policy.
     * @param recordIds The ids of the records to deliver.
     * @return The persisted execution record.
     * @throws IllegalArgumentException if the policy is unknown or no record ids are given.
     * @throws IllegalStateException if the policy is disabled.
     * @throws com.sailfish.retrydispatch.handler.HandlerResolutionException if the policy's handler cannot be resolved.
     */
    ExecutionRecord startRun(String policyName, Collection<String> recordIds);

    /**
     * Initiates a graceful shutdown of the worker executor.
     * Should be called during application shutdown.
     *
     * @param timeoutSeconds Time to wait for running workers to complete before forceful shutdown.
     */
    void shutdown(long timeoutSeconds);
}
