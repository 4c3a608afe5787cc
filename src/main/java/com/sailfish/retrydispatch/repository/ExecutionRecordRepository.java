package com.sailfish.retrydispatch.repository;

import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.retry.RetryCriteria;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for managing ExecutionRecord entities.
 * Implementations will handle database interactions (e.g., using JPA, JDBC).
 */
public interface ExecutionRecordRepository {

    /**
     * Saves or updates an execution record.
     *
     * @param record The record to save.
     * @return The saved record, potentially with generated ID or updated timestamps.
     */
    ExecutionRecord save(ExecutionRecord record);

    /**
     * Finds an execution record by its ID.
     *
     * @param id The ID of the execution record.
     * @return An Optional containing the record if found, empty otherwise.
     */
    Optional<ExecutionRecord> findById(Long id);

    /**
     * Loads every record whose id is in {@code ids}. Unknown ids are silently absent from the result,
     * and the result order is unspecified.
     *
     * @param ids The ids to load.
     * @return The records found.
     */
    List<ExecutionRecord> findAllById(Collection<Long> ids);

    /**
     * Finds the ids of non-child records that are eligible for another retry attempt under {@code criteria}.
     * Read-only.
     *
     * @param criteria The policy thresholds.
     * @return Candidate ids in ascending order.
     */
    List<Long> findRetryCandidateIds(RetryCriteria criteria);

}
