package com.sailfish.retrydispatch.repository;

import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.model.ExecutionStatus;
import com.sailfish.retrydispatch.model.RecordKind;
import com.sailfish.retrydispatch.retry.RetryCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import jakarta.transaction.Transactional;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * JPA implementation of the ExecutionRecordRepository.
 * Assumes a JPA environment is configured (e.g., via Spring Boot Data JPA or manual setup).
 */
public class JpaExecutionRecordRepository implements ExecutionRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaExecutionRecordRepository.class);

    /** Keeps every IN list below the 1000-element limit some databases enforce. */
    public static final int DEFAULT_ID_PAGE_SIZE = 500;

    @PersistenceContext
    private EntityManager entityManager;

    private final int idPageSize;

    public JpaExecutionRecordRepository() {
        this.idPageSize = DEFAULT_ID_PAGE_SIZE;
    }

    public JpaExecutionRecordRepository(EntityManager entityManager) {
        this(entityManager, DEFAULT_ID_PAGE_SIZE);
    }

    public JpaExecutionRecordRepository(EntityManager entityManager, int idPageSize) {
        if (idPageSize <= 0) {
            throw new IllegalArgumentException("idPageSize must be positive");
        }
        this.entityManager = entityManager;
        this.idPageSize = idPageSize;
    }

    @Override
    @Transactional
    public ExecutionRecord save(ExecutionRecord record) {
        if (record.getId() == null) {
            entityManager.persist(record);
            log.debug("Persisted new ExecutionRecord with ID: {}", record.getId());
            return record;
        } else {
            ExecutionRecord merged = entityManager.merge(record);
            log.debug("Merged existing ExecutionRecord with ID: {}", merged.getId());
            return merged;
        }
    }

    @Override
    public Optional<ExecutionRecord> findById(Long id) {
        return Optional.ofNullable(entityManager.find(ExecutionRecord.class, id));
    }

    @Override
    public List<ExecutionRecord> findAllById(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        List<Long> allIds = new ArrayList<>(ids);
        List<ExecutionRecord> records = new ArrayList<>(allIds.size());
        for (int from = 0; from < allIds.size(); from += idPageSize) {
            List<Long> page = allIds.subList(from, Math.min(from + idPageSize, allIds.size()));
            TypedQuery<ExecutionRecord> query = entityManager.createQuery(
                    "SELECT r FROM ExecutionRecord r JOIN FETCH r.policy WHERE r.id IN :ids", ExecutionRecord.class);
            query.setParameter("ids", page);
            records.addAll(query.getResultList());
        }
        log.debug("Loaded {} of {} requested execution records in pages of {}.", records.size(), allIds.size(), idPageSize);
        return records;
    }

    @Override
    public List<Long> findRetryCandidateIds(RetryCriteria criteria) {
        // Served by the (policy_id, status, lastAttemptAt) index
        StringBuilder jpql = new StringBuilder("SELECT r.id FROM ExecutionRecord r " +
                "WHERE r.policy.id = :policyId " +
                "AND r.kind <> :childKind " +
                "AND r.status = :failedStatus " +
                "AND r.retryIds IS NOT NULL " +
                "AND r.retriesAttempted < :maxRetries " +
                "AND (r.lastAttemptAt IS NULL OR r.lastAttemptAt <= :cutoff)");
        if (criteria.restrictsStatusCodes()) {
            jpql.append(" AND r.lastStatusCode IN :statusCodes");
        }
        jpql.append(" ORDER BY r.id ASC");

        TypedQuery<Long> query = entityManager.createQuery(jpql.toString(), Long.class);
        query.setParameter("policyId", criteria.getPolicyId());
        query.setParameter("childKind", RecordKind.EGRESS_CHILD);
        query.setParameter("failedStatus", ExecutionStatus.FAILED);
        query.setParameter("maxRetries", criteria.getMaxRetries());
        query.setParameter("cutoff", criteria.getLastAttemptNotAfter());
        if (criteria.restrictsStatusCodes()) {
            query.setParameter("statusCodes", criteria.getRetryableStatusCodes());
        }

        List<Long> ids = query.getResultList();
        log.debug("Found {} retry candidates for {}", ids.size(), criteria);
        return ids;
    }
}
