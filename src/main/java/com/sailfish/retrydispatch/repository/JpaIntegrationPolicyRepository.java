package com.sailfish.retrydispatch.repository;

import com.sailfish.retrydispatch.model.IntegrationPolicy;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.List;
import java.util.Optional;

/**
 * JPA implementation of the IntegrationPolicyRepository.
 */
public class JpaIntegrationPolicyRepository implements IntegrationPolicyRepository {

    @PersistenceContext
    private EntityManager entityManager;

    public JpaIntegrationPolicyRepository() {
    }

    public JpaIntegrationPolicyRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    @Override
    public List<IntegrationPolicy> findEnabled() {
        return entityManager.createQuery(
                        "SELECT p FROM IntegrationPolicy p WHERE p.enabled = true ORDER BY p.id ASC", IntegrationPolicy.class)
                .getResultList();
    }

    @Override
    public Optional<IntegrationPolicy> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return entityManager.createQuery(
                        "SELECT p FROM IntegrationPolicy p WHERE p.name = :name", IntegrationPolicy.class)
                .setParameter("name", name)
                .getResultStream()
                .findFirst();
    }
}
