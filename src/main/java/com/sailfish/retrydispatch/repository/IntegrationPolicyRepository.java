package com.sailfish.retrydispatch.repository;

import com.sailfish.retrydispatch.model.IntegrationPolicy;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the configured integration policies.
 */
public interface IntegrationPolicyRepository {

    /**
     * @return Every enabled policy, ordered by id.
     */
    List<IntegrationPolicy> findEnabled();

    Optional<IntegrationPolicy> findByName(String name);

}
