package com.recordguard.domain.repository;

import com.recordguard.domain.model.Principal;

import java.util.Optional;

/**
 * Principal lookup against the record store, used once at session start.
 *
 * @since 1.0.0
 */
public interface PrincipalRepository {

    /**
     * Find the principal owning the given record.
     *
     * @param id record identifier
     * @return principal if the record exists
     */
    Optional<Principal> findById(long id);

    /**
     * Pick any principal from the store, simulating a login.
     *
     * @return a principal, or empty when the store holds no records
     */
    Optional<Principal> findAny();
}
