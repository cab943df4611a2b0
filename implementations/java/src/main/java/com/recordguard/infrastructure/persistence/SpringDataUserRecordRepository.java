package com.recordguard.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SpringDataUserRecordRepository extends JpaRepository<UserRecord, Long> {

    /**
     * Any one record, picked at random.
     */
    @Query(value = "SELECT * FROM users ORDER BY RANDOM() LIMIT 1", nativeQuery = true)
    Optional<UserRecord> findRandom();
}
