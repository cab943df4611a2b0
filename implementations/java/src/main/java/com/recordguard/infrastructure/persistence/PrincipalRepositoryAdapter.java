package com.recordguard.infrastructure.persistence;

import com.recordguard.domain.model.CapabilityLevel;
import com.recordguard.domain.model.Principal;
import com.recordguard.domain.repository.PrincipalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Builds principals from rows of the record store.
 */
@Component
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class PrincipalRepositoryAdapter implements PrincipalRepository {

    private final SpringDataUserRecordRepository userRecords;

    @Override
    public Optional<Principal> findById(long id) {
        Optional<Principal> principal = userRecords.findById(id).map(PrincipalRepositoryAdapter::toPrincipal);
        if (principal.isEmpty()) {
            log.debug("No record for principal id={}", id);
        }
        return principal;
    }

    @Override
    public Optional<Principal> findAny() {
        return userRecords.findRandom().map(PrincipalRepositoryAdapter::toPrincipal);
    }

    private static Principal toPrincipal(UserRecord record) {
        return Principal.builder()
            .id(record.getId())
            .identityString(record.getEmail())
            .displayName(record.getFirstName() + " " + record.getLastName())
            .capabilityLevel(CapabilityLevel.BASIC)
            .build();
    }
}
