package com.recordguard.infrastructure.persistence;

import com.recordguard.domain.model.CapabilityLevel;
import com.recordguard.domain.model.Principal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(PrincipalRepositoryAdapter.class)
class PrincipalRepositoryAdapterTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private PrincipalRepositoryAdapter adapter;

    @Test
    void buildsPrincipalFromRecord() {
        UserRecord record = entityManager.persistAndFlush(UserRecord.builder()
            .firstName("John")
            .lastName("Doe")
            .email("john.doe@example.com")
            .ssn("123-45-6789")
            .build());

        Principal principal = adapter.findById(record.getId()).orElseThrow();

        assertEquals(record.getId().longValue(), principal.getId());
        assertEquals("john.doe@example.com", principal.getIdentityString());
        assertEquals("John Doe", principal.getDisplayName());
        assertEquals(CapabilityLevel.BASIC, principal.getCapabilityLevel());
    }

    @Test
    void findAnyPicksAnExistingRecord() {
        UserRecord record = entityManager.persistAndFlush(UserRecord.builder()
            .firstName("Alice")
            .lastName("Smith")
            .email("alice.smith@example.com")
            .build());

        Optional<Principal> principal = adapter.findAny();

        assertTrue(principal.isPresent());
        assertEquals(record.getId().longValue(), principal.get().getId());
    }

    @Test
    void emptyStoreHasNoPrincipal() {
        assertTrue(adapter.findAny().isEmpty());
        assertTrue(adapter.findById(42).isEmpty());
    }
}
