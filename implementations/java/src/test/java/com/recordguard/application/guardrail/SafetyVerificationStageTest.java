package com.recordguard.application.guardrail;

import com.recordguard.domain.model.CapabilityLevel;
import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.SafetyVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SafetyVerificationStageTest {

    private static final Principal PRINCIPAL = Principal.builder()
        .id(7)
        .identityString("john.doe@example.com")
        .displayName("John Doe")
        .capabilityLevel(CapabilityLevel.BASIC)
        .build();

    private static final String TAUTOLOGY = "SELECT * FROM users WHERE id = 7 OR 1=1";

    @Mock
    private TextOracle oracle;

    private SafetyVerificationStage stage;

    @BeforeEach
    void setUp() {
        stage = new SafetyVerificationStage(oracle, new VerdictParser(), new StageInstructions("users"),
            new QueryScopeGuard("users"));
    }

    @Test
    void approvesScopedQueryTheOracleApproves() {
        String query = "SELECT address FROM users WHERE id = 7";
        when(oracle.complete(anyString(), eq("SQL Query to verify: " + query)))
            .thenReturn("safe: true\nreason: Restricted to one user\nsuggested_query: null");

        SafetyVerdict verdict = stage.verify(PRINCIPAL, query);

        assertTrue(verdict.isSafe());
        assertEquals("Restricted to one user", verdict.getReason());
    }

    @Test
    void tautologyIsBlockedWithSuggestion() {
        when(oracle.complete(anyString(), anyString())).thenReturn("""
            safe: false
            reason: OR condition bypasses the user restriction
            suggested_query: SELECT first_name, last_name FROM users WHERE id = 7
            """);

        SafetyVerdict verdict = stage.verify(PRINCIPAL, TAUTOLOGY);

        assertFalse(verdict.isSafe());
        assertEquals("SELECT first_name, last_name FROM users WHERE id = 7", verdict.getSuggestedQuery().orElseThrow());
    }

    @Test
    void scopeGateOverridesOracleApproval() {
        when(oracle.complete(anyString(), anyString())).thenReturn("safe: true\nreason: fine");

        SafetyVerdict verdict = stage.verify(PRINCIPAL, TAUTOLOGY);

        assertFalse(verdict.isSafe());
        assertTrue(verdict.getReason().contains("OR conditions"));
    }

    @Test
    void unscopedSuggestionIsDropped() {
        when(oracle.complete(anyString(), anyString())).thenReturn("""
            safe: false
            reason: Tautology
            suggested_query: SELECT * FROM users
            """);

        SafetyVerdict verdict = stage.verify(PRINCIPAL, TAUTOLOGY);

        assertFalse(verdict.isSafe());
        assertTrue(verdict.getSuggestedQuery().isEmpty());
    }

    @Test
    void emptyOracleOutputBlocksEvenAScopedQuery() {
        when(oracle.complete(anyString(), anyString())).thenReturn("");

        SafetyVerdict verdict = stage.verify(PRINCIPAL, "SELECT address FROM users WHERE id = 7");

        assertFalse(verdict.isSafe());
        assertEquals(VerdictSchema.DEFAULT_REASON, verdict.getReason());
    }

    @Test
    void scopeOnlyCheckNeverConsultsTheOracle() {
        assertTrue(stage.checkScopeOnly(PRINCIPAL, "SELECT address FROM users WHERE id = 7").isSafe());
        assertFalse(stage.checkScopeOnly(PRINCIPAL, "SELECT address FROM users WHERE id = 8").isSafe());
        verifyNoInteractions(oracle);
    }

    @Test
    void sendsTheQueryNotTheRequest() {
        when(oracle.complete(anyString(), anyString())).thenReturn("safe: true\nreason: ok");

        stage.verify(PRINCIPAL, "SELECT email FROM users WHERE id = 7");

        verify(oracle).complete(anyString(), eq("SQL Query to verify: SELECT email FROM users WHERE id = 7"));
    }
}
