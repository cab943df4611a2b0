package com.recordguard.application.guardrail;

import com.recordguard.domain.model.AuthorizationVerdict;
import com.recordguard.domain.model.CombinedVerdict;
import com.recordguard.domain.model.SafetyVerdict;
import com.recordguard.domain.model.SanitizationVerdict;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VerdictSchemasTest {

    private final VerdictParser parser = new VerdictParser();

    @Test
    void authorizationVerdictSurvivesRenderAndParse() {
        AuthorizationVerdict verdict = AuthorizationVerdict.builder()
            .authorized(true)
            .reason("User is requesting their own contact details")
            .sensitiveFields(Set.of("phone_number", "address"))
            .candidateQuery("SELECT phone_number, address FROM users WHERE id = 7")
            .build();

        String rendered = VerdictSchemas.AUTHORIZATION.render(verdict);

        assertEquals(verdict, parser.parse(rendered, VerdictSchemas.AUTHORIZATION));
    }

    @Test
    void safetyVerdictSurvivesRenderAndParse() {
        SafetyVerdict verdict = SafetyVerdict.builder()
            .safe(false)
            .reason("OR condition bypasses the user restriction")
            .suggestedQuery("SELECT first_name FROM users WHERE id = 7")
            .build();

        assertEquals(verdict, parser.parse(VerdictSchemas.SAFETY.render(verdict), VerdictSchemas.SAFETY));
    }

    @Test
    void sanitizationVerdictSurvivesRenderAndParse() {
        SanitizationVerdict verdict = SanitizationVerdict.builder()
            .safe(false)
            .reason("Full address")
            .sanitizedResponse("Springfield, IL")
            .originalResponse("123 Main St, Springfield, IL 62704")
            .build();

        assertEquals(verdict, parser.parse(VerdictSchemas.SANITIZATION.render(verdict), VerdictSchemas.SANITIZATION));
    }

    @Test
    void multiLineResultTextSurvivesRenderAndParse() {
        SanitizationVerdict verdict = SanitizationVerdict.builder()
            .safe(true)
            .reason("Own address")
            .sanitizedResponse("123 Main St\nSpringfield, IL 62704")
            .originalResponse("123 Main St\r\nSpringfield, IL 62704\nC:\\notes\\n.txt")
            .build();

        String rendered = VerdictSchemas.SANITIZATION.render(verdict);

        assertEquals(4, rendered.split("\n").length);
        assertTrue(rendered.contains("sanitized_response: 123 Main St\\nSpringfield, IL 62704\n"));
        assertEquals(verdict, parser.parse(rendered, VerdictSchemas.SANITIZATION));
    }

    @Test
    void missingReasonReadsAsEmptyAndSurvivesRenderAndParse() {
        SafetyVerdict verdict = SafetyVerdict.builder().safe(true).build();

        assertEquals("", verdict.getReason());
        assertEquals(verdict, parser.parse(VerdictSchemas.SAFETY.render(verdict), VerdictSchemas.SAFETY));
    }

    @Test
    void unknownEscapesAreKeptAsWritten() {
        SafetyVerdict verdict = parser.parse("safe: false\nreason: tab \\t stays, \\\\ is one backslash",
            VerdictSchemas.SAFETY);

        assertEquals("tab \\t stays, \\ is one backslash", verdict.getReason());
    }

    @Test
    void combinedLayoutReadsSqlReasonIntoSafetyVerdict() {
        String raw = """
            authorized: true
            reason: Own address
            sensitive_fields: [address]
            sql_query: SELECT address FROM users WHERE id = 7
            safe: true
            sql_reason: Query is restricted to a single user
            suggested_query: null
            """;

        CombinedVerdict verdict = parser.parse(raw, VerdictSchemas.COMBINED);

        assertTrue(verdict.getAuthorization().isAuthorized());
        assertEquals("Own address", verdict.getAuthorization().getReason());
        assertTrue(verdict.getSafety().isSafe());
        assertEquals("Query is restricted to a single user", verdict.getSafety().getReason());
        assertEquals(verdict, parser.parse(VerdictSchemas.COMBINED.render(verdict), VerdictSchemas.COMBINED));
    }

    @Test
    void safeDefaultsAreAllRestrictive() {
        CombinedVerdict combined = VerdictSchemas.COMBINED.safeDefault("unavailable");

        assertFalse(combined.getAuthorization().isAuthorized());
        assertFalse(combined.getSafety().isSafe());
        assertEquals("unavailable", combined.getAuthorization().getReason());
        assertEquals("unavailable", combined.getSafety().getReason());
        assertFalse(VerdictSchemas.SANITIZATION.safeDefault("x").isSafe());
    }
}
