package com.recordguard.application.guardrail;

import com.recordguard.domain.model.AuthorizationVerdict;
import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.SensitiveField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a natural-language request may be served for the current
 * principal and proposes the query that serves it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AuthorizationStage {

    static final String UNSCOPED_QUERY = "Proposed query is not restricted to the current user";

    private final TextOracle oracle;
    private final VerdictParser parser;
    private final StageInstructions instructions;
    private final QueryScopeGuard scopeGuard;

    public AuthorizationVerdict authorize(Principal principal, String request) {
        String raw = oracle.complete(instructions.authorization(principal), "Query: " + request);
        AuthorizationVerdict verdict = parser.parse(raw, VerdictSchemas.AUTHORIZATION);
        return enforce(principal, verdict);
    }

    /**
     * Apply the mechanical policy to an oracle verdict: flag every taxonomy
     * column the candidate query selects, and deny a query that does not
     * carry the principal's id predicate.
     */
    public AuthorizationVerdict enforce(Principal principal, AuthorizationVerdict verdict) {
        Set<String> flagged = new LinkedHashSet<>(verdict.getSensitiveFields());
        Optional<String> query = verdict.getCandidateQuery();
        query.ifPresent(q -> flagged.addAll(selectedSensitiveColumns(q)));

        if (query.isPresent() && !scopeGuard.referencesPrincipal(query.get(), principal.getId())) {
            log.warn("Authorization downgraded for principal {}: candidate query is unscoped", principal.getId());
            return AuthorizationVerdict.builder()
                .authorized(false)
                .reason(UNSCOPED_QUERY)
                .sensitiveFields(flagged)
                .build();
        }
        return verdict.toBuilder().sensitiveFields(flagged).build();
    }

    private Set<String> selectedSensitiveColumns(String query) {
        Set<String> columns = new LinkedHashSet<>();
        for (String column : scopeGuard.selectedColumns(query)) {
            if (column.equals("*") || column.endsWith(".*")) {
                Arrays.stream(SensitiveField.values()).map(SensitiveField::getColumn).forEach(columns::add);
            } else {
                SensitiveField.fromColumn(column).map(SensitiveField::getColumn).ifPresent(columns::add);
            }
        }
        return columns;
    }
}
