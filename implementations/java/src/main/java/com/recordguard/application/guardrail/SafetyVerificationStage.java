package com.recordguard.application.guardrail;

import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.SafetyVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Re-judges a candidate query, never the original request.
 *
 * <p>The oracle's opinion can only make a verdict stricter: the scope gate
 * runs after it and a failed gate is always unsafe. Suggested queries that
 * fail the gate themselves are dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SafetyVerificationStage {

    private final TextOracle oracle;
    private final VerdictParser parser;
    private final StageInstructions instructions;
    private final QueryScopeGuard scopeGuard;

    public SafetyVerdict verify(Principal principal, String query) {
        String raw = oracle.complete(instructions.safety(principal), "SQL Query to verify: " + query);
        return enforce(principal, query, parser.parse(raw, VerdictSchemas.SAFETY));
    }

    /**
     * Verdict from the scope gate alone, used when the oracle check is off.
     */
    public SafetyVerdict checkScopeOnly(Principal principal, String query) {
        QueryScopeGuard.ScopeCheck check = scopeGuard.check(query, principal.getId());
        return check.passed()
            ? SafetyVerdict.builder().safe(true).reason("Query passed the scope check").build()
            : SafetyVerdict.unsafe(check.violation());
    }

    public SafetyVerdict enforce(Principal principal, String query, SafetyVerdict judged) {
        String suggestion = judged.getSuggestedQuery()
            .filter(candidate -> scopeGuard.check(candidate, principal.getId()).passed())
            .orElse(null);

        QueryScopeGuard.ScopeCheck check = scopeGuard.check(query, principal.getId());
        if (!check.passed()) {
            if (judged.isSafe()) {
                log.warn("Scope gate overrode a safe oracle verdict for principal {}: {}",
                    principal.getId(), check.violation());
            }
            return SafetyVerdict.builder()
                .safe(false)
                .reason(check.violation())
                .suggestedQuery(suggestion)
                .build();
        }
        return judged.toBuilder().suggestedQuery(suggestion).build();
    }
}
