package com.recordguard.application.guardrail;

import com.recordguard.domain.model.AuthorizationVerdict;
import com.recordguard.domain.model.CombinedVerdict;
import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.SafetyVerdict;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Single-pass variant: one oracle call answers both authorization and query
 * safety. The mechanical policies of both stages still apply.
 */
@Component
@RequiredArgsConstructor
public class CombinedGuardrailStage {

    private final TextOracle oracle;
    private final VerdictParser parser;
    private final StageInstructions instructions;
    private final AuthorizationStage authorizationStage;
    private final SafetyVerificationStage safetyStage;

    public CombinedVerdict evaluate(Principal principal, String request) {
        String raw = oracle.complete(instructions.combined(principal), "Query: " + request);
        CombinedVerdict judged = parser.parse(raw, VerdictSchemas.COMBINED);

        AuthorizationVerdict authorization = authorizationStage.enforce(principal, judged.getAuthorization());
        SafetyVerdict safety = authorization.getCandidateQuery()
            .map(query -> safetyStage.enforce(principal, query, judged.getSafety()))
            .orElse(judged.getSafety());
        return new CombinedVerdict(authorization, safety);
    }
}
