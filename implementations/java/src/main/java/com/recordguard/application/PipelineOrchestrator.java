package com.recordguard.application;

import com.recordguard.application.exceptions.CollaboratorFailureException;
import com.recordguard.application.guardrail.AuthorizationStage;
import com.recordguard.application.guardrail.CombinedGuardrailStage;
import com.recordguard.application.guardrail.OutputSanitizationStage;
import com.recordguard.application.guardrail.SafetyVerificationStage;
import com.recordguard.config.RecordGuardProperties;
import com.recordguard.domain.model.AuthorizationVerdict;
import com.recordguard.domain.model.CombinedVerdict;
import com.recordguard.domain.model.GuardedSession;
import com.recordguard.domain.model.PipelineResult;
import com.recordguard.domain.model.PipelineState;
import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.QueryResult;
import com.recordguard.domain.model.SafetyVerdict;
import com.recordguard.domain.model.SanitizationVerdict;
import com.recordguard.domain.repository.RecordQueryExecutor;
import com.recordguard.infrastructure.audit.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one request through the guardrail pipeline.
 *
 * <p>States per request:
 * <pre>
 *   RECEIVED -> AUTHORIZING -> (DENIED | AUTHORIZED)
 *            -> VERIFYING_SAFETY -> (BLOCKED | VERIFIED) -> EXECUTING -> SANITIZING -> RESPONDED
 *   AUTHORIZED without a candidate query -> ANSWERING_OPENLY -> SANITIZING -> RESPONDED
 * </pre>
 * Any collaborator failure ends the run in {@code ERRORED}. This class is the
 * only producer of requester-visible pipeline messages, and the only writer of
 * {@link com.recordguard.domain.model.SessionState}.
 */
@Service
@Slf4j
public class PipelineOrchestrator {

    public static final String RETRY_PROMPT =
        "Something went wrong while processing your request. Please try again.";
    public static final String DENIED_PREFIX = "Access denied: ";
    public static final String BLOCKED_PREFIX = "Query blocked: ";
    public static final String SUGGESTION_PREFIX = "Suggested query: ";
    static final String NO_QUERY_REASON = "Request cannot be answered from your own record";

    private final AuthorizationStage authorizationStage;
    private final SafetyVerificationStage safetyStage;
    private final CombinedGuardrailStage combinedStage;
    private final OutputSanitizationStage sanitizationStage;
    private final RecordQueryExecutor executor;
    private final OpenAnswerResponder openAnswerResponder;
    private final AuditService auditService;
    private final RecordGuardProperties.Pipeline settings;

    public PipelineOrchestrator(
            AuthorizationStage authorizationStage,
            SafetyVerificationStage safetyStage,
            CombinedGuardrailStage combinedStage,
            OutputSanitizationStage sanitizationStage,
            RecordQueryExecutor executor,
            OpenAnswerResponder openAnswerResponder,
            AuditService auditService,
            RecordGuardProperties properties) {
        this.authorizationStage = authorizationStage;
        this.safetyStage = safetyStage;
        this.combinedStage = combinedStage;
        this.sanitizationStage = sanitizationStage;
        this.executor = executor;
        this.openAnswerResponder = openAnswerResponder;
        this.auditService = auditService;
        this.settings = properties.getPipeline();
        log.info("Guardrail pipeline: mode={}, safetyVerification={}, openAnswer={}",
            settings.getMode(), settings.isSafetyVerificationEnabled(), settings.isOpenAnswerEnabled());
    }

    public PipelineResult handle(GuardedSession session, String request) {
        List<PipelineState> trail = new ArrayList<>();
        trail.add(PipelineState.RECEIVED);
        if (log.isDebugEnabled()) {
            log.debug("Session {} received request: {}", session.getSessionId(), Encode.forJava(request));
        }
        try {
            return run(session, request, trail);
        } catch (CollaboratorFailureException e) {
            log.error("Collaborator {} failed in session {} at {}",
                e.collaborator(), session.getSessionId(), trail.get(trail.size() - 1), e);
            audit(session, "collaborator", "failure", e.collaborator() + ": " + e.getMessage());
            return errored(trail);
        } catch (RuntimeException e) {
            log.error("Pipeline failed in session {} at {}", session.getSessionId(), trail.get(trail.size() - 1), e);
            audit(session, "pipeline", "failure", e.getClass().getSimpleName());
            return errored(trail);
        }
    }

    private PipelineResult run(GuardedSession session, String request, List<PipelineState> trail) {
        Principal principal = session.getPrincipal();

        trail.add(PipelineState.AUTHORIZING);
        AuthorizationVerdict authorization;
        SafetyVerdict combinedSafety = null;
        if (settings.getMode() == PipelineMode.COMBINED) {
            CombinedVerdict combined = combinedStage.evaluate(principal, request);
            authorization = combined.getAuthorization();
            combinedSafety = combined.getSafety();
        } else {
            authorization = authorizationStage.authorize(principal, request);
        }

        if (!authorization.isAuthorized()) {
            trail.add(PipelineState.DENIED);
            audit(session, "authorization", "denied", authorization.getReason());
            return PipelineResult.builder()
                .outcome(PipelineState.DENIED)
                .message(DENIED_PREFIX + authorization.getReason())
                .reason(authorization.getReason())
                .sensitiveFields(authorization.getSensitiveFields())
                .trail(trail)
                .build();
        }
        trail.add(PipelineState.AUTHORIZED);
        if (!authorization.getSensitiveFields().isEmpty()) {
            audit(session, "authorization", "sensitive-fields",
                authorization.getSensitiveFields().stream().sorted().collect(Collectors.joining(",")));
        }

        if (authorization.getCandidateQuery().isEmpty()) {
            if (!settings.isOpenAnswerEnabled()) {
                trail.add(PipelineState.DENIED);
                audit(session, "authorization", "denied", NO_QUERY_REASON);
                return PipelineResult.builder()
                    .outcome(PipelineState.DENIED)
                    .message(DENIED_PREFIX + NO_QUERY_REASON)
                    .reason(NO_QUERY_REASON)
                    .sensitiveFields(authorization.getSensitiveFields())
                    .trail(trail)
                    .build();
            }
            trail.add(PipelineState.ANSWERING_OPENLY);
            String answer = openAnswerResponder.answer(principal, session.getState().exchanges(), request);
            trail.add(PipelineState.SANITIZING);
            return respond(session, request, authorization, sanitizationStage.sanitize(principal, answer), trail);
        }

        String query = authorization.getCandidateQuery().get();
        trail.add(PipelineState.VERIFYING_SAFETY);
        SafetyVerdict safety;
        if (!settings.isSafetyVerificationEnabled()) {
            safety = safetyStage.checkScopeOnly(principal, query);
        } else if (combinedSafety != null) {
            safety = combinedSafety;
        } else {
            safety = safetyStage.verify(principal, query);
        }

        if (!safety.isSafe()) {
            trail.add(PipelineState.BLOCKED);
            audit(session, "safety", "blocked", safety.getReason());
            String message = BLOCKED_PREFIX + safety.getReason()
                + safety.getSuggestedQuery().map(s -> "\n" + SUGGESTION_PREFIX + s).orElse("");
            return PipelineResult.builder()
                .outcome(PipelineState.BLOCKED)
                .message(message)
                .reason(safety.getReason())
                .suggestedQuery(safety.getSuggestedQuery().orElse(null))
                .sensitiveFields(authorization.getSensitiveFields())
                .trail(trail)
                .build();
        }
        trail.add(PipelineState.VERIFIED);

        trail.add(PipelineState.EXECUTING);
        QueryResult result = executor.execute(query);

        trail.add(PipelineState.SANITIZING);
        return respond(session, request, authorization, sanitizationStage.sanitize(principal, result), trail);
    }

    private PipelineResult respond(
            GuardedSession session,
            String request,
            AuthorizationVerdict authorization,
            SanitizationVerdict verdict,
            List<PipelineState> trail) {
        String released = verdict.getSanitizedResponse().orElse(SanitizationVerdict.WITHHELD_NOTICE);
        if (!verdict.isSafe()) {
            audit(session, "sanitization", "redacted", verdict.getReason());
        }
        trail.add(PipelineState.RESPONDED);
        session.getState().append(request, released);
        return PipelineResult.builder()
            .outcome(PipelineState.RESPONDED)
            .message(released)
            .reason(verdict.getReason())
            .sanitized(!verdict.isSafe())
            .sensitiveFields(authorization.getSensitiveFields())
            .trail(trail)
            .build();
    }

    private PipelineResult errored(List<PipelineState> trail) {
        trail.add(PipelineState.ERRORED);
        return PipelineResult.builder()
            .outcome(PipelineState.ERRORED)
            .message(RETRY_PROMPT)
            .trail(trail)
            .build();
    }

    private void audit(GuardedSession session, String category, String action, String detail) {
        auditService.record(category, action, session.getSessionId().toString(),
            Long.toString(session.getPrincipal().getId()), detail);
    }
}
