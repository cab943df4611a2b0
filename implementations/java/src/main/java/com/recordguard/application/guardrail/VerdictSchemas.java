package com.recordguard.application.guardrail;

import com.recordguard.domain.model.AuthorizationVerdict;
import com.recordguard.domain.model.CombinedVerdict;
import com.recordguard.domain.model.SafetyVerdict;
import com.recordguard.domain.model.SanitizationVerdict;

import java.util.List;

/**
 * Response layouts of every guardrail stage.
 */
public final class VerdictSchemas {

    public static final String AUTHORIZED = "authorized";
    public static final String REASON = "reason";
    public static final String SENSITIVE_FIELDS = "sensitive_fields";
    public static final String SQL_QUERY = "sql_query";
    public static final String SAFE = "safe";
    public static final String SQL_REASON = "sql_reason";
    public static final String SUGGESTED_QUERY = "suggested_query";
    public static final String SANITIZED_RESPONSE = "sanitized_response";
    public static final String ORIGINAL_RESPONSE = "original_response";

    public static final VerdictSchema<AuthorizationVerdict> AUTHORIZATION = new VerdictSchema<>(
        "authorization",
        List.of(
            FieldSpec.bool(AUTHORIZED),
            FieldSpec.text(REASON),
            FieldSpec.stringSet(SENSITIVE_FIELDS),
            FieldSpec.nullable(SQL_QUERY)),
        VerdictSchemas::authorization,
        verdict -> ParsedFields.builder()
            .flag(AUTHORIZED, verdict.isAuthorized())
            .text(REASON, verdict.getReason())
            .set(SENSITIVE_FIELDS, verdict.getSensitiveFields())
            .nullable(SQL_QUERY, verdict.getCandidateQuery().orElse(null))
            .build());

    public static final VerdictSchema<SafetyVerdict> SAFETY = new VerdictSchema<>(
        "safety",
        List.of(
            FieldSpec.bool(SAFE),
            FieldSpec.text(REASON),
            FieldSpec.nullable(SUGGESTED_QUERY)),
        fields -> safety(fields, REASON),
        verdict -> ParsedFields.builder()
            .flag(SAFE, verdict.isSafe())
            .text(REASON, verdict.getReason())
            .nullable(SUGGESTED_QUERY, verdict.getSuggestedQuery().orElse(null))
            .build());

    public static final VerdictSchema<SanitizationVerdict> SANITIZATION = new VerdictSchema<>(
        "sanitization",
        List.of(
            FieldSpec.bool(SAFE),
            FieldSpec.text(REASON),
            FieldSpec.nullable(SANITIZED_RESPONSE),
            FieldSpec.nullable(ORIGINAL_RESPONSE)),
        fields -> SanitizationVerdict.builder()
            .safe(fields.flag(SAFE))
            .reason(fields.text(REASON))
            .sanitizedResponse(fields.nullable(SANITIZED_RESPONSE))
            .originalResponse(fields.nullable(ORIGINAL_RESPONSE))
            .build(),
        verdict -> ParsedFields.builder()
            .flag(SAFE, verdict.isSafe())
            .text(REASON, verdict.getReason())
            .nullable(SANITIZED_RESPONSE, verdict.getSanitizedResponse().orElse(null))
            .nullable(ORIGINAL_RESPONSE, verdict.getOriginalResponse().orElse(null))
            .build());

    /** Single-pass layout: authorization and query safety in one response. */
    public static final VerdictSchema<CombinedVerdict> COMBINED = new VerdictSchema<>(
        "combined",
        List.of(
            FieldSpec.bool(AUTHORIZED),
            FieldSpec.text(REASON),
            FieldSpec.stringSet(SENSITIVE_FIELDS),
            FieldSpec.nullable(SQL_QUERY),
            FieldSpec.bool(SAFE),
            FieldSpec.text(SQL_REASON),
            FieldSpec.nullable(SUGGESTED_QUERY)),
        fields -> new CombinedVerdict(authorization(fields), safety(fields, SQL_REASON)),
        verdict -> ParsedFields.builder()
            .flag(AUTHORIZED, verdict.getAuthorization().isAuthorized())
            .text(REASON, verdict.getAuthorization().getReason())
            .set(SENSITIVE_FIELDS, verdict.getAuthorization().getSensitiveFields())
            .nullable(SQL_QUERY, verdict.getAuthorization().getCandidateQuery().orElse(null))
            .flag(SAFE, verdict.getSafety().isSafe())
            .text(SQL_REASON, verdict.getSafety().getReason())
            .nullable(SUGGESTED_QUERY, verdict.getSafety().getSuggestedQuery().orElse(null))
            .build());

    private VerdictSchemas() {}

    private static AuthorizationVerdict authorization(ParsedFields fields) {
        return AuthorizationVerdict.builder()
            .authorized(fields.flag(AUTHORIZED))
            .reason(fields.text(REASON))
            .sensitiveFields(fields.set(SENSITIVE_FIELDS))
            .candidateQuery(fields.nullable(SQL_QUERY))
            .build();
    }

    private static SafetyVerdict safety(ParsedFields fields, String reasonField) {
        return SafetyVerdict.builder()
            .safe(fields.flag(SAFE))
            .reason(fields.text(reasonField))
            .suggestedQuery(fields.nullable(SUGGESTED_QUERY))
            .build();
    }
}
