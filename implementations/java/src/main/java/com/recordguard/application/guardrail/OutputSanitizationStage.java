package com.recordguard.application.guardrail;

import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.QueryResult;
import com.recordguard.domain.model.SanitizationVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Screens text before it is released to the requester.
 *
 * <p>The oracle's verdict is backed by the pattern redactor: an approved text
 * the redactor would change becomes unsafe, and an unsafe verdict's sanitized
 * text is redacted again. A sanitized text that still contains the raw text
 * is replaced by the withheld notice.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputSanitizationStage {

    static final String MULTIPLE_RECORDS = "Result spans more than one record";
    static final String PATTERN_REDACTION = "Sensitive values redacted: ";

    private final TextOracle oracle;
    private final VerdictParser parser;
    private final StageInstructions instructions;
    private final SensitiveDataRedactor redactor;

    /**
     * Screen an executed query result. A result spanning more than one record
     * cannot belong to a single principal and is withheld outright.
     */
    public SanitizationVerdict sanitize(Principal principal, QueryResult result) {
        String rendered = result.render();
        if (result.getRowCount() > 1) {
            log.warn("Withholding result of {} rows for principal {}", result.getRowCount(), principal.getId());
            return SanitizationVerdict.withheld(MULTIPLE_RECORDS, rendered);
        }
        return sanitize(principal, rendered);
    }

    public SanitizationVerdict sanitize(Principal principal, String raw) {
        String text = raw == null ? "" : raw;
        String completion = oracle.complete(instructions.sanitization(principal), "Response to verify: " + text);
        SanitizationVerdict judged = parser.parse(completion, VerdictSchemas.SANITIZATION);

        if (judged.isSafe()) {
            SensitiveDataRedactor.Redaction redaction = redactor.redact(text);
            if (redaction.changed()) {
                log.info("Redactor overrode a safe sanitization verdict for principal {}: {}",
                    principal.getId(), redaction.categories());
                return SanitizationVerdict.builder()
                    .safe(false)
                    .reason(PATTERN_REDACTION + String.join(", ", redaction.categories()))
                    .sanitizedResponse(withholdIfVerbatim(redaction.text(), text))
                    .originalResponse(text)
                    .build();
            }
            return SanitizationVerdict.builder()
                .safe(true)
                .reason(judged.getReason())
                .sanitizedResponse(text)
                .originalResponse(text)
                .build();
        }

        String sanitized = redactor.redact(judged.getSanitizedResponse().orElse(SanitizationVerdict.WITHHELD_NOTICE)).text();
        return SanitizationVerdict.builder()
            .safe(false)
            .reason(judged.getReason())
            .sanitizedResponse(withholdIfVerbatim(sanitized, text))
            .originalResponse(text)
            .build();
    }

    private static String withholdIfVerbatim(String sanitized, String raw) {
        return !raw.isEmpty() && sanitized.contains(raw) ? SanitizationVerdict.WITHHELD_NOTICE : sanitized;
    }
}
