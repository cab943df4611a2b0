package com.recordguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Screening decision over raw result text.
 *
 * <p>When {@code safe} is false a sanitized response is always present and
 * callers must release it instead of any raw text.
 */
@Value
public class SanitizationVerdict {

    public static final String WITHHELD_NOTICE = "[response withheld by output guardrail]";

    boolean safe;
    String reason;
    String sanitizedResponse;
    String originalResponse;

    @Builder(toBuilder = true)
    public SanitizationVerdict(
            boolean safe,
            String reason,
            String sanitizedResponse,
            String originalResponse) {
        this.safe = safe;
        this.reason = reason == null ? "" : reason;
        this.sanitizedResponse = !safe && sanitizedResponse == null ? WITHHELD_NOTICE : sanitizedResponse;
        this.originalResponse = originalResponse;
    }

    public Optional<String> getSanitizedResponse() {
        return Optional.ofNullable(sanitizedResponse);
    }

    public Optional<String> getOriginalResponse() {
        return Optional.ofNullable(originalResponse);
    }

    public static SanitizationVerdict withheld(String reason, String originalResponse) {
        return new SanitizationVerdict(false, reason, WITHHELD_NOTICE, originalResponse);
    }
}
