package com.recordguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Independent judgement of a candidate query.
 *
 * <p>A suggested query is surfaced to the requester but never executed. A
 * missing reason reads as empty text.
 */
@Value
public class SafetyVerdict {

    boolean safe;
    String reason;
    String suggestedQuery;

    @Builder(toBuilder = true)
    public SafetyVerdict(boolean safe, String reason, String suggestedQuery) {
        this.safe = safe;
        this.reason = reason == null ? "" : reason;
        this.suggestedQuery = suggestedQuery;
    }

    public Optional<String> getSuggestedQuery() {
        return Optional.ofNullable(suggestedQuery);
    }

    public static SafetyVerdict unsafe(String reason) {
        return new SafetyVerdict(false, reason, null);
    }
}
