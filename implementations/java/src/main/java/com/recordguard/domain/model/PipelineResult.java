package com.recordguard.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Terminal output of one pipeline run, the only thing shown to the requester.
 *
 * <p>{@code message} is the user-visible text: the denial, the blocked-query
 * notice, the sanitized answer or the retry prompt.
 */
@Value
@Builder
public class PipelineResult {

    PipelineState outcome;
    String message;
    String reason;
    @Singular Set<String> sensitiveFields;
    String suggestedQuery;
    boolean sanitized;
    @Singular("transition") List<PipelineState> trail;

    public Optional<String> getSuggestedQuery() {
        return Optional.ofNullable(suggestedQuery);
    }

    public boolean isAnswered() {
        return outcome == PipelineState.RESPONDED;
    }
}
