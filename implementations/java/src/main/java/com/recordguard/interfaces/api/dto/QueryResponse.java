package com.recordguard.interfaces.api.dto;

import com.recordguard.domain.model.PipelineResult;
import com.recordguard.domain.model.PipelineState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Response DTO for one pipeline run. {@code message} is the only text meant
 * for display.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private PipelineState outcome;
    private String message;
    private String reason;
    private Set<String> sensitiveFields;
    private String suggestedQuery;
    private boolean sanitized;
    private List<PipelineState> trail;

    public static QueryResponse from(PipelineResult result) {
        return QueryResponse.builder()
            .outcome(result.getOutcome())
            .message(result.getMessage())
            .reason(result.getReason())
            .sensitiveFields(new TreeSet<>(result.getSensitiveFields()))
            .suggestedQuery(result.getSuggestedQuery().orElse(null))
            .sanitized(result.isSanitized())
            .trail(result.getTrail())
            .build();
    }
}
