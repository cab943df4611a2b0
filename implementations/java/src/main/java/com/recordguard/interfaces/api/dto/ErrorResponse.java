package com.recordguard.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Host-level failure body. Pipeline outcomes never use it; they are
 * {@link QueryResponse}s.
 *
 * <p>{@code errorId} is also written to the server log, so a generic 500 can
 * be traced without exposing details. {@code sessionId} is set when the
 * failure concerns a known session id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private UUID errorId;
    private Instant timestamp;
    private int status;
    private String error;
    private String message;
    private String path;
    private UUID sessionId;
    private List<FieldViolation> validationErrors;

    /**
     * One rejected request field; {@code constraint} is the Jakarta
     * Validation constraint name, e.g. {@code NotBlank}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldViolation {
        private String field;
        private String constraint;
        private String message;
    }
}
