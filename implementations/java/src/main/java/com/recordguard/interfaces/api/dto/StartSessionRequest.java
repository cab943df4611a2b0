package com.recordguard.interfaces.api.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting a session. Without a principal id any principal
 * in the store is picked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartSessionRequest {

    @Positive(message = "Principal id must be positive")
    private Long principalId;
}
