package com.recordguard.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for one natural-language request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitQueryRequest {

    @NotBlank(message = "Request text is required")
    @Size(max = 2000, message = "Request text must not exceed 2000 characters")
    private String request;
}
