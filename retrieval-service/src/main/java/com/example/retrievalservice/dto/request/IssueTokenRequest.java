package com.example.retrievalservice.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for issuing a download token. Limits fall back to the configured defaults when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueTokenRequest {

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    private String email;

    @Min(value = 1, message = "maxDownloads must be at least 1")
    @Max(value = 100, message = "maxDownloads must be at most 100")
    private Integer maxDownloads;

    @Min(value = 1, message = "expiryHours must be at least 1")
    @Max(value = 720, message = "expiryHours must be at most 720")
    private Integer expiryHours;
}
