package com.example.retrievalservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of checking a download token. {@code reason} is set only when invalid.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenValidation {

    private boolean valid;
    private String reason;
    private DownloadTokenSnapshot token;

    public static TokenValidation valid(DownloadTokenSnapshot token) {
        return new TokenValidation(true, null, token);
    }

    public static TokenValidation invalid(String reason, DownloadTokenSnapshot token) {
        return new TokenValidation(false, reason, token);
    }
}
