package com.example.retrievalservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Exception for forbidden access (HTTP 403).
 */
public class ForbiddenException extends BaseException {

    public ForbiddenException(String code, String message) {
        super(code, message, HttpStatus.FORBIDDEN);
    }

    /**
     * Job was submitted by someone else.
     */
    public static ForbiddenException notJobOwner(UUID jobId) {
        return new ForbiddenException(
            "NOT_JOB_OWNER",
            String.format("Job %s does not belong to the requester", jobId)
        );
    }

    /**
     * Token exists but can no longer be used.
     */
    public static ForbiddenException tokenInvalid(String reason) {
        return new ForbiddenException("TOKEN_INVALID", reason);
    }
}
